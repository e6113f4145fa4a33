package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;

/**
 * Encoder from a normalized RGB tensor to a feature map.
 *
 * <p>Implementations must be deterministic and side-effect free, and always produce the same
 * channel depth.
 */
public interface FeatureExtractor extends NetworkAdapter {

    /**
     * @param normalizedImage {@code 3 × H × W} tensor, per-channel mean/std normalized
     * @return feature map {@code C × H' × W'}
     * @throws ExternalModelException if the forward pass fails
     */
    FeatureMap forward(FeatureMap normalizedImage);
}
