package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;

/**
 * Decoder from a feature map back to a normalized RGB tensor.
 *
 * <p>Implementations must be deterministic and side-effect free.
 */
public interface InverseNetwork extends NetworkAdapter {

    /**
     * @param features feature map {@code C × H' × W'}
     * @return {@code 3 × H × W} pixel tensor in normalized image space
     * @throws ExternalModelException if the forward pass fails or does not yield 3 channels
     */
    FeatureMap forward(FeatureMap features);
}
