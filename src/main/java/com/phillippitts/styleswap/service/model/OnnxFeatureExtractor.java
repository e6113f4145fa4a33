package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.config.model.FeatureExtractorConfig;
import com.phillippitts.styleswap.domain.FeatureMap;
import org.springframework.stereotype.Component;

/**
 * Feature extractor backed by an ONNX export of VGG-19 truncated after relu3_1.
 *
 * <p>Input is the ImageNet-normalized RGB tensor, output is a 256-channel map at a quarter of
 * the input resolution (the exact depth is whatever the exported graph yields).
 */
@Component
public class OnnxFeatureExtractor extends AbstractOnnxNetwork implements FeatureExtractor {

    public OnnxFeatureExtractor(FeatureExtractorConfig config) {
        super(config.modelPath(), config.inputName(), config.outputName());
    }

    @Override
    public FeatureMap forward(FeatureMap normalizedImage) {
        return runForward(normalizedImage);
    }

    @Override
    public String getNetworkName() {
        return NetworkNames.EXTRACTOR;
    }
}
