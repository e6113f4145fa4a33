package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.config.model.InverseNetworkConfig;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;
import org.springframework.stereotype.Component;

/**
 * Inverse network backed by an ONNX export of the decoder trained to invert relu3_1 features.
 */
@Component
public class OnnxInverseNetwork extends AbstractOnnxNetwork implements InverseNetwork {

    private static final int RGB_CHANNELS = 3;

    public OnnxInverseNetwork(InverseNetworkConfig config) {
        super(config.modelPath(), config.inputName(), config.outputName());
    }

    @Override
    public FeatureMap forward(FeatureMap features) {
        FeatureMap pixels = runForward(features);
        if (pixels.channels() != RGB_CHANNELS) {
            throw new ExternalModelException("Expected " + RGB_CHANNELS + " output channels, got "
                    + pixels.shape(), getNetworkName());
        }
        return pixels;
    }

    @Override
    public String getNetworkName() {
        return NetworkNames.INVERSE;
    }
}
