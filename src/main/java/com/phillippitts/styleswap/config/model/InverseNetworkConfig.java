package com.phillippitts.styleswap.config.model;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the inverse network that decodes a feature map back to pixels.
 * Binds to properties prefixed with "model.inverse".
 *
 * @param modelPath  path to the ONNX graph (must exist when validation is enabled)
 * @param inputName  graph input receiving a {@code 1 × C × H' × W'} feature map
 * @param outputName graph output holding the {@code 1 × 3 × H × W} normalized image
 */
@ConfigurationProperties(prefix = "model.inverse")
@Validated
public record InverseNetworkConfig(
        @NotBlank(message = "Inverse network model path must not be blank")
        @DefaultValue("models/invnet-relu3_1.onnx")
        String modelPath,

        @NotBlank(message = "Inverse network input name must not be blank")
        @DefaultValue("features")
        String inputName,

        @NotBlank(message = "Inverse network output name must not be blank")
        @DefaultValue("image")
        String outputName
) {
}
