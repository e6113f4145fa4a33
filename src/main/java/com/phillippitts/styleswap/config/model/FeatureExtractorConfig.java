package com.phillippitts.styleswap.config.model;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the feature extractor network (a VGG-19 truncated after relu3_1, exported to ONNX).
 * Binds to properties prefixed with "model.extractor".
 *
 * <p>Example application.properties:
 * <pre>
 * model.extractor.model-path=models/vgg19-relu3_1.onnx
 * model.extractor.input-name=image
 * model.extractor.output-name=features
 * </pre>
 *
 * @param modelPath  path to the ONNX graph (must exist when validation is enabled)
 * @param inputName  graph input receiving a {@code 1 × 3 × H × W} normalized image
 * @param outputName graph output holding the {@code 1 × C × H' × W'} feature map
 */
@ConfigurationProperties(prefix = "model.extractor")
@Validated
public record FeatureExtractorConfig(
        @NotBlank(message = "Extractor model path must not be blank")
        @DefaultValue("models/vgg19-relu3_1.onnx")
        String modelPath,

        @NotBlank(message = "Extractor input name must not be blank")
        @DefaultValue("image")
        String inputName,

        @NotBlank(message = "Extractor output name must not be blank")
        @DefaultValue("features")
        String outputName
) {
}
