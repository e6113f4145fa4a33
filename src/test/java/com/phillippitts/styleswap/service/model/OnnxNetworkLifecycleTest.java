package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.config.model.FeatureExtractorConfig;
import com.phillippitts.styleswap.config.model.InverseNetworkConfig;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OnnxNetworkLifecycleTest {

    @TempDir
    Path tempDir;

    @Test
    void forwardBeforeInitializeFails() {
        OnnxFeatureExtractor extractor = extractorAt(tempDir.resolve("vgg.onnx").toString());

        assertThatThrownBy(() -> extractor.forward(new FeatureMap(3, 4, 4)))
                .isInstanceOf(ExternalModelException.class)
                .hasMessageContaining("not initialized")
                .satisfies(ex -> assertThat(((ExternalModelException) ex).getNetworkName())
                        .isEqualTo(NetworkNames.EXTRACTOR));
        assertThat(extractor.isHealthy()).isFalse();
    }

    @Test
    void initializeWithCorruptGraphFailsAndStaysUnhealthy() throws IOException {
        Path garbage = tempDir.resolve("garbage.onnx");
        Files.write(garbage, new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        OnnxInverseNetwork inverse = new OnnxInverseNetwork(
                new InverseNetworkConfig(garbage.toString(), "features", "image"));

        assertThatThrownBy(inverse::initialize)
                .isInstanceOf(ExternalModelException.class)
                .hasMessageContaining("Failed to initialize inverse network");
        assertThat(inverse.isHealthy()).isFalse();
    }

    @Test
    void closeIsIdempotent() {
        OnnxFeatureExtractor extractor = extractorAt(tempDir.resolve("vgg.onnx").toString());

        assertThatCode(() -> {
            extractor.close();
            extractor.close();
        }).doesNotThrowAnyException();
        assertThat(extractor.isHealthy()).isFalse();
    }

    @Test
    void exposesConfiguredModelPath() {
        assertThat(extractorAt("models/vgg19-relu3_1.onnx").getModelPath()).isEqualTo("models/vgg19-relu3_1.onnx");
    }

    /**
     * Runs against a real exported graph: {@code -Dstyleswap.extractor.model=/path/to/vgg.onnx}.
     */
    @Test
    @EnabledIfSystemProperty(named = "styleswap.extractor.model", matches = ".+")
    void realExtractorProducesQuarterResolutionMap() {
        OnnxFeatureExtractor extractor = extractorAt(System.getProperty("styleswap.extractor.model"));
        try {
            extractor.initialize();
            FeatureMap features = extractor.forward(new FeatureMap(3, 64, 64));

            assertThat(features.height()).isEqualTo(16);
            assertThat(features.width()).isEqualTo(16);
            assertThat(extractor.isHealthy()).isTrue();
        } finally {
            extractor.close();
        }
    }

    private static OnnxFeatureExtractor extractorAt(String path) {
        return new OnnxFeatureExtractor(new FeatureExtractorConfig(path, "image", "features"));
    }
}
