package com.phillippitts.styleswap.service.health;

import com.phillippitts.styleswap.service.model.AbstractOnnxNetwork;
import com.phillippitts.styleswap.service.model.FeatureExtractor;
import com.phillippitts.styleswap.service.model.InverseNetwork;
import com.phillippitts.styleswap.service.model.NetworkAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for the two network models.
 *
 * <p>UP when both model files are present. Session state is reported as a detail only: an
 * adapter that is not loaded yet is not a failure, because the transfer service loads sessions
 * on first use.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final FeatureExtractor extractor;
    private final InverseNetwork inverse;

    public ModelHealthIndicator(FeatureExtractor extractor, InverseNetwork inverse) {
        this.extractor = extractor;
        this.inverse = inverse;
    }

    @Override
    public Health health() {
        Path extractorPath = modelPathOf(extractor);
        Path inversePath = modelPathOf(inverse);
        boolean extractorFile = extractorPath == null || Files.isRegularFile(extractorPath);
        boolean inverseFile = inversePath == null || Files.isRegularFile(inversePath);

        Health.Builder builder = (extractorFile && inverseFile) ? Health.up() : Health.down();
        return builder
                .withDetail("extractorModel", formatStatus(extractorFile, extractorPath))
                .withDetail("inverseModel", formatStatus(inverseFile, inversePath))
                .withDetail("extractorSession", extractor.isHealthy() ? "loaded" : "not loaded")
                .withDetail("inverseSession", inverse.isHealthy() ? "loaded" : "not loaded")
                .build();
    }

    private static Path modelPathOf(NetworkAdapter adapter) {
        if (adapter instanceof AbstractOnnxNetwork onnx) {
            return Paths.get(onnx.getModelPath());
        }
        return null;
    }

    private static String formatStatus(boolean exists, Path path) {
        if (path == null) {
            return "in-memory";
        }
        return exists ? "accessible at " + path : "NOT FOUND at " + path;
    }
}
