package com.phillippitts.styleswap.config.model;

import com.phillippitts.styleswap.exception.ModelNotFoundException;
import com.phillippitts.styleswap.service.model.FeatureExtractor;
import com.phillippitts.styleswap.service.model.InverseNetwork;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validates the network model files at startup and loads both sessions.
 *
 * Fail-fast philosophy: abort application startup with clear, actionable errors
 * if a model is missing or obviously invalid.
 *
 * Validation performed:
 * - each model file exists, is a regular file and is at least
 *   {@link ModelConstants#MIN_MODEL_SIZE_BYTES} large
 * - both ONNX sessions can be created
 */
@Component
@ConditionalOnProperty(name = "model.validation.enabled", havingValue = "true", matchIfMissing = true)
class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private static final long BYTES_PER_MB = 1024 * 1024;

    private final FeatureExtractorConfig extractorConfig;
    private final InverseNetworkConfig inverseConfig;
    private final FeatureExtractor extractor;
    private final InverseNetwork inverse;

    ModelValidationService(FeatureExtractorConfig extractorConfig,
                           InverseNetworkConfig inverseConfig,
                           FeatureExtractor extractor,
                           InverseNetwork inverse) {
        this.extractorConfig = extractorConfig;
        this.inverseConfig = inverseConfig;
        this.extractor = extractor;
        this.inverse = inverse;
    }

    @PostConstruct
    void validateAllOnStartup() {
        LOG.info("Validating network models... os={}, arch={}",
            System.getProperty("os.name"), System.getProperty("os.arch"));

        validateModelFile(extractorConfig.modelPath(), "Extractor model");
        validateModelFile(inverseConfig.modelPath(), "Inverse model");

        extractor.initialize();
        inverse.initialize();

        LOG.info("Model validation complete: extractor.model='{}', inverse.model='{}'",
            extractorConfig.modelPath(), inverseConfig.modelPath());
    }

    // Visible for tests
    Path validateModelFile(String configuredPath, String description) {
        Path model = resolve(configuredPath, description);
        if (!Files.exists(model)) {
            throw new ModelNotFoundException(model.toString());
        }
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(description + " is not a regular file: " + model);
        }
        try {
            long sizeBytes = Files.size(model);
            if (sizeBytes < ModelConstants.MIN_MODEL_SIZE_BYTES) {
                throw new ModelNotFoundException(description + " too small (" + sizeBytes + " bytes) at: " + model);
            }
            LOG.info("{} size: {} MB", description, sizeBytes / BYTES_PER_MB);
        } catch (IOException e) {
            throw new ModelNotFoundException("Failed to read " + description + " metadata at: " + model, e);
        }
        return model;
    }

    private Path resolve(String pathString, String description) {
        Path path = Paths.get(pathString);
        if (!path.isAbsolute()) {
            Path resolved = Paths.get(".").toAbsolutePath().normalize().resolve(path).normalize();
            LOG.warn("{} uses relative path '{}' - resolved to '{}'. " +
                    "Consider using absolute paths in production to avoid ambiguity.",
                    description, pathString, resolved);
            return resolved;
        }
        return path;
    }
}
