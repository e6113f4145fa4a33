package com.phillippitts.styleswap.service.storage;

import com.phillippitts.styleswap.config.properties.OutputStorageProperties;
import com.phillippitts.styleswap.exception.ResourceException;
import com.phillippitts.styleswap.service.image.ImageCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Creates temporary files for transfer inputs and results.
 *
 * <p>Files go to {@code transfer.output.temp-dir}, or the system temp directory when that is blank.
 * A failed write never leaves a partial file behind.
 */
@Component
public class TransientFileStore {

    private static final Logger LOG = LogManager.getLogger(TransientFileStore.class);

    private final OutputStorageProperties properties;
    private final ImageCodec codec;

    public TransientFileStore(OutputStorageProperties properties, ImageCodec codec) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Writes the image as a new temporary PNG.
     *
     * @return owning handle; the caller must close it
     * @throws ResourceException if the file cannot be created or written
     */
    public TransientImageFile writePng(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        Path file = createTempFile(".png");
        try (OutputStream out = Files.newOutputStream(file)) {
            codec.writePng(image, out);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(file);
            throw new ResourceException("Failed to write result image", e);
        }
        LOG.debug("Wrote {}x{} result to {}", image.getWidth(), image.getHeight(), file);
        return new TransientImageFile(file, image.getWidth(), image.getHeight());
    }

    /**
     * Copies an upload stream into a new temporary file.
     *
     * @return path of the new file; the caller must delete it
     * @throws ResourceException if the file cannot be created or written
     */
    public Path store(InputStream in, String suffix) {
        Objects.requireNonNull(in, "in must not be null");
        Path file = createTempFile(suffix);
        try {
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(file);
            throw new ResourceException("Failed to store upload", e);
        }
        return file;
    }

    /**
     * Deletes a file created by {@link #store}; failures are logged.
     */
    public void delete(Path file) {
        if (file != null) {
            deleteQuietly(file);
        }
    }

    private Path createTempFile(String suffix) {
        try {
            String tempDir = properties.getTempDir();
            if (tempDir == null || tempDir.isBlank()) {
                return Files.createTempFile(properties.getFilePrefix(), suffix);
            }
            Path dir = Paths.get(tempDir);
            Files.createDirectories(dir);
            return Files.createTempFile(dir, properties.getFilePrefix(), suffix);
        } catch (IOException | IllegalArgumentException e) {
            throw new ResourceException("Failed to create temporary file", e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
