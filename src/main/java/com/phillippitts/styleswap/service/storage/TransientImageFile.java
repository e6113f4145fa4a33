package com.phillippitts.styleswap.service.storage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owning handle to a temporary PNG produced by a style transfer.
 *
 * <p>The file lives until {@link #close()} is called. Use it in try-with-resources so the file is
 * removed even if the caller fails after receiving it:
 * <pre>{@code
 * try (TransientImageFile result = orchestrator.transferStyle(content, style)) {
 *     byte[] png = Files.readAllBytes(result.path());
 * }
 * }</pre>
 *
 * <p>{@code close()} is idempotent and thread-safe.
 */
public final class TransientImageFile implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TransientImageFile.class);

    private final Path path;
    private final int width;
    private final int height;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TransientImageFile(Path path, int width, int height) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.width = width;
        this.height = height;
    }

    public Path path() {
        return path;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Deletes the underlying file. A failed delete is logged, not thrown.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete transient image {}: {}", path, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "TransientImageFile{" + path + ", " + width + "x" + height + (isClosed() ? ", closed" : "") + '}';
    }
}
