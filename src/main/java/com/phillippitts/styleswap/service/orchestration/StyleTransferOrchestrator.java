package com.phillippitts.styleswap.service.orchestration;

import com.phillippitts.styleswap.service.storage.TransientImageFile;

import java.nio.file.Path;

/**
 * Runs one patch-swap style transfer from two image files to a result file.
 *
 * <p>The pipeline is synchronous and keeps no state between calls. It has no internal timeout,
 * retry or concurrency control; callers bound and serialize invocations themselves (see
 * {@link com.phillippitts.styleswap.service.transfer.StyleTransferService}).
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * try (TransientImageFile result = orchestrator.transferStyle(contentPath, stylePath)) {
 *     upload(result.path());
 * } // result file deleted here
 * }</pre>
 *
 * @since 1.0
 */
public interface StyleTransferOrchestrator {

    /**
     * Renders the content image in the texture of the style image.
     *
     * <p>The result has the content image's dimensions when the content was below the minimum
     * size bound; otherwise it has the bounded working size.
     *
     * @param contentPath image providing structure
     * @param stylePath   image providing texture and colours
     * @return owning handle to a temporary PNG; the caller must close it
     * @throws com.phillippitts.styleswap.exception.ImageDecodeException   if either file cannot be decoded
     * @throws com.phillippitts.styleswap.exception.ShapeMismatchException if the feature maps disagree in depth
     * @throws com.phillippitts.styleswap.exception.ExternalModelException if a network forward pass fails
     * @throws com.phillippitts.styleswap.exception.ResourceException      if the result cannot be written
     */
    TransientImageFile transferStyle(Path contentPath, Path stylePath);
}
