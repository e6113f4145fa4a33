package com.phillippitts.styleswap.service.orchestration;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;
import com.phillippitts.styleswap.exception.ExternalModelExceptionBuilder;
import com.phillippitts.styleswap.exception.StyleSwapException;
import com.phillippitts.styleswap.service.image.ImageCodec;
import com.phillippitts.styleswap.service.image.ImageSizeNormalizer;
import com.phillippitts.styleswap.service.image.ImageTensors;
import com.phillippitts.styleswap.service.model.FeatureExtractor;
import com.phillippitts.styleswap.service.model.InverseNetwork;
import com.phillippitts.styleswap.service.model.NetworkAdapter;
import com.phillippitts.styleswap.service.patchswap.PatchSwapEngine;
import com.phillippitts.styleswap.service.postprocess.PixelPostProcessor;
import com.phillippitts.styleswap.service.storage.TransientFileStore;
import com.phillippitts.styleswap.service.storage.TransientImageFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Default implementation of {@link StyleTransferOrchestrator}.
 *
 * <p>Pipeline: load, bound sizes, normalize, extract features of both images, swap every
 * content patch for its best style patch, invert back to pixels, denormalize, match colours
 * against the raw style image, restore the original content size and write a PNG.
 *
 * <p>Nothing is written until the very last step, so a failure at any point leaves no file.
 * Runtime failures inside a network adapter that are not already domain exceptions are
 * reported as {@link ExternalModelException}.
 *
 * @since 1.0
 */
public class DefaultStyleTransferOrchestrator implements StyleTransferOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultStyleTransferOrchestrator.class);

    private final ImageCodec codec;
    private final ImageSizeNormalizer sizeNormalizer;
    private final FeatureExtractor extractor;
    private final InverseNetwork inverse;
    private final PatchSwapEngine patchSwap;
    private final PixelPostProcessor postProcessor;
    private final TransientFileStore fileStore;

    /**
     * @throws NullPointerException if any collaborator is null
     */
    public DefaultStyleTransferOrchestrator(ImageCodec codec,
                                            ImageSizeNormalizer sizeNormalizer,
                                            FeatureExtractor extractor,
                                            InverseNetwork inverse,
                                            PatchSwapEngine patchSwap,
                                            PixelPostProcessor postProcessor,
                                            TransientFileStore fileStore) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.sizeNormalizer = Objects.requireNonNull(sizeNormalizer, "sizeNormalizer must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.inverse = Objects.requireNonNull(inverse, "inverse must not be null");
        this.patchSwap = Objects.requireNonNull(patchSwap, "patchSwap must not be null");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor must not be null");
        this.fileStore = Objects.requireNonNull(fileStore, "fileStore must not be null");
    }

    @Override
    public TransientImageFile transferStyle(Path contentPath, Path stylePath) {
        Objects.requireNonNull(contentPath, "contentPath must not be null");
        Objects.requireNonNull(stylePath, "stylePath must not be null");
        long startTime = System.nanoTime();

        BufferedImage rawContent = codec.read(contentPath);
        BufferedImage rawStyle = codec.read(stylePath);
        int originalWidth = rawContent.getWidth();
        int originalHeight = rawContent.getHeight();

        BufferedImage content = sizeNormalizer.normalize(rawContent);
        BufferedImage style = sizeNormalizer.normalize(rawStyle);
        LOG.debug("Working sizes: content {}x{} (from {}x{}), style {}x{} (from {}x{})",
                content.getWidth(), content.getHeight(), originalWidth, originalHeight,
                style.getWidth(), style.getHeight(), rawStyle.getWidth(), rawStyle.getHeight());

        FeatureMap contentFeatures = forward(extractor, extractor::forward, ImageTensors.toNormalizedTensor(content));
        FeatureMap styleFeatures = forward(extractor, extractor::forward, ImageTensors.toNormalizedTensor(style));

        FeatureMap swapped = patchSwap.swap(contentFeatures, styleFeatures);
        FeatureMap pixels = forward(inverse, inverse::forward, swapped);

        FeatureMap matched = postProcessor.colorMatch(postProcessor.denormalize(pixels), rawStyle);
        BufferedImage result = sizeNormalizer.restoreOriginalSize(
                postProcessor.toImage(matched), originalWidth, originalHeight);

        TransientImageFile file = fileStore.writePng(result);
        LOG.info("Style transfer produced {}x{} image in {} ms",
                file.width(), file.height(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return file;
    }

    private static FeatureMap forward(NetworkAdapter network, UnaryOperator<FeatureMap> pass, FeatureMap input) {
        long startTime = System.nanoTime();
        FeatureMap output;
        try {
            output = pass.apply(input);
        } catch (StyleSwapException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ExternalModelExceptionBuilder.create("Forward pass failed")
                    .network(network.getNetworkName())
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime))
                    .cause(e)
                    .build();
        }
        if (output == null) {
            throw new ExternalModelException("Forward pass returned no output", network.getNetworkName());
        }
        LOG.debug("{} forward {} -> {} in {} ms", network.getNetworkName(), input.shape(), output.shape(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return output;
    }
}
