package com.phillippitts.styleswap.config.orchestration;

import com.phillippitts.styleswap.service.image.ImageCodec;
import com.phillippitts.styleswap.service.image.ImageSizeNormalizer;
import com.phillippitts.styleswap.service.model.FeatureExtractor;
import com.phillippitts.styleswap.service.model.InverseNetwork;
import com.phillippitts.styleswap.service.orchestration.DefaultStyleTransferOrchestrator;
import com.phillippitts.styleswap.service.orchestration.StyleTransferOrchestrator;
import com.phillippitts.styleswap.service.patchswap.PatchSwapEngine;
import com.phillippitts.styleswap.service.postprocess.PixelPostProcessor;
import com.phillippitts.styleswap.service.storage.TransientFileStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the style transfer pipeline explicitly so the orchestrator itself stays free of
 * Spring annotations and can be built by hand in tests.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public StyleTransferOrchestrator styleTransferOrchestrator(ImageCodec codec,
                                                               ImageSizeNormalizer sizeNormalizer,
                                                               FeatureExtractor extractor,
                                                               InverseNetwork inverse,
                                                               PatchSwapEngine patchSwap,
                                                               PixelPostProcessor postProcessor,
                                                               TransientFileStore fileStore) {
        return new DefaultStyleTransferOrchestrator(codec, sizeNormalizer, extractor, inverse,
                patchSwap, postProcessor, fileStore);
    }
}
