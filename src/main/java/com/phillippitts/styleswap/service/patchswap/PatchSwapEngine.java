package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.Assignment;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Style swap in feature space: replaces every content patch with its best-correlated style patch
 * and blends the overlaps.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class PatchSwapEngine {

    private final PatchExtractor extractor;
    private final CorrelationMatcher matcher;
    private final PatchAssembler assembler;

    public PatchSwapEngine(PatchExtractor extractor, CorrelationMatcher matcher, PatchAssembler assembler) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
    }

    /**
     * Synthesizes a feature map with the content's layout and the style's local statistics.
     *
     * @param content content feature map ({@code C × Hc × Wc})
     * @param style   style feature map ({@code C × Hs × Ws})
     * @return swapped feature map with the content's shape
     * @throws ShapeMismatchException if channel counts differ or either map is smaller than a patch
     */
    public FeatureMap swap(FeatureMap content, FeatureMap style) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(style, "style must not be null");
        if (content.channels() != style.channels()) {
            throw new ShapeMismatchException("Content features have " + content.channels()
                    + " channels, style features have " + style.channels());
        }

        int s = PatchSwapConstants.PATCH_SIZE;
        PatchSet stylePatches = extractor.extractPatches(style, s);
        PatchSet kernels = extractor.normalize(stylePatches);
        Assignment assignment = matcher.match(content, kernels);
        return assembler.reconstruct(assignment, stylePatches);
    }
}
