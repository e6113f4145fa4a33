package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PatchExtractorTest {

    private final PatchExtractor extractor = new PatchExtractor();

    @Test
    void shouldEnumerateAllUnitStridePatches() {
        PatchSet patches = extractor.extractPatches(PatchSwapFixtures.sequential(2, 4, 5), 3);

        assertThat(patches.count()).isEqualTo(2 * 3);
        assertThat(patches.rows()).isEqualTo(2);
        assertThat(patches.cols()).isEqualTo(3);
        assertThat(patches.patchLength()).isEqualTo(2 * 9);
    }

    @Test
    void shouldUseRowMajorOriginOrder() {
        FeatureMap map = PatchSwapFixtures.sequential(2, 4, 5);

        PatchSet patches = extractor.extractPatches(map, 3);

        int k = 4; // origin (1, 1)
        assertThat(patches.originRow(k)).isEqualTo(1);
        assertThat(patches.originCol(k)).isEqualTo(1);
        for (int c = 0; c < 2; c++) {
            for (int dy = 0; dy < 3; dy++) {
                for (int dx = 0; dx < 3; dx++) {
                    assertThat(patches.get(k, c, dy, dx)).isEqualTo(map.get(c, 1 + dy, 1 + dx));
                }
            }
        }
    }

    @Test
    void shouldYieldSinglePatchForPatchSizedMap() {
        PatchSet patches = extractor.extractPatches(PatchSwapFixtures.sequential(4, 3, 3), 3);

        assertThat(patches.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectMapSmallerThanPatch() {
        FeatureMap tooNarrow = new FeatureMap(1, 5, 2);

        assertThatThrownBy(() -> extractor.extractPatches(tooNarrow, 3))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("1x5x2");
    }

    @Test
    void normalizeShouldProduceUnitNormPatches() {
        PatchSet patches = extractor.extractPatches(PatchSwapFixtures.random(3, 6, 6, 7L), 3);

        PatchSet normalized = extractor.normalize(patches);

        for (int k = 0; k < normalized.count(); k++) {
            double sum = 0;
            for (int i = normalized.offset(k); i < normalized.offset(k) + normalized.patchLength(); i++) {
                sum += normalized.data()[i] * normalized.data()[i];
            }
            assertThat(Math.sqrt(sum)).isCloseTo(1.0, within(1e-5));
        }
    }

    @Test
    void normalizeShouldNotModifyRawPatches() {
        PatchSet patches = extractor.extractPatches(PatchSwapFixtures.constant(1, 3, 3, 2f), 3);

        PatchSet normalized = extractor.normalize(patches);

        assertThat(patches.get(0, 0, 0, 0)).isEqualTo(2f);
        assertThat(normalized.get(0, 0, 0, 0)).isCloseTo(1f / 3f, within(1e-6f));
    }

    @Test
    void normalizeShouldKeepZeroPatchAtZero() {
        PatchSet patches = extractor.extractPatches(new FeatureMap(2, 3, 3), 3);

        PatchSet normalized = extractor.normalize(patches);

        assertThat(normalized.data()).containsOnly(0f);
    }
}
