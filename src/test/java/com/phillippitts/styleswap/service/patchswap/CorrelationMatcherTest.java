package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.Assignment;
import com.phillippitts.styleswap.domain.CorrelationVolume;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CorrelationMatcherTest {

    private final PatchExtractor extractor = new PatchExtractor();
    private final CorrelationMatcher matcher = new CorrelationMatcher();

    @Test
    void volumeShouldHaveOneSlicePerPatch() {
        FeatureMap content = PatchSwapFixtures.random(2, 6, 7, 1L);
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(2, 5, 5, 2L), 3));

        CorrelationVolume volume = matcher.computeCorrelation(content, kernels);

        assertThat(volume.numPatches()).isEqualTo(9);
        assertThat(volume.rows()).isEqualTo(4);
        assertThat(volume.cols()).isEqualTo(5);
    }

    @Test
    void volumeShouldHoldWindowDotProducts() {
        FeatureMap content = PatchSwapFixtures.random(2, 5, 5, 3L);
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(2, 4, 4, 4L), 3));

        CorrelationVolume volume = matcher.computeCorrelation(content, kernels);

        int k = 3;
        int i = 1;
        int j = 2;
        double expected = 0;
        for (int c = 0; c < 2; c++) {
            for (int dy = 0; dy < 3; dy++) {
                for (int dx = 0; dx < 3; dx++) {
                    expected += content.get(c, i + dy, j + dx) * kernels.get(k, c, dy, dx);
                }
            }
        }
        assertThat((double) volume.get(k, i, j)).isCloseTo(expected, within(1e-4));
    }

    @Test
    void tiesShouldResolveToLowestPatchIndex() {
        // Uniform style map: every patch is identical, so every correlation ties
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.constant(1, 5, 5, 1f), 3));
        FeatureMap content = PatchSwapFixtures.random(1, 6, 6, 5L);

        Assignment viaVolume = matcher.selectBestMatch(matcher.computeCorrelation(content, kernels));
        Assignment fused = matcher.match(content, kernels);

        assertThat(viaVolume.patchIndices()).containsOnly(0);
        assertThat(fused.patchIndices()).containsOnly(0);
    }

    @Test
    void fusedMatchShouldAgreeWithVolumeArgmax() {
        FeatureMap content = PatchSwapFixtures.random(4, 9, 8, 11L);
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(4, 7, 10, 12L), 3));

        Assignment viaVolume = matcher.selectBestMatch(matcher.computeCorrelation(content, kernels));
        Assignment fused = matcher.match(content, kernels);

        assertThat(fused.patchIndices()).containsExactly(viaVolume.patchIndices());
        assertThat(fused.score(3, 4)).isEqualTo(viaVolume.score(3, 4));
    }

    @Test
    void identicalContentAndStyleShouldMatchEveryPatchToItself() {
        FeatureMap map = PatchSwapFixtures.random(3, 7, 9, 21L);
        PatchSet raw = extractor.extractPatches(map, 3);
        PatchSet kernels = extractor.normalize(raw);

        Assignment assignment = matcher.match(map, kernels);

        for (int i = 0; i < assignment.rows(); i++) {
            for (int j = 0; j < assignment.cols(); j++) {
                int k = assignment.patchIndex(i, j);
                assertThat(k).isEqualTo(raw.indexOf(i, j));
                // score is the window norm, so the normalized correlation is 1
                assertThat((double) assignment.score(i, j) / norm(raw, k)).isCloseTo(1.0, within(1e-4));
            }
        }
    }

    @Test
    void onePatchStyleShouldCorrelateEquallyForUniformContent() {
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(2, 3, 3, 8L), 3));
        FeatureMap content = PatchSwapFixtures.constant(2, 6, 6, 0.5f);

        CorrelationVolume volume = matcher.computeCorrelation(content, kernels);
        Assignment assignment = matcher.selectBestMatch(volume);

        assertThat(volume.numPatches()).isEqualTo(1);
        assertThat(assignment.patchIndices()).containsOnly(0);
        float first = assignment.score(0, 0);
        for (int i = 0; i < assignment.rows(); i++) {
            for (int j = 0; j < assignment.cols(); j++) {
                assertThat(assignment.score(i, j)).isEqualTo(first);
            }
        }
    }

    @Test
    void matchShouldPickBestWindowDotProductWhenPatchCountIsNotBlockAligned() {
        FeatureMap content = PatchSwapFixtures.random(3, 8, 9, 31L);
        // 3 x 5 = 15 patches: three full blocks of four plus a remainder of three
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(3, 5, 7, 32L), 3));
        assertThat(kernels.count()).isEqualTo(15);

        Assignment assignment = matcher.match(content, kernels);

        for (int i = 0; i < assignment.rows(); i++) {
            for (int j = 0; j < assignment.cols(); j++) {
                double best = Double.NEGATIVE_INFINITY;
                for (int k = 0; k < kernels.count(); k++) {
                    best = Math.max(best, windowDot(content, kernels, k, i, j));
                }
                int chosen = assignment.patchIndex(i, j);
                assertThat(windowDot(content, kernels, chosen, i, j)).isCloseTo(best, within(1e-4));
                assertThat((double) assignment.score(i, j)).isCloseTo(best, within(1e-4));
            }
        }
    }

    @Test
    void tiesShouldResolveToLowestIndexAcrossPatchBlocks() {
        // Columns 4..7 repeat columns 0..3, so patches 4 and 5 equal patches 0 and 1 in the next block
        FeatureMap style = new FeatureMap(2, 3, 10);
        FeatureMap half = PatchSwapFixtures.random(2, 3, 4, 41L);
        for (int c = 0; c < 2; c++) {
            for (int y = 0; y < 3; y++) {
                for (int x = 0; x < 4; x++) {
                    style.set(c, y, x, half.get(c, y, x));
                    style.set(c, y, x + 4, half.get(c, y, x));
                }
                style.set(c, y, 8, -50f);
                style.set(c, y, 9, -50f);
            }
        }
        PatchSet kernels = extractor.normalize(extractor.extractPatches(style, 3));
        FeatureMap content = PatchSwapFixtures.random(2, 7, 7, 42L);

        Assignment fused = matcher.match(content, kernels);
        Assignment viaVolume = matcher.selectBestMatch(matcher.computeCorrelation(content, kernels));

        assertThat(fused.patchIndices()).doesNotContain(4, 5);
        assertThat(IntStream.of(fused.patchIndices()).filter(k -> k <= 1).count()).isPositive();
        assertThat(fused.patchIndices()).containsExactly(viaVolume.patchIndices());
    }

    @Test
    void matchShouldHandleRelu31SizedMapsInSeconds() {
        // 46 x 46 positions against 2116 patches of 256 x 3 x 3 is about 1e10 multiply-adds
        FeatureMap content = PatchSwapFixtures.random(256, 48, 48, 51L);
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(256, 48, 48, 52L), 3));

        long start = System.nanoTime();
        Assignment assignment = matcher.match(content, kernels);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(assignment.rows()).isEqualTo(46);
        assertThat(elapsedMs).isLessThan(8_000);
    }

    @Test
    void shouldRejectChannelMismatch() {
        PatchSet kernels = extractor.normalize(extractor.extractPatches(PatchSwapFixtures.random(4, 4, 4, 1L), 3));
        FeatureMap content = PatchSwapFixtures.random(3, 4, 4, 2L);

        assertThatThrownBy(() -> matcher.match(content, kernels))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> matcher.computeCorrelation(content, kernels))
                .isInstanceOf(ShapeMismatchException.class);
    }

    private static double windowDot(FeatureMap content, PatchSet kernels, int k, int i, int j) {
        double sum = 0;
        for (int c = 0; c < content.channels(); c++) {
            for (int dy = 0; dy < 3; dy++) {
                for (int dx = 0; dx < 3; dx++) {
                    sum += (double) content.get(c, i + dy, j + dx) * kernels.get(k, c, dy, dx);
                }
            }
        }
        return sum;
    }

    private static double norm(PatchSet patches, int k) {
        double sum = 0;
        for (int i = patches.offset(k); i < patches.offset(k) + patches.patchLength(); i++) {
            sum += (double) patches.data()[i] * patches.data()[i];
        }
        return Math.sqrt(sum);
    }
}
