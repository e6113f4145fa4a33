package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.FeatureMap;

import java.util.Random;

final class PatchSwapFixtures {

    private PatchSwapFixtures() {
    }

    static FeatureMap random(int channels, int height, int width, long seed) {
        Random random = new Random(seed);
        FeatureMap map = new FeatureMap(channels, height, width);
        float[] data = map.data();
        for (int i = 0; i < data.length; i++) {
            data[i] = (float) random.nextGaussian();
        }
        return map;
    }

    static FeatureMap sequential(int channels, int height, int width) {
        FeatureMap map = new FeatureMap(channels, height, width);
        float[] data = map.data();
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
        return map;
    }

    static FeatureMap constant(int channels, int height, int width, float value) {
        FeatureMap map = new FeatureMap(channels, height, width);
        java.util.Arrays.fill(map.data(), value);
        return map;
    }
}
