package com.phillippitts.styleswap.testutil;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.service.model.InverseNetwork;

/**
 * Test double for InverseNetwork: nearest-neighbour upsampling of the first three channels.
 *
 * <p><b>Mutable fields:</b> {@code failure} is public; when set, {@code forward} throws it.
 */
public class FakeInverseNetwork implements InverseNetwork {

    private final int scale;
    public RuntimeException failure;
    private int calls;
    private boolean initialized;
    private boolean closed;

    public FakeInverseNetwork(int scale) {
        this.scale = scale;
    }

    @Override
    public FeatureMap forward(FeatureMap features) {
        calls++;
        if (failure != null) {
            throw failure;
        }
        int height = features.height() * scale;
        int width = features.width() * scale;
        FeatureMap out = new FeatureMap(3, height, width);
        for (int c = 0; c < 3; c++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    out.set(c, y, x, features.get(c, y / scale, x / scale));
                }
            }
        }
        return out;
    }

    @Override
    public void initialize() {
        initialized = true;
        closed = false;
    }

    @Override
    public String getNetworkName() {
        return "inverse";
    }

    @Override
    public boolean isHealthy() {
        return initialized && !closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    public int calls() {
        return calls;
    }
}
