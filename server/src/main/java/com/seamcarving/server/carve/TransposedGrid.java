package com.seamcarving.server.carve;

/**
 * A grid with its x and y axes swapped. Transposing twice gives back the
 * original reads.
 */
public class TransposedGrid implements PixelGrid {

    private final PixelGrid inner;

    public TransposedGrid(PixelGrid inner) {
        this.inner = inner;
    }

    @Override
    public int getWidth() {
        return inner.getHeight();
    }

    @Override
    public int getHeight() {
        return inner.getWidth();
    }

    @Override
    public int getChannelCount() {
        return inner.getChannelCount();
    }

    @Override
    public int getSample(int x, int y, int channel) {
        return inner.getSample(y, x, channel);
    }
}
