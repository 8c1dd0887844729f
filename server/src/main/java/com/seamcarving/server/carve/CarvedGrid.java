package com.seamcarving.server.carve;

import java.util.List;

/**
 * A source grid with some vertical seams removed. The source is never copied
 * or modified; each logical column is mapped back to a source column through
 * a per-row alias table.
 */
public class CarvedGrid implements PixelGrid {

    private final PixelGrid source;
    // source[aliases[x, y], y] is this[x, y]
    private final IntMatrix aliases;
    private int removed;

    public CarvedGrid(PixelGrid source) {
        this.source = source;
        this.aliases = new IntMatrix(source.getWidth(), source.getHeight(), (x, y) -> x);
        this.removed = 0;
    }

    public void removeSeam(List<Pos> seam) {
        aliases.removeSeam(seam);
        removed++;
    }

    public int getRemovedCount() {
        return removed;
    }

    public PixelGrid getSource() {
        return source;
    }

    @Override
    public int getWidth() {
        return source.getWidth() - removed;
    }

    @Override
    public int getHeight() {
        return source.getHeight();
    }

    @Override
    public int getChannelCount() {
        return source.getChannelCount();
    }

    @Override
    public int getSample(int x, int y, int channel) {
        return source.getSample(aliases.get(x, y), y, channel);
    }
}
