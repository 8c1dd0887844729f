package com.seamcarving.server.carve;

import java.util.Arrays;

/**
 * A dense, band-interleaved pixel buffer. This is the form every resize result
 * is materialized into.
 */
public class RasterImage implements PixelGrid {

    private final int width;
    private final int height;
    private final int channelCount;
    // samples[(y * width + x) * channelCount + c]
    private final int[] samples;

    public RasterImage(int width, int height, int channelCount, int[] samples) {
        if (width < 0 || height < 0 || channelCount <= 0) {
            throw new IllegalArgumentException(
                    "Invalid raster shape: " + width + "x" + height + "x" + channelCount);
        }
        if (samples.length != width * height * channelCount) {
            throw new IllegalArgumentException("Expected " + (width * height * channelCount)
                    + " samples but got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.channelCount = channelCount;
        this.samples = samples;
    }

    public RasterImage(int width, int height, int channelCount) {
        this(width, height, channelCount, new int[width * height * channelCount]);
    }

    /**
     * Single channel image from row-major rows, e.g. {@code {{3, 1, 4}, {1, 5, 9}}}.
     */
    public static RasterImage grayscale(int[][] rows) {
        int h = rows.length;
        int w = h == 0 ? 0 : rows[0].length;
        int[] samples = new int[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("Row " + y + " has length " + rows[y].length + ", expected " + w);
            }
            System.arraycopy(rows[y], 0, samples, y * w, w);
        }
        return new RasterImage(w, h, 1, samples);
    }

    /**
     * Samples every pixel of {@code grid} into a new dense buffer with the same
     * channel layout.
     */
    public static RasterImage copyOf(PixelGrid grid) {
        RasterImage out = new RasterImage(grid.getWidth(), grid.getHeight(), grid.getChannelCount());
        for (Pos p : Pos.iterInRect(grid.size())) {
            for (int c = 0; c < out.channelCount; c++) {
                out.setSample(p.x, p.y, c, grid.getSample(p.x, p.y, c));
            }
        }
        return out;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getChannelCount() {
        return channelCount;
    }

    @Override
    public int getSample(int x, int y, int channel) {
        return samples[offset(x, y, channel)];
    }

    public void setSample(int x, int y, int channel, int value) {
        samples[offset(x, y, channel)] = value;
    }

    private int offset(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height || channel < 0 || channel >= channelCount) {
            throw new IllegalArgumentException("Sample (" + x + ", " + y + ", " + channel + ") is outside "
                    + width + "x" + height + "x" + channelCount);
        }
        return (y * width + x) * channelCount + channel;
    }

    /**
     * The backing samples, band-interleaved in row-major order. Not a copy.
     */
    public int[] getSamples() {
        return samples;
    }

    /**
     * Channel 0 of every pixel as rows. Handy for grayscale images.
     */
    public int[][] toRows() {
        int[][] rows = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rows[y][x] = getSample(x, y, 0);
            }
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RasterImage))
            return false;
        RasterImage other = (RasterImage) o;
        return width == other.width && height == other.height && channelCount == other.channelCount
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channelCount) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "RasterImage(" + width + "x" + height + "x" + channelCount + ")";
    }
}
