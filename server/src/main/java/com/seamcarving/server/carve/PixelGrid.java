package com.seamcarving.server.carve;

/**
 * Read-only access to a grid of pixels. Every pixel has the same number of
 * numeric channels (samples).
 */
public interface PixelGrid {

    int getWidth();

    int getHeight();

    int getChannelCount();

    /**
     * @param x       column in [0, width)
     * @param y       row in [0, height)
     * @param channel channel index in [0, channelCount)
     * @return the sample value of that channel
     */
    int getSample(int x, int y, int channel);

    default int[] getPixel(int x, int y) {
        int[] pixel = new int[getChannelCount()];
        for (int c = 0; c < pixel.length; c++) {
            pixel[c] = getSample(x, y, c);
        }
        return pixel;
    }

    default Pos size() {
        return new Pos(getWidth(), getHeight());
    }
}
