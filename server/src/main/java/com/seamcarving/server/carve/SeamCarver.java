package com.seamcarving.server.carve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-aware resizing: removes vertical seams, then horizontal seams, until
 * the image fits the requested size.
 */
public final class SeamCarver {

    private static final Logger logger = LoggerFactory.getLogger(SeamCarver.class);

    private SeamCarver() {
    }

    /**
     * Shrinks {@code image} to at most {@code width} x {@code height}.
     * An axis already within the target is left as is, so the result is
     * {@code min(width, image width)} x {@code min(height, image height)}.
     * The input is not modified.
     */
    public static RasterImage resize(PixelGrid image, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Target size must be non-negative: " + width + "x" + height);
        }
        Pos toRemove = image.size().minus(new Pos(width, height));

        if (image.getWidth() == 0 || image.getHeight() == 0) {
            return new RasterImage(Math.min(width, image.getWidth()), Math.min(height, image.getHeight()),
                    image.getChannelCount());
        }

        long start = System.currentTimeMillis();
        logger.info("Resizing {}x{} image to {}x{}: removing {} vertical and {} horizontal seams",
                image.getWidth(), image.getHeight(), width, height, toRemove.x, toRemove.y);

        // 1. Columns on the source
        CarvedGrid carvedX = carve(image, toRemove.x);

        // 2. Rows, as columns of the transposed view
        CarvedGrid carvedY = carve(new TransposedGrid(carvedX), toRemove.y);

        // 3. Back to the original orientation, sampled into a dense buffer
        RasterImage result = RasterImage.copyOf(new TransposedGrid(carvedY));

        logger.info("Resized to {}x{} in {} ms", result.getWidth(), result.getHeight(),
                (System.currentTimeMillis() - start));
        return result;
    }

    /**
     * Removes {@code seamCount} vertical seams from {@code image}.
     */
    public static CarvedGrid carve(PixelGrid image, int seamCount) {
        if (seamCount > image.getWidth()) {
            throw new IllegalArgumentException(
                    "Cannot remove " + seamCount + " seams from an image of width " + image.getWidth());
        }
        Carvable carvable = new Carvable(image);
        for (int i = 0; i < seamCount; i++) {
            carvable.removeSeam();
        }
        logger.debug("Carved {} seams, width {} -> {}", seamCount, image.getWidth(),
                carvable.getResult().getWidth());
        return carvable.getResult();
    }
}
