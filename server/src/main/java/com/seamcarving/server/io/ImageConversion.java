package com.seamcarving.server.io;

import com.seamcarving.server.carve.RasterImage;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Moves pixels between {@link BufferedImage} and {@link RasterImage}. Each
 * raster band becomes one channel.
 */
public class ImageConversion {

    public static RasterImage toRaster(BufferedImage image) {
        BufferedImage source = expandPalette(image);
        Raster raster = source.getRaster();
        int w = raster.getWidth();
        int h = raster.getHeight();
        int bands = raster.getNumBands();
        int[] samples = raster.getPixels(0, 0, w, h, new int[w * h * bands]);
        return new RasterImage(w, h, bands, samples);
    }

    /**
     * Writes {@code raster} into a new image with the colour model of
     * {@code like}, which must have as many bands as the raster has channels.
     */
    public static BufferedImage toBufferedImage(RasterImage raster, BufferedImage like) {
        if (raster.getWidth() == 0 || raster.getHeight() == 0) {
            throw new IllegalArgumentException("Cannot create an image with no pixels ("
                    + raster.getWidth() + "x" + raster.getHeight() + ")");
        }
        ColorModel cm = like.getColorModel() instanceof IndexColorModel
                ? ColorModel.getRGBdefault()
                : like.getColorModel();
        WritableRaster out = cm.createCompatibleWritableRaster(raster.getWidth(), raster.getHeight());
        if (out.getNumBands() != raster.getChannelCount()) {
            throw new IllegalArgumentException("Image has " + out.getNumBands() + " bands but raster has "
                    + raster.getChannelCount() + " channels");
        }
        out.setPixels(0, 0, raster.getWidth(), raster.getHeight(), raster.getSamples());
        return new BufferedImage(cm, out, cm.isAlphaPremultiplied(), null);
    }

    /**
     * @return the decoded image, or null when no installed reader recognises
     *         the bytes
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(bytes));
    }

    public static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        if (!ImageIO.write(image, format, bos)) {
            throw new IOException("No image writer available for format '" + format + "'");
        }
        return bos.toByteArray();
    }

    // Palette indices are not meaningful to diff, carve the expanded colours instead
    private static BufferedImage expandPalette(BufferedImage image) {
        if (!(image.getColorModel() instanceof IndexColorModel)) {
            return image;
        }
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }
}
