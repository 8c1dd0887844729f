package com.seamcarving.server.tools;

import com.seamcarving.server.carve.RasterImage;
import com.seamcarving.server.carve.SeamCarver;
import com.seamcarving.server.config.CarvingConfig;
import com.seamcarving.server.config.CarvingConfigLoader;
import com.seamcarving.server.io.ImageConversion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Offline tool to resize a single image file.
 * Usage: ImageResizeTool <image> <width> <height>
 * The result is written next to the input as {@code <name>_resized.<ext>}.
 */
public class ImageResizeTool {

    private static final Logger logger = LoggerFactory.getLogger(ImageResizeTool.class);

    public static void main(String[] args) {
        if (args.length < 3) {
            System.err.println("Usage: ImageResizeTool /path/to/image.jpg <width> <height>");
            System.exit(1);
        }

        File input = new File(args[0]);
        if (!input.isFile()) {
            System.err.println("Invalid input image: " + args[0]);
            System.exit(1);
        }

        int width;
        int height;
        try {
            width = Integer.parseInt(args[1]);
            height = Integer.parseInt(args[2]);
        } catch (NumberFormatException e) {
            System.err.println("Width and height must be integers: " + e.getMessage());
            System.exit(1);
            return;
        }
        if (width <= 0 || height <= 0) {
            System.err.println("Width and height must be positive");
            System.exit(1);
        }

        try {
            CarvingConfig config = CarvingConfigLoader.load();
            File output = run(input, width, height, config.outputSuffix);
            System.out.println("Resized image successfully written to " + output.getPath());
        } catch (Exception e) {
            logger.error("Resize failed", e);
            System.exit(1);
        }
    }

    public static File run(File input, int width, int height, String suffix) throws IOException {
        BufferedImage image = ImageIO.read(input);
        if (image == null) {
            throw new IOException("No image reader recognises " + input.getPath());
        }
        logger.info("Loaded {} ({}x{})", input.getPath(), image.getWidth(), image.getHeight());

        RasterImage resized = SeamCarver.resize(ImageConversion.toRaster(image), width, height);
        BufferedImage result = ImageConversion.toBufferedImage(resized, image);

        File output = outputFile(input, suffix);
        String format = extension(input.getName());
        if (!ImageIO.write(result, format, output)) {
            throw new IOException("No image writer available for format '" + format + "'");
        }
        return output;
    }

    static File outputFile(File input, String suffix) {
        String name = input.getName();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            throw new IllegalArgumentException("Input file has no extension: " + name);
        }
        String resizedName = name.substring(0, dot) + suffix + name.substring(dot);
        return new File(input.getAbsoluteFile().getParentFile(), resizedName);
    }

    private static String extension(String name) {
        return name.substring(name.lastIndexOf('.') + 1).toLowerCase();
    }
}
