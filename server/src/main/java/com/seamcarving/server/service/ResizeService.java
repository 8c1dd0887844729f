package com.seamcarving.server.service;

import com.seamcarving.server.carve.RasterImage;
import com.seamcarving.server.carve.SeamCarver;
import com.seamcarving.server.config.CarvingConfig;
import com.seamcarving.server.config.CarvingConfigLoader;
import com.seamcarving.server.io.ImageConversion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;

@Service
public class ResizeService {

    private static final Logger logger = LoggerFactory.getLogger(ResizeService.class);

    private final CarvingConfig config;

    public ResizeService() {
        this(CarvingConfigLoader.load());
    }

    public ResizeService(CarvingConfig config) {
        this.config = config;
        logger.info("ResizeService: maxInputPixels={}, maxSeamsPerRequest={}, outputFormat={}",
                config.maxInputPixels, config.maxSeamsPerRequest, config.outputFormat);
    }

    public CarvingConfig getConfig() {
        return config;
    }

    public static class ResizeResult {
        public final byte[] image;
        public final String format;
        public final int width;
        public final int height;
        public final int seamsRemovedX;
        public final int seamsRemovedY;

        public ResizeResult(byte[] image, String format, int width, int height, int seamsRemovedX,
                int seamsRemovedY) {
            this.image = image;
            this.format = format;
            this.width = width;
            this.height = height;
            this.seamsRemovedX = seamsRemovedX;
            this.seamsRemovedY = seamsRemovedY;
        }
    }

    /**
     * Decodes {@code imageBytes}, shrinks it to at most width x height and
     * encodes the result in the configured output format.
     *
     * @throws IllegalArgumentException if the request is invalid or exceeds the
     *                                  configured limits
     */
    public ResizeResult resize(byte[] imageBytes, int width, int height) throws IOException {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target width and height must be positive");
        }
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("Empty image body");
        }

        BufferedImage input = ImageConversion.decode(imageBytes);
        if (input == null) {
            throw new IllegalArgumentException("Unsupported or corrupt image data");
        }

        long pixels = (long) input.getWidth() * input.getHeight();
        if (pixels > config.maxInputPixels) {
            throw new IllegalArgumentException("Image has " + pixels + " pixels, limit is " + config.maxInputPixels);
        }

        int seamsX = Math.max(0, input.getWidth() - width);
        int seamsY = Math.max(0, input.getHeight() - height);
        if (seamsX + seamsY > config.maxSeamsPerRequest) {
            throw new IllegalArgumentException("Request needs " + (seamsX + seamsY)
                    + " seams, limit is " + config.maxSeamsPerRequest);
        }

        RasterImage resized = SeamCarver.resize(ImageConversion.toRaster(input), width, height);
        BufferedImage output = ImageConversion.toBufferedImage(resized, input);
        byte[] encoded = ImageConversion.encode(output, config.outputFormat);

        logger.debug("Encoded {}x{} result as {} ({} bytes)", resized.getWidth(), resized.getHeight(),
                config.outputFormat, encoded.length);
        return new ResizeResult(encoded, config.outputFormat, resized.getWidth(), resized.getHeight(), seamsX,
                seamsY);
    }
}
