package com.seamcarving.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Limits and output settings for resize requests, read from
 * seamcarving_config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CarvingConfig {
    // Largest accepted input, width * height
    public long maxInputPixels = 16_000_000L;
    // Seams removed per request, both axes together
    public int maxSeamsPerRequest = 4096;
    public String outputFormat = "png";
    // Appended to the file name by the command-line tool
    public String outputSuffix = "_resized";

    public CarvingConfig() {
    }

    public CarvingConfig(long maxInputPixels, int maxSeamsPerRequest, String outputFormat, String outputSuffix) {
        this.maxInputPixels = maxInputPixels;
        this.maxSeamsPerRequest = maxSeamsPerRequest;
        this.outputFormat = outputFormat;
        this.outputSuffix = outputSuffix;
    }

    public static CarvingConfig defaults() {
        return new CarvingConfig();
    }
}
