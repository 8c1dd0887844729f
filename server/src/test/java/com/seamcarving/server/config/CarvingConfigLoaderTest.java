package com.seamcarving.server.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CarvingConfigLoaderTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(CarvingConfigLoader.CONFIG_PROPERTY);
    }

    @Test
    public void testLoadConfigFromDefaultFile() {
        CarvingConfig config = CarvingConfigLoader.load();

        // Values of seamcarving_config.json
        assertEquals(16_000_000L, config.maxInputPixels);
        assertEquals(4096, config.maxSeamsPerRequest);
        assertEquals("png", config.outputFormat);
        assertEquals("_resized", config.outputSuffix);
    }

    @Test
    public void testSystemPropertyOverridesClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.json");
        Files.write(file, "{\"maxSeamsPerRequest\": 7, \"someFutureOption\": true}".getBytes(StandardCharsets.UTF_8));
        System.setProperty(CarvingConfigLoader.CONFIG_PROPERTY, file.toString());

        CarvingConfig config = CarvingConfigLoader.load();

        assertEquals(7, config.maxSeamsPerRequest);
        // Unset fields keep their defaults
        assertEquals("png", config.outputFormat);
    }

    @Test
    public void testMissingFileFallsBackToClasspath(@TempDir Path dir) {
        System.setProperty(CarvingConfigLoader.CONFIG_PROPERTY, dir.resolve("missing.json").toString());

        CarvingConfig config = CarvingConfigLoader.load();

        assertEquals(4096, config.maxSeamsPerRequest);
    }
}
