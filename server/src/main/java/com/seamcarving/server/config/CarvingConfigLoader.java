package com.seamcarving.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class CarvingConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(CarvingConfigLoader.class);

    public static final String CONFIG_PROPERTY = "seamcarving.config";
    public static final String CONFIG_RESOURCE = "/seamcarving_config.json";

    public static CarvingConfig load() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. Check System Property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            File file = new File(path);
            try {
                CarvingConfig config = mapper.readValue(file, CarvingConfig.class);
                logger.info("Loaded carving config from {}", file.getAbsolutePath());
                return config;
            } catch (IOException e) {
                logger.warn("Failed to read carving config from {}, trying classpath: {}", path, e.getMessage());
            }
        }

        // 2. Check Config File on the classpath
        try (InputStream is = CarvingConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                return mapper.readValue(is, CarvingConfig.class);
            }
            logger.info("No {} on the classpath, using defaults", CONFIG_RESOURCE);
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults", CONFIG_RESOURCE, e);
        }

        // 3. Default
        return CarvingConfig.defaults();
    }
}
