package com.techsheet.cscan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Resolves the processor configuration:
 * 1. {@code /cscan_config.json} on the classpath (built-in defaults if missing or unreadable)
 * 2. the {@code cscan.synthetic.seed} system property, which overrides the configured seed
 */
public class ProcessorConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorConfigLoader.class);

    public static final String CONFIG_RESOURCE = "/cscan_config.json";
    public static final String SEED_PROPERTY = "cscan.synthetic.seed";

    public static ProcessorConfig loadOrDefault() {
        return loadOrDefault(CONFIG_RESOURCE);
    }

    public static ProcessorConfig loadOrDefault(String resource) {
        ProcessorConfig config = null;
        try (InputStream is = ProcessorConfigLoader.class.getResourceAsStream(resource)) {
            if (is != null) {
                ObjectMapper mapper = new ObjectMapper();
                config = mapper.readValue(is, ProcessorConfig.class);
                logger.info("Loaded processor config from {}", resource);
            } else {
                logger.warn("{} not found on classpath, using built-in defaults", resource);
            }
        } catch (Exception e) {
            logger.warn("Failed to read processor config {}, using defaults. Error: {}", resource, e.getMessage());
        }

        if (config == null) {
            config = ProcessorConfig.defaults();
        }
        config.withDefaults();
        applySeedOverride(config);
        return config;
    }

    private static void applySeedOverride(ProcessorConfig config) {
        String sysProp = System.getProperty(SEED_PROPERTY);
        if (sysProp == null || sysProp.isEmpty()) {
            return;
        }
        try {
            config.synthetic.seed = Long.parseLong(sysProp.trim());
            logger.info("Synthetic seed set via {}={}", SEED_PROPERTY, config.synthetic.seed);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}='{}'", SEED_PROPERTY, sysProp);
        }
    }
}
