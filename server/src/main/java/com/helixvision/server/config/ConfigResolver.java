package com.helixvision.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helixvision.server.vision.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String CONFIG_PROPERTY = "helix.config";
    public static final String CONFIG_RESOURCE = "/helix_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static HelixConfig resolve() {
        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            logger.info("Loading configuration from {}", sysProp);
            return fromFile(Paths.get(sysProp));
        }

        // 2. Check classpath resource
        try (InputStream is = ConfigResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                logger.info("Loading configuration from classpath {}", CONFIG_RESOURCE);
                return read(is, CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + CONFIG_RESOURCE, e);
        }

        // 3. Default
        logger.warn("No {} on the classpath, using built-in defaults", CONFIG_RESOURCE);
        return new HelixConfig();
    }

    public static HelixConfig fromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return read(is, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file " + file, e);
        }
    }

    static HelixConfig read(InputStream is, String description) {
        try {
            HelixConfig config = MAPPER.readValue(is, HelixConfig.class);
            return config != null ? config : new HelixConfig();
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration in " + description, e);
        }
    }
}
