/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowlang.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the flow language tooling.
 * Values are resolved from built-in defaults, then a {@code flowlang.properties}
 * file, then {@code flowlang.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FlowlangConfiguration {
    private static final Logger logger = Logger.getLogger(FlowlangConfiguration.class.getName());

    public static final String MAX_NESTING_DEPTH = "flowlang.parser.max.nesting.depth";
    public static final String CHECK_FORM_REFERENCES = "flowlang.parser.check.form.references";
    public static final String YAML_MAX_NESTING_DEPTH = "flowlang.yaml.max.nesting.depth";
    public static final String YAML_MAX_ALIASES = "flowlang.yaml.max.aliases";
    public static final String YAML_CODE_POINT_LIMIT = "flowlang.yaml.code.point.limit";
    public static final String METRICS_ENABLED = "flowlang.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_NESTING_DEPTH = 128;
    private static final int DEFAULT_YAML_MAX_NESTING_DEPTH = 1000;
    private static final int DEFAULT_YAML_MAX_ALIASES = 50;
    private static final int DEFAULT_YAML_CODE_POINT_LIMIT = 3 * 1024 * 1024; // 3MB

    private final Properties properties;

    public FlowlangConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowlangConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Creates a configuration holding only the built-in defaults.
     */
    public static FlowlangConfiguration defaults() {
        return new FlowlangConfiguration(null);
    }

    // Parser Configuration
    public int getMaxNestingDepth() {
        return getIntProperty(MAX_NESTING_DEPTH, DEFAULT_MAX_NESTING_DEPTH);
    }

    public boolean isFormReferenceCheckEnabled() {
        return getBooleanProperty(CHECK_FORM_REFERENCES, true);
    }

    // YAML Reader Configuration
    public int getYamlMaxNestingDepth() {
        return getIntProperty(YAML_MAX_NESTING_DEPTH, DEFAULT_YAML_MAX_NESTING_DEPTH);
    }

    public int getYamlMaxAliases() {
        return getIntProperty(YAML_MAX_ALIASES, DEFAULT_YAML_MAX_ALIASES);
    }

    public int getYamlCodePointLimit() {
        return getIntProperty(YAML_CODE_POINT_LIMIT, DEFAULT_YAML_CODE_POINT_LIMIT);
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_NESTING_DEPTH, String.valueOf(DEFAULT_MAX_NESTING_DEPTH));
        properties.setProperty(CHECK_FORM_REFERENCES, "true");
        properties.setProperty(YAML_MAX_NESTING_DEPTH, String.valueOf(DEFAULT_YAML_MAX_NESTING_DEPTH));
        properties.setProperty(YAML_MAX_ALIASES, String.valueOf(DEFAULT_YAML_MAX_ALIASES));
        properties.setProperty(YAML_CODE_POINT_LIMIT, String.valueOf(DEFAULT_YAML_CODE_POINT_LIMIT));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowlang.properties",
                "config/flowlang.properties",
                System.getProperty("user.home") + "/.flowlang/flowlang.properties",
                "/etc/flowlang/flowlang.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = FlowlangConfiguration.class.getClassLoader().getResourceAsStream("flowlang.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("flowlang."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowlangConfiguration{" +
                "maxNestingDepth=" + getMaxNestingDepth() +
                ", formReferenceCheck=" + isFormReferenceCheckEnabled() +
                ", yamlMaxNestingDepth=" + getYamlMaxNestingDepth() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
