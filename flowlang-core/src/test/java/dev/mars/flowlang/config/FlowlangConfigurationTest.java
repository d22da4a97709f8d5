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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FlowlangConfiguration.
 * Validates default values, explicit properties, system property overrides and type conversion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
class FlowlangConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowlangConfiguration.MAX_NESTING_DEPTH);
        System.clearProperty(FlowlangConfiguration.METRICS_ENABLED);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        FlowlangConfiguration config = FlowlangConfiguration.defaults();

        assertEquals(128, config.getMaxNestingDepth());
        assertTrue(config.isFormReferenceCheckEnabled());
        assertEquals(1000, config.getYamlMaxNestingDepth());
        assertEquals(50, config.getYamlMaxAliases());
        assertEquals(3 * 1024 * 1024, config.getYamlCodePointLimit());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Explicit Properties Tests ==========

    @Test
    void testExplicitPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(FlowlangConfiguration.MAX_NESTING_DEPTH, "16");
        properties.setProperty(FlowlangConfiguration.CHECK_FORM_REFERENCES, "false");

        FlowlangConfiguration config = new FlowlangConfiguration(properties);

        assertEquals(16, config.getMaxNestingDepth());
        assertFalse(config.isFormReferenceCheckEnabled());
        assertEquals(50, config.getYamlMaxAliases());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(FlowlangConfiguration.MAX_NESTING_DEPTH, "deep");

        FlowlangConfiguration config = new FlowlangConfiguration(properties);

        assertEquals(128, config.getMaxNestingDepth());
    }

    @Test
    void testSetProperty() {
        FlowlangConfiguration config = FlowlangConfiguration.defaults();
        config.setProperty(FlowlangConfiguration.YAML_MAX_ALIASES, " 5 ");

        assertEquals(5, config.getYamlMaxAliases());
        assertEquals(" 5 ", config.getProperty(FlowlangConfiguration.YAML_MAX_ALIASES));
        assertEquals("fallback", config.getProperty("flowlang.unknown", "fallback"));
    }

    // ========== System Property Tests ==========

    @Test
    void testSystemPropertiesOverride() {
        System.setProperty(FlowlangConfiguration.MAX_NESTING_DEPTH, "32");
        System.setProperty(FlowlangConfiguration.METRICS_ENABLED, "false");

        FlowlangConfiguration config = new FlowlangConfiguration();

        assertEquals(32, config.getMaxNestingDepth());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testToStringContainsKeySettings() {
        String text = FlowlangConfiguration.defaults().toString();

        assertTrue(text.contains("maxNestingDepth=128"));
        assertTrue(text.contains("metricsEnabled=true"));
    }
}
