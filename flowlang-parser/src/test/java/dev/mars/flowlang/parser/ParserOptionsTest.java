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

package dev.mars.flowlang.parser;

import dev.mars.flowlang.config.FlowlangConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ParserOptionsTest {

    @Test
    void testDefaults() {
        ParserOptions options = ParserOptions.defaults();

        assertEquals(ParserOptions.DEFAULT_MAX_NESTING_DEPTH, options.maxNestingDepth());
        assertTrue(options.checkFormReferences());
        assertTrue(options.metricsEnabled());
    }

    @Test
    void testFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(FlowlangConfiguration.MAX_NESTING_DEPTH, "16");
        properties.setProperty(FlowlangConfiguration.CHECK_FORM_REFERENCES, "false");
        properties.setProperty(FlowlangConfiguration.METRICS_ENABLED, "false");

        ParserOptions options = ParserOptions.from(new FlowlangConfiguration(properties));

        assertEquals(16, options.maxNestingDepth());
        assertFalse(options.checkFormReferences());
        assertFalse(options.metricsEnabled());
    }

    @Test
    void testWithers() {
        ParserOptions options = ParserOptions.defaults().withMaxNestingDepth(4).withMetricsEnabled(false);

        assertEquals(4, options.maxNestingDepth());
        assertFalse(options.metricsEnabled());
        assertTrue(options.checkFormReferences());
    }

    @Test
    void testRejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new ParserOptions(0, true, true));
    }
}
