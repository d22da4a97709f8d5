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

import dev.mars.flowlang.model.Flow;
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.value.Value;
import dev.mars.flowlang.yaml.FlowDocumentReadException;
import dev.mars.flowlang.yaml.YamlValueReader;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shared helpers for parser tests: YAML text in, parse result out.
 */
final class ParserTestSupport {

    private static final YamlValueReader READER = new YamlValueReader();

    private ParserTestSupport() {
    }

    static FlowDocumentParser newParser() {
        return new FlowDocumentParser(ParserOptions.defaults().withMetricsEnabled(false));
    }

    static Value yaml(String text) {
        try {
            return READER.read(text, "test");
        } catch (FlowDocumentReadException e) {
            return fail("Test YAML is not readable: " + e.getMessage(), e);
        }
    }

    static ParseResult parse(String text) {
        return newParser().parse(yaml(text));
    }

    static Flow flow(ParseResult result, String name) {
        Flow flow = result.document().flows().get(name);
        assertNotNull(flow, "flow '" + name + "' should be present");
        return flow;
    }

    /**
     * @return the only step of the flow {@code main}
     */
    static Step singleStep(ParseResult result) {
        Flow flow = flow(result, "main");
        if (flow.size() != 1) {
            fail("Expected exactly one step in 'main' but got " + flow.size() + ": " + result.diagnostics());
        }
        return flow.steps().get(0);
    }
}
