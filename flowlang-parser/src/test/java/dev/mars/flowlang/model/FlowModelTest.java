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

package dev.mars.flowlang.model;

import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the invariants and helpers of the AST records.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-03
 */
class FlowModelTest {

    @Test
    void testStepKindKeys() {
        assertEquals("logYaml", StepKind.LOG_YAML.key());
        assertEquals(StepKind.LOG_YAML, StepKind.fromKey("logYaml").orElseThrow());
        assertFalse(StepKind.fromKey("logyaml").isPresent());
        assertTrue(StepKind.isDiscriminant("try"));
        assertFalse(StepKind.isDiscriminant("name"));
        assertTrue(StepKind.SWITCH.isBlockStructured());
        assertFalse(StepKind.TASK.isBlockStructured());
    }

    @Test
    void testLoopModeKeys() {
        assertEquals(LoopMode.PARALLEL, LoopMode.fromKey("parallel").orElseThrow());
        assertFalse(LoopMode.fromKey("PARALLEL").isPresent());
        assertEquals("serial", LoopMode.SERIAL.key());
    }

    @Test
    void testFormFieldType() {
        FormField required = new FormField("age", "int+");
        FormField optional = new FormField("name", "string");
        FormField bare = new FormField("odd", "+");

        assertTrue(required.required());
        assertEquals("int", required.baseType());
        assertFalse(optional.required());
        assertEquals("string", optional.baseType());
        assertTrue(bare.required());
        assertEquals("", bare.baseType());
        assertTrue(optional.options().isEmpty());
    }

    @Test
    void testLoopDefaultsToSerial() {
        Loop loop = new Loop(ScalarValue.of("${items}"), null, null, null);

        assertEquals(LoopMode.SERIAL, loop.mode());
        assertFalse(loop.isParallel());
        assertThrows(IllegalArgumentException.class,
                () -> new Loop(ScalarValue.of("x"), LoopMode.PARALLEL, 0, null));
    }

    @Test
    void testRetryRejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new Retry(-1, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Retry(1, -0.1, null, null));
        assertFalse(new Retry(1, 0, null, null).hasInputOverrides());
    }

    @Test
    void testOutputVariableNames() {
        Output single = new Output.Single("result");
        Output names = new Output.Names(List.of("x", "y"));
        Output bindings = new Output.Bindings(List.of(
                new Output.Binding("b", ScalarValue.of("${b}")),
                new Output.Binding("a", ScalarValue.of("${a}"))));

        assertEquals(List.of("result"), single.variableNames());
        assertEquals(List.of("x", "y"), names.variableNames());
        assertEquals(List.of("b", "a"), bindings.variableNames());
    }

    @Test
    void testFlowCompleteness() {
        Step log = new Step(new StepDefinition.Log("hi"), null, null);
        Flow complete = new Flow(List.of(log), 0, null);
        Flow partial = new Flow(List.of(log), 2, null);

        assertTrue(complete.isComplete());
        assertFalse(partial.isComplete());
        assertEquals(Modifiers.NONE, log.modifiers());
        assertThrows(IllegalArgumentException.class, () -> new Flow(List.of(), -1, null));
    }

    @Test
    void testDocumentMapsAreReadOnly() {
        Flow flow = new Flow(List.of(), 0, null);
        FlowDocument document = new FlowDocument(null, Map.of("main", flow), Map.of(), List.of("main"));

        assertThrows(UnsupportedOperationException.class, () -> document.flows().put("other", flow));
        assertTrue(document.isPublic("main"));
        assertTrue(document.flow("main").isPresent());
        assertFalse(document.form("main").isPresent());
    }

    @Test
    void testConfigurationAccessorsIgnoreWrongShapes() {
        Configuration configuration = new Configuration(MappingValue.builder()
                .put("runtime", SequenceValue.of())
                .put("dependencies", "not-a-list")
                .put("processTimeout", "fifteen minutes")
                .put("debug", "true")
                .build());

        assertFalse(configuration.runtime().isPresent());
        assertFalse(configuration.dependencies().isPresent());
        assertEquals("fifteen minutes", configuration.processTimeout().orElseThrow());
        assertFalse(configuration.processTimeoutDuration().isPresent());
        assertFalse(configuration.debug().isPresent());
        assertFalse(configuration.arguments().isPresent());
    }

    @Test
    void testConfigurationTimeout() {
        Configuration configuration = new Configuration(MappingValue.builder()
                .put("processTimeout", "PT1H30M")
                .build());

        assertEquals(Duration.ofMinutes(90), configuration.processTimeoutDuration().orElseThrow());
    }

    @Test
    void testIfElseOptional() {
        StepDefinition.If withoutElse = new StepDefinition.If("${x}", List.of(), null);
        StepDefinition.Switch withoutDefault = new StepDefinition.Switch("${x}",
                List.of(new SwitchCase("a", List.of(), null)), null);

        assertFalse(withoutElse.hasElse());
        assertFalse(withoutDefault.hasDefault());
        assertEquals(StepKind.IF, withoutElse.kind());
    }
}
