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

import dev.mars.flowlang.diagnostics.Diagnostic;
import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.model.FormField;
import dev.mars.flowlang.model.ScriptBody;
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.model.SwitchCase;
import dev.mars.flowlang.value.ScalarValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.flowlang.parser.ParserTestSupport.flow;
import static dev.mars.flowlang.parser.ParserTestSupport.parse;
import static dev.mars.flowlang.parser.ParserTestSupport.singleStep;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the variant-specific fields of each step kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-05
 */
class StepBuildersTest {

    @Test
    void testScalarPayloadIsKeptVerbatim() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - log: Boom, ${lastError}!
                """));

        assertEquals("Boom, ${lastError}!", step.definitionAs(StepDefinition.Log.class).message());
    }

    @Test
    void testScalarPayloadMustBeScalar() {
        ParseResult result = parse("""
                flows:
                  main:
                    - task:
                        name: t
                """);

        Diagnostic diagnostic = result.getErrors().get(0);
        assertEquals(DiagnosticKind.MALFORMED_FIELD, diagnostic.getKind());
        assertEquals("task", diagnostic.getField());
        assertEquals("'task' must be a scalar, got mapping", diagnostic.getMessage());
    }

    @Test
    void testNullPayloadIsRejected() {
        ParseResult result = parse("""
                flows:
                  main:
                    - call:
                """);

        assertEquals(DiagnosticKind.MALFORMED_FIELD, result.getErrors().get(0).getKind());
    }

    @Test
    void testSetKeepsOrder() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - set:
                        foo: bar
                        bar: baz
                        baz: "qux"
                """));

        StepDefinition.SetVariables set = step.definitionAs(StepDefinition.SetVariables.class);
        assertEquals(List.of("foo", "bar", "baz"), set.variables().keys());
    }

    @Test
    void testSetRequiresMapping() {
        ParseResult result = parse("""
                flows:
                  main:
                    - set: x
                """);

        assertEquals("set", result.getErrors().get(0).getField());
    }

    @Test
    void testInlineScript() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - script: groovy
                      body: |
                        println('hi');
                """));

        StepDefinition.Script script = step.definitionAs(StepDefinition.Script.class);
        assertEquals("groovy", script.language());
        assertEquals(new ScriptBody.Inline("println('hi');\n"), script.body());
    }

    @Test
    void testExternalScript() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - script: scripts/check.groovy
                """));

        StepDefinition.Script script = step.definitionAs(StepDefinition.Script.class);
        assertEquals("groovy", script.language());
        assertEquals(new ScriptBody.External("scripts/check.groovy"), script.body());
    }

    @Test
    void testScriptWithoutBodyOrReference() {
        ParseResult result = parse("""
                flows:
                  main:
                    - script: js
                """);

        Diagnostic diagnostic = result.getErrors().get(0);
        assertEquals(DiagnosticKind.MISSING_FIELD, diagnostic.getKind());
        assertEquals("body", diagnostic.getField());
    }

    @Test
    void testScriptLanguageOfReference() {
        assertEquals("js", ScriptStepBuilder.languageOf("test.js"));
        assertEquals("py", ScriptStepBuilder.languageOf("a.b/run.py"));
        assertEquals("scripts/run", ScriptStepBuilder.languageOf("scripts/run"));
        assertTrue(ScriptStepBuilder.isExternalReference("scripts/run"));
        assertFalse(ScriptStepBuilder.isExternalReference("groovy"));
        assertFalse(ScriptStepBuilder.isExternalReference(".hidden"));
        assertFalse(ScriptStepBuilder.isExternalReference("python3.11"));
        assertTrue(ScriptStepBuilder.isExternalReference("check.groovy"));
    }

    @Test
    void testFormCall() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - form: myForm
                      fields:
                        - age:
                            type: int+
                        - areYouARobot: { type: boolean+ }
                      values:
                        a: "a"
                      runAs:
                        someone: else
                      yield: true
                      saveSubmittedBy: false
                forms:
                  myForm: []
                """));

        StepDefinition.FormCall form = step.definitionAs(StepDefinition.FormCall.class);
        assertEquals("myForm", form.formName());
        assertEquals(List.of("age", "areYouARobot"), form.fields().stream().map(FormField::name).toList());
        assertTrue(form.fields().get(0).required());
        assertEquals("int", form.fields().get(0).baseType());
        assertEquals("a", ((ScalarValue) form.values().get("a")).asString());
        assertTrue(form.runAs().containsKey("someone"));
        assertEquals(Boolean.TRUE, form.yieldExecution());
        assertEquals(Boolean.FALSE, form.saveSubmittedBy());
    }

    @Test
    void testFormCallOptionsDefaultToUnset() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - form: myForm
                forms:
                  myForm: []
                """));

        StepDefinition.FormCall form = step.definitionAs(StepDefinition.FormCall.class);
        assertTrue(form.fields().isEmpty());
        assertNull(form.values());
        assertNull(form.yieldExecution());
    }

    @Test
    void testFormCallRejectsBadYield() {
        ParseResult result = parse("""
                flows:
                  main:
                    - form: myForm
                      yield: sometimes
                """);

        assertEquals("yield", result.getErrors().get(0).getField());
        assertTrue(flow(result, "main").steps().isEmpty());
    }

    @Test
    void testIfWithElse() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - if: ${something}
                      then:
                        - log: "It is true"
                        - log: "Definitely"
                      else:
                        - log: "It is false"
                """));

        StepDefinition.If branch = step.definitionAs(StepDefinition.If.class);
        assertEquals("${something}", branch.condition());
        assertEquals(2, branch.thenSteps().size());
        assertTrue(branch.hasElse());
        assertEquals(1, branch.elseSteps().size());
    }

    @Test
    void testIfWithoutElse() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - if: ${false}
                      then:
                        - log: "How did this happen"
                """));

        assertFalse(step.definitionAs(StepDefinition.If.class).hasElse());
    }

    @Test
    void testIfRequiresThen() {
        ParseResult result = parse("""
                flows:
                  main:
                    - if: ${x}
                      else:
                        - log: no
                """);

        Diagnostic diagnostic = result.getErrors().get(0);
        assertEquals(DiagnosticKind.MISSING_FIELD, diagnostic.getKind());
        assertEquals("then", diagnostic.getField());
        assertTrue(flow(result, "main").steps().isEmpty());
    }

    @Test
    void testSwitchCasesKeepOrderAndDefaultIsSeparate() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - switch: ${foo}
                      abc:
                        - log: "abc"
                      xyz:
                        - log: "xyz"
                      default:
                        - log: "default"
                      ${foo}:
                        - log: "foo!"
                      123:
                        - log: "123"
                """));

        StepDefinition.Switch switchStep = step.definitionAs(StepDefinition.Switch.class);
        assertEquals("${foo}", switchStep.expression());
        assertEquals(List.of("abc", "xyz", "${foo}", "123"),
                switchStep.cases().stream().map(SwitchCase::label).toList());
        assertTrue(switchStep.hasDefault());
        assertEquals(1, switchStep.defaultSteps().size());
    }

    @Test
    void testSwitchLabelsMayReuseReservedKeys() {
        ParseResult result = parse("""
                flows:
                  main:
                    - name: Route it
                      switch: ${action}
                      call:
                        - call: other
                      return:
                        - return
                      error:
                        - log: "error case"
                      name:
                        - log: "name case"
                      default:
                        - log: "default"
                      meta:
                        owner: ops
                """);

        assertTrue(result.isValid(), () -> result.diagnostics().toString());
        Step step = singleStep(result);
        StepDefinition.Switch switchStep = step.definitionAs(StepDefinition.Switch.class);
        assertEquals(List.of("call", "return", "error", "name"),
                switchStep.cases().stream().map(SwitchCase::label).toList());
        assertTrue(switchStep.hasDefault());
        assertEquals("Route it", step.name());
        assertFalse(step.modifiers().hasErrorHandler());
        assertNotNull(step.modifiers().meta());
    }

    @Test
    void testStepKindBeforeSwitchIsStillAmbiguous() {
        ParseResult result = parse("""
                flows:
                  main:
                    - log: hi
                      switch: ${action}
                      call:
                        - log: x
                """);

        assertEquals(1, result.getErrors().size());
        assertEquals(DiagnosticKind.AMBIGUOUS_STEP, result.getErrors().get(0).getKind());
        assertTrue(result.getErrors().get(0).getMessage().endsWith("log, switch"));
    }

    @Test
    void testSwitchNeedsABranch() {
        ParseResult result = parse("""
                flows:
                  main:
                    - switch: ${foo}
                """);

        Diagnostic diagnostic = result.getErrors().get(0);
        assertEquals(DiagnosticKind.MISSING_FIELD, diagnostic.getKind());
        assertEquals("default", diagnostic.getField());
    }

    @Test
    void testSwitchBranchMustBeSequence() {
        ParseResult result = parse("""
                flows:
                  main:
                    - switch: ${foo}
                      abc: oops
                """);

        assertEquals(DiagnosticKind.MALFORMED_FIELD, result.getErrors().get(0).getKind());
        assertEquals("abc", result.getErrors().get(0).getField());
    }

    @Test
    void testNestedSwitchCasePath() {
        ParseResult result = parse("""
                flows:
                  main:
                    - switch: ${foo}
                      abc:
                        - nothing: here
                """);

        assertEquals("flows.main[0].abc[0]", result.getErrors().get(0).getDocumentPath());
        assertEquals(1, singleStep(result).definitionAs(StepDefinition.Switch.class).cases().size());
    }

    @Test
    void testBlockStructuredKinds() {
        ParseResult result = parse("""
                flows:
                  main:
                    - parallel:
                        - log: a
                        - log: b
                    - block:
                        - log: foo
                    - try:
                        - log: bar
                      error:
                        - log: ${lastError}
                """);

        List<Step> steps = flow(result, "main").steps();
        assertEquals(2, steps.get(0).definitionAs(StepDefinition.Parallel.class).steps().size());
        assertEquals(1, steps.get(1).definitionAs(StepDefinition.Block.class).steps().size());
        assertTrue(steps.get(2).kind().isBlockStructured());
        assertTrue(steps.get(2).modifiers().hasErrorHandler());
    }

    @Test
    void testBlockRequiresSequence() {
        ParseResult result = parse("""
                flows:
                  main:
                    - block: nope
                """);

        assertEquals("'block' must be a sequence, got string", result.getErrors().get(0).getMessage());
    }

    @Test
    void testLogYamlAcceptsAnyValue() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - logYaml:
                        a:
                          b: "c"
                """));

        assertTrue(step.definitionAs(StepDefinition.LogYaml.class).value().isMapping());
    }

    @Test
    void testDefinitionAsWrongType() {
        Step step = singleStep(parse("""
                flows:
                  main:
                    - log: hi
                """));

        assertThrows(IllegalStateException.class, () -> step.definitionAs(StepDefinition.Task.class));
    }
}
