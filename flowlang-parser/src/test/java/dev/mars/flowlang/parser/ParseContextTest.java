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

import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.SourcePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-call parse state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-05
 */
class ParseContextTest {

    private ParseContext context;

    @BeforeEach
    void setUp() {
        context = new ParseContext(ParserOptions.defaults().withMaxNestingDepth(2), null, null);
    }

    @Test
    void testPathFormatting() {
        assertEquals("", context.currentPath());

        context.enter("flows");
        context.enter("main");
        context.enter("[2]");
        context.enter("then");
        context.enter("[0]");

        assertEquals("flows.main[2].then[0]", context.currentPath());

        context.leave();
        context.leave();
        assertEquals("flows.main[2]", context.currentPath());
    }

    @Test
    void testWithinRestoresPathOnException() {
        context.enter("flows");

        assertThrows(IllegalStateException.class, () -> context.within("main", () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("flows", context.currentPath());
    }

    @Test
    void testReportUsesCurrentPath() {
        context.within("flows", () -> {
            context.report(DiagnosticKind.MALFORMED_STEP, SourcePosition.of(1, 1), "msg");
            return null;
        });

        assertEquals("flows", context.diagnostics().getAll().get(0).getDocumentPath());
    }

    @Test
    void testNestingGuard() {
        assertTrue(context.enterNesting());
        assertTrue(context.enterNesting());
        assertFalse(context.enterNesting());
        assertEquals(2, context.depth());

        context.leaveNesting();
        assertTrue(context.enterNesting());
    }

    @Test
    void testCounters() {
        context.rejectSteps(2);
        context.rejectSteps(1);
        context.countStep(StepKind.LOG);
        context.countStep(StepKind.LOG);
        context.countStep(StepKind.IF);

        assertEquals(3, context.rejectedSteps());
        assertEquals(2, context.stepCounts().get(StepKind.LOG));
        assertEquals(1, context.stepCounts().get(StepKind.IF));
    }

    @Test
    void testFormReferencesRememberPath() {
        context.within("flows", () -> {
            context.addFormReference("myForm", SourcePosition.of(4, 13));
            return null;
        });

        ParseContext.FormReference reference = context.formReferences().get(0);
        assertEquals("myForm", reference.formName());
        assertEquals("flows", reference.documentPath());
    }
}
