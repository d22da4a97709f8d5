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
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a sequence of steps. This is the single recursive entry point: flow
 * bodies, {@code error} handlers and every block-structured variant come back
 * here for their nested steps.
 *
 * <p>A step that cannot be parsed is reported, counted as rejected and left
 * out; its siblings are still parsed. Nesting deeper than
 * {@link ParserOptions#maxNestingDepth()} is cut off with a single diagnostic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
final class StepListParser {

    private static final String BARE_RETURN = "return";

    private final StepModifierExtractor modifierExtractor;
    private final StepVariantDispatcher dispatcher;

    StepListParser(StepModifierExtractor modifierExtractor, StepVariantDispatcher dispatcher) {
        this.modifierExtractor = modifierExtractor;
        this.dispatcher = dispatcher;
    }

    /**
     * @return the parsed steps in source order, never null
     */
    List<Step> parse(SequenceValue sequence, ParseContext context) {
        if (!context.enterNesting()) {
            context.report(DiagnosticKind.NESTING_TOO_DEEP, sequence.position(),
                    "Steps are nested deeper than " + context.options().maxNestingDepth() + " levels");
            context.rejectSteps(sequence.size());
            return List.of();
        }
        try {
            List<Step> steps = new ArrayList<>(sequence.size());
            for (int i = 0; i < sequence.size(); i++) {
                Value item = sequence.get(i);
                Optional<Step> step = context.within("[" + i + "]", () -> parseStep(item, context));
                if (step.isPresent()) {
                    steps.add(step.get());
                } else {
                    context.rejectSteps(1);
                }
            }
            return steps;
        } finally {
            context.leaveNesting();
        }
    }

    private Optional<Step> parseStep(Value item, ParseContext context) {
        if (item instanceof ScalarValue scalar && scalar.isString() && BARE_RETURN.equals(scalar.text())) {
            context.countStep(ReturnStepBuilder.RETURN.kind());
            return Optional.of(new Step(ReturnStepBuilder.RETURN, null, scalar.position()));
        }
        if (!(item instanceof MappingValue mapping)) {
            context.report(DiagnosticKind.MALFORMED_STEP, item.position(),
                    "Step must be a mapping, got " + item.describe());
            return Optional.empty();
        }
        StepModifierExtractor.Extraction extraction = modifierExtractor.extract(mapping, context);
        Optional<StepDefinition> definition = dispatcher.dispatch(mapping, extraction.remaining(), context);
        if (!extraction.valid() || definition.isEmpty()) {
            return Optional.empty();
        }

        context.countStep(definition.get().kind());
        return Optional.of(new Step(definition.get(), extraction.modifiers(), mapping.position()));
    }
}
