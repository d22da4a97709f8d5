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
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * Builder for {@code if} steps: a condition, a required {@code then} branch and
 * an optional {@code else} branch.
 */
final class IfStepBuilder implements StepBuilder {

    @Override
    public StepKind getKind() {
        return StepKind.IF;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return "then".equals(key) || "else".equals(key);
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_FIELD);
        String condition = reader.text(source.value(), "if");

        Value thenValue = source.sibling("then");
        List<Step> thenSteps = null;
        if (thenValue == null) {
            reader.missing(source.step().position(), "then", "The 'then' branch is required in an 'if' step");
        } else {
            thenSteps = reader.steps(thenValue, "then");
        }

        Value elseValue = source.sibling("else");
        List<Step> elseSteps = elseValue != null ? reader.steps(elseValue, "else") : null;

        if (!reader.isValid()) {
            return Optional.empty();
        }
        return Optional.of(new StepDefinition.If(condition, thenSteps, elseSteps));
    }
}
