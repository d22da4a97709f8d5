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
import dev.mars.flowlang.model.SwitchCase;
import dev.mars.flowlang.value.MappingValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builder for {@code switch} steps.
 *
 * <p>Every sibling key is a case label, kept verbatim and in source order,
 * except {@code default}, which holds the fallback branch. Labels are not
 * interpreted, so {@code 123} and {@code ${foo}} are plain labels too.
 */
final class SwitchStepBuilder implements StepBuilder {

    static final String DEFAULT = "default";

    @Override
    public StepKind getKind() {
        return StepKind.SWITCH;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return true;
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_FIELD);
        String expression = reader.text(source.value(), "switch");

        List<SwitchCase> cases = new ArrayList<>();
        List<Step> defaultSteps = null;

        for (MappingValue.Entry entry : source.siblings()) {
            List<Step> steps = reader.steps(entry.value(), entry.key());
            if (steps == null) {
                continue;
            }
            if (DEFAULT.equals(entry.key())) {
                defaultSteps = steps;
            } else {
                cases.add(new SwitchCase(entry.key(), steps, entry.position()));
            }
        }

        if (reader.isValid() && cases.isEmpty() && defaultSteps == null) {
            reader.missing(source.step().position(), DEFAULT,
                    "A 'switch' step needs at least one case or a 'default' branch");
        }
        if (!reader.isValid()) {
            return Optional.empty();
        }
        return Optional.of(new StepDefinition.Switch(expression, cases, defaultSteps));
    }
}
