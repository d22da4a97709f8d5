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

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builder for variants whose payload is a single nested step sequence:
 * {@code parallel}, {@code block} and {@code try}.
 */
final class BlockStepBuilder implements StepBuilder {

    private final StepKind kind;
    private final Function<List<Step>, StepDefinition> factory;

    BlockStepBuilder(StepKind kind, Function<List<Step>, StepDefinition> factory) {
        this.kind = kind;
        this.factory = factory;
    }

    @Override
    public StepKind getKind() {
        return kind;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return false;
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_FIELD);
        List<Step> steps = reader.steps(source.value(), kind.key());
        return steps != null ? Optional.of(factory.apply(steps)) : Optional.empty();
    }
}
