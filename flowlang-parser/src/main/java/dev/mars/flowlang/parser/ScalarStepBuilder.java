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
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;

import java.util.Optional;
import java.util.function.Function;

/**
 * Builder for variants whose whole payload is the scalar under the
 * discriminant key: {@code log}, {@code throw}, {@code expr}, {@code task},
 * {@code call}, {@code checkpoint} and {@code suspend}.
 */
final class ScalarStepBuilder implements StepBuilder {

    private final StepKind kind;
    private final Function<String, StepDefinition> factory;

    ScalarStepBuilder(StepKind kind, Function<String, StepDefinition> factory) {
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
        String text = reader.text(source.value(), kind.key());
        return text != null ? Optional.of(factory.apply(text)) : Optional.empty();
    }
}
