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

import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;

import java.util.Optional;

/**
 * Builder for {@code logYaml} steps. The value is rendered at execution time,
 * so any value shape is accepted as is.
 */
final class LogYamlStepBuilder implements StepBuilder {

    @Override
    public StepKind getKind() {
        return StepKind.LOG_YAML;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return false;
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        return Optional.of(new StepDefinition.LogYaml(source.value()));
    }
}
