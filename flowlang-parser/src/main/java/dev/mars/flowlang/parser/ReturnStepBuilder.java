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
 * Builder for {@code return} steps. Whatever follows the key is ignored, so
 * {@code return:} and {@code return: null} are equally valid.
 */
final class ReturnStepBuilder implements StepBuilder {

    static final StepDefinition.Return RETURN = new StepDefinition.Return();

    @Override
    public StepKind getKind() {
        return StepKind.RETURN;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return false;
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        return Optional.of(RETURN);
    }
}
