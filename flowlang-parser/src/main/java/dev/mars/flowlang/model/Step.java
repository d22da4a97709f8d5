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

import dev.mars.flowlang.value.SourcePosition;

import java.util.Objects;

/**
 * One instruction of a flow: exactly one variant plus the shared modifiers.
 *
 * @param definition the variant payload
 * @param modifiers  the shared modifiers, {@link Modifiers#NONE} when none are set
 * @param position   position of the step mapping, may be null
 */
public record Step(StepDefinition definition, Modifiers modifiers, SourcePosition position) {

    public Step {
        Objects.requireNonNull(definition, "definition");
        modifiers = modifiers != null ? modifiers : Modifiers.NONE;
    }

    public StepKind kind() {
        return definition.kind();
    }

    /**
     * @return the display name, or null when the step has none
     */
    public String name() {
        return modifiers.name();
    }

    /**
     * Returns the variant payload cast to the expected record type.
     *
     * @throws IllegalStateException if the step is of a different variant
     */
    public <T extends StepDefinition> T definitionAs(Class<T> type) {
        if (!type.isInstance(definition)) {
            throw new IllegalStateException("Step is a " + definition.kind().key()
                    + " step, not " + type.getSimpleName());
        }
        return type.cast(definition);
    }
}
