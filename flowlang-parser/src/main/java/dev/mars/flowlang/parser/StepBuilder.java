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
 * Builds the payload of one step variant.
 * Implementations validate their own sub-fields and recurse into the
 * {@link StepListParser} for nested step sequences.
 */
interface StepBuilder {

    /**
     * Get the variant this builder produces
     */
    StepKind getKind();

    /**
     * Check if a non-modifier key may appear next to the discriminant key
     */
    boolean acceptsSiblingKey(String key);

    /**
     * Build the variant payload
     *
     * @param source  the step mapping with its discriminant and sibling entries
     * @param context the parse context diagnostics are reported to
     * @return the payload, or empty if the step's own fields are invalid
     */
    Optional<StepDefinition> build(StepSource source, ParseContext context);
}
