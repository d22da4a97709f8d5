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

import java.util.List;
import java.util.Objects;

/**
 * One labelled branch of a {@code switch} step.
 *
 * @param label    the raw case label, a literal or an expression string
 * @param steps    the branch steps
 * @param position position of the label, may be null
 */
public record SwitchCase(String label, List<Step> steps, SourcePosition position) {

    public SwitchCase {
        Objects.requireNonNull(label, "label");
        steps = List.copyOf(steps);
    }
}
