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
import dev.mars.flowlang.value.Value;

import java.util.Objects;

/**
 * The {@code loop} modifier.
 *
 * @param items       a literal sequence or an expression scalar
 * @param mode        the loop mode, {@link LoopMode#SERIAL} unless declared
 * @param parallelism maximum concurrent iterations, or null for unbounded
 * @param position    position of the {@code loop} mapping, may be null
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record Loop(Value items, LoopMode mode, Integer parallelism, SourcePosition position) {

    public Loop {
        Objects.requireNonNull(items, "items");
        mode = mode != null ? mode : LoopMode.SERIAL;
        if (parallelism != null && parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
    }

    public boolean isParallel() {
        return mode == LoopMode.PARALLEL;
    }
}
