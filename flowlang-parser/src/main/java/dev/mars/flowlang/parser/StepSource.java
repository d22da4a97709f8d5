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

import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.Value;

import java.util.List;

/**
 * A step mapping as seen by a {@link StepBuilder}.
 *
 * @param step         the full step mapping, modifiers included
 * @param discriminant the entry whose key selected the variant
 * @param siblings     the other non-modifier entries, in source order
 */
record StepSource(MappingValue step, MappingValue.Entry discriminant, List<MappingValue.Entry> siblings) {

    StepSource {
        siblings = List.copyOf(siblings);
    }

    Value value() {
        return discriminant.value();
    }

    /**
     * @return the sibling value stored under the key, or null
     */
    Value sibling(String key) {
        for (MappingValue.Entry entry : siblings) {
            if (entry.key().equals(key)) {
                return entry.value();
            }
        }
        return null;
    }
}
