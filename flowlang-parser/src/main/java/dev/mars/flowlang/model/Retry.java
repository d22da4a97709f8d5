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

import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.SourcePosition;

/**
 * The {@code retry} modifier.
 *
 * @param times    number of retries, 0 when not declared
 * @param delay    delay between attempts, 0 when not declared
 * @param input    input overrides applied to retried attempts only, or null
 * @param position position of the {@code retry} mapping, may be null
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record Retry(int times, double delay, MappingValue input, SourcePosition position) {

    public Retry {
        if (times < 0) {
            throw new IllegalArgumentException("Retry times cannot be negative: " + times);
        }
        if (delay < 0 || Double.isNaN(delay)) {
            throw new IllegalArgumentException("Retry delay cannot be negative: " + delay);
        }
    }

    public boolean hasInputOverrides() {
        return input != null;
    }
}
