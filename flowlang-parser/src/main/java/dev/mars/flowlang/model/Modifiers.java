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

import java.util.List;

/**
 * Cross-cutting options attachable to any step variant. Absent modifiers are null,
 * except {@code ignoreErrors} which defaults to false.
 *
 * @param name         display label
 * @param meta         opaque annotations, never interpreted
 * @param input        call-time input bindings ({@code in})
 * @param output       result bindings ({@code out})
 * @param error        the error handler steps
 * @param ignoreErrors whether errors of the step are ignored
 * @param loop         loop options
 * @param retry        retry options
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record Modifiers(String name,
                        MappingValue meta,
                        MappingValue input,
                        Output output,
                        List<Step> error,
                        boolean ignoreErrors,
                        Loop loop,
                        Retry retry) {

    public static final Modifiers NONE = new Modifiers(null, null, null, null, null, false, null, null);

    public Modifiers {
        error = error != null ? List.copyOf(error) : null;
    }

    public boolean hasErrorHandler() {
        return error != null;
    }

    public boolean isEmpty() {
        return equals(NONE);
    }
}
