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
import java.util.Optional;

/**
 * A reusable named set of input fields.
 *
 * @param name     the form name
 * @param fields   the fields in declaration order
 * @param position position of the form name, may be null
 */
public record Form(String name, List<FormField> fields, SourcePosition position) {

    public Form {
        Objects.requireNonNull(name, "name");
        fields = List.copyOf(fields);
    }

    public Optional<FormField> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }
}
