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

import java.util.Objects;

/**
 * A form field declaration.
 *
 * <p>The type descriptor is stored raw (e.g. {@code int+}); {@link #baseType()}
 * and {@link #required()} expose its parsed form. The type vocabulary is open
 * ended and is not validated here.
 *
 * @param name     the field name
 * @param type     the raw type descriptor
 * @param options  every option of the field, {@code type} included, in declaration order
 * @param position position of the field name, may be null
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record FormField(String name, String type, MappingValue options, SourcePosition position) {

    private static final char REQUIRED_SUFFIX = '+';

    public FormField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        options = options != null ? options : MappingValue.empty();
    }

    public FormField(String name, String type) {
        this(name, type, null, null);
    }

    /**
     * @return the type descriptor without its {@code +} suffix
     */
    public String baseType() {
        return required() ? type.substring(0, type.length() - 1) : type;
    }

    public boolean required() {
        return !type.isEmpty() && type.charAt(type.length() - 1) == REQUIRED_SUFFIX;
    }
}
