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

import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.model.FormField;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses form field declarations, used for the top-level {@code forms} section
 * and for the field overrides of {@code form} steps.
 *
 * <p>Each item is a single-entry mapping from the field name to its options,
 * which must contain a scalar {@code type}:
 * <pre>
 * - firstName:
 *     type: string
 * - age: { type: int+ }
 * </pre>
 * A malformed field is reported and left out; the other fields are kept.
 */
final class FormFieldParser {

    private static final String TYPE = "type";

    List<FormField> parse(SequenceValue declarations, ParseContext context) {
        List<FormField> fields = new ArrayList<>(declarations.size());
        for (int i = 0; i < declarations.size(); i++) {
            Value item = declarations.get(i);
            FormField field = context.within("[" + i + "]", () -> parseField(item, context));
            if (field != null) {
                fields.add(field);
            }
        }
        return fields;
    }

    private FormField parseField(Value item, ParseContext context) {
        if (!(item instanceof MappingValue mapping) || mapping.size() != 1) {
            context.report(DiagnosticKind.MALFORMED_FORM_FIELD, item.position(),
                    "Form field must be a single-entry mapping of the field name to its options, got "
                            + describe(item));
            return null;
        }

        MappingValue.Entry declaration = mapping.entries().get(0);
        String name = declaration.key();
        if (!(declaration.value() instanceof MappingValue options)) {
            context.report(DiagnosticKind.MALFORMED_FORM_FIELD, declaration.position(), name,
                    "Options of form field '" + name + "' must be a mapping, got " + declaration.value().describe());
            return null;
        }

        Value type = options.get(TYPE);
        if (type == null) {
            context.report(DiagnosticKind.MISSING_FIELD, declaration.position(), TYPE,
                    "The 'type' option is required for form field '" + name + "'");
            return null;
        }
        if (!(type instanceof ScalarValue scalar) || scalar.isNull()) {
            context.report(DiagnosticKind.MALFORMED_FORM_FIELD, type.position(), TYPE,
                    "Type of form field '" + name + "' must be a scalar, got " + type.describe());
            return null;
        }
        return new FormField(name, scalar.asString(), options, declaration.position());
    }

    private static String describe(Value item) {
        if (item instanceof MappingValue mapping) {
            return "mapping with " + mapping.size() + " entries";
        }
        return item.describe();
    }
}
