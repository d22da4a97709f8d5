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
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.SequenceValue;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builder for {@code form} steps. Field overrides go through the same
 * {@link FormFieldParser} as the top-level {@code forms} section.
 */
final class FormCallStepBuilder implements StepBuilder {

    private static final Set<String> OPTIONS = Set.of("fields", "values", "runAs", "yield", "saveSubmittedBy");

    @Override
    public StepKind getKind() {
        return StepKind.FORM;
    }

    @Override
    public boolean acceptsSiblingKey(String key) {
        return OPTIONS.contains(key);
    }

    @Override
    public Optional<StepDefinition> build(StepSource source, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_FIELD);
        String formName = reader.text(source.value(), "form");

        List<FormField> fields = List.of();
        MappingValue values = null;
        MappingValue runAs = null;
        Boolean yieldExecution = null;
        Boolean saveSubmittedBy = null;

        for (MappingValue.Entry entry : source.siblings()) {
            switch (entry.key()) {
                case "fields":
                    SequenceValue declared = reader.sequence(entry.value(), "fields");
                    if (declared != null) {
                        fields = context.within("fields",
                                () -> context.formFieldParser().parse(declared, context));
                    }
                    break;
                case "values":
                    values = reader.mapping(entry.value(), "values");
                    break;
                case "runAs":
                    runAs = reader.mapping(entry.value(), "runAs");
                    break;
                case "yield":
                    yieldExecution = reader.bool(entry.value(), "yield");
                    break;
                case "saveSubmittedBy":
                    saveSubmittedBy = reader.bool(entry.value(), "saveSubmittedBy");
                    break;
                default:
                    break;
            }
        }

        if (!reader.isValid()) {
            return Optional.empty();
        }
        context.addFormReference(formName, source.value().position());
        return Optional.of(new StepDefinition.FormCall(formName, fields, values, runAs, yieldExecution, saveSubmittedBy));
    }
}
