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
import dev.mars.flowlang.model.StepDefinition;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.MappingValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the variant of a step from the discriminant key among its
 * non-modifier entries and hands the step to the matching builder.
 *
 * <p>Exactly one discriminant must be present. Any other key left over must be
 * a sibling the selected builder accepts, such as {@code then} for {@code if}.
 * Keys after a {@code switch} key are case labels and never count as discriminants.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
final class StepVariantDispatcher {

    private final StepBuilderRegistry registry;

    StepVariantDispatcher(StepBuilderRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param step      the whole step mapping
     * @param remaining the entries left after modifier extraction, in source order
     * @return the variant payload, or empty after reporting why none could be built
     */
    Optional<StepDefinition> dispatch(MappingValue step, List<MappingValue.Entry> remaining, ParseContext context) {
        List<MappingValue.Entry> discriminants = new ArrayList<>();
        for (MappingValue.Entry entry : remaining) {
            if (StepKind.isDiscriminant(entry.key())) {
                discriminants.add(entry);
            }
            if (StepModifierExtractor.opensCaseLabels(entry.key())) {
                break;
            }
        }

        if (discriminants.isEmpty()) {
            context.report(DiagnosticKind.MISSING_DISCRIMINANT, step.position(),
                    "Step has no known step type, found keys: " + keysOf(step.entries()));
            return Optional.empty();
        }
        if (discriminants.size() > 1) {
            context.report(DiagnosticKind.AMBIGUOUS_STEP, discriminants.get(1).position(),
                    "Step declares more than one step type: " + keysOf(discriminants));
            return Optional.empty();
        }

        MappingValue.Entry discriminant = discriminants.get(0);
        StepKind kind = StepKind.fromKey(discriminant.key()).orElseThrow();
        StepBuilder builder = registry.getBuilder(kind);

        List<MappingValue.Entry> siblings = new ArrayList<>();
        boolean valid = true;
        for (MappingValue.Entry entry : remaining) {
            if (entry == discriminant) {
                continue;
            }
            if (builder.acceptsSiblingKey(entry.key())) {
                siblings.add(entry);
            } else {
                context.report(DiagnosticKind.UNKNOWN_FIELD, entry.position(), entry.key(),
                        "Unexpected " + kind.key() + " step element '" + entry.key() + "'");
                valid = false;
            }
        }
        if (!valid) {
            return Optional.empty();
        }

        return builder.build(new StepSource(step, discriminant, siblings), context);
    }

    private static String keysOf(List<MappingValue.Entry> entries) {
        if (entries.isEmpty()) {
            return "none";
        }
        return entries.stream().map(MappingValue.Entry::key).collect(Collectors.joining(", "));
    }
}
