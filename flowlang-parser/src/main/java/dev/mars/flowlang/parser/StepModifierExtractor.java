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
import dev.mars.flowlang.model.Loop;
import dev.mars.flowlang.model.LoopMode;
import dev.mars.flowlang.model.Modifiers;
import dev.mars.flowlang.model.Output;
import dev.mars.flowlang.model.Retry;
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the modifiers shared by all step variants out of a step mapping.
 *
 * <p>Each modifier is validated independently; a malformed modifier is reported
 * and makes the extraction invalid, but the remaining modifiers are still
 * checked. The keys that are not modifiers are handed back, in source order,
 * for variant dispatch.
 *
 * <p>Keys following a {@code switch} key are case labels, so only {@code meta}
 * is still read as a modifier there.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
final class StepModifierExtractor {

    /**
     * @param modifiers the extracted modifiers, meaningful only when {@code valid}
     * @param remaining the non-modifier entries in source order
     * @param valid     false if any modifier was malformed
     */
    record Extraction(Modifiers modifiers, List<MappingValue.Entry> remaining, boolean valid) {
    }

    Extraction extract(MappingValue step, ParseContext context) {
        FieldReader reader = new FieldReader(context, DiagnosticKind.MALFORMED_MODIFIER);
        List<MappingValue.Entry> remaining = new ArrayList<>();

        String name = null;
        MappingValue meta = null;
        MappingValue input = null;
        Output output = null;
        List<Step> error = null;
        boolean ignoreErrors = false;
        Loop loop = null;
        Retry retry = null;
        boolean caseLabels = false;

        for (MappingValue.Entry entry : step.entries()) {
            Value value = entry.value();
            if (caseLabels && !"meta".equals(entry.key())) {
                remaining.add(entry);
                continue;
            }
            caseLabels = caseLabels || opensCaseLabels(entry.key());
            switch (entry.key()) {
                case "name":
                    if (!(value instanceof ScalarValue scalar && scalar.isNull())) {
                        name = reader.text(value, "name");
                    }
                    break;
                case "meta":
                    meta = reader.mapping(value, "meta");
                    break;
                case "in":
                    input = reader.mapping(value, "in");
                    break;
                case "out":
                    output = parseOutput(value, reader);
                    break;
                case "error":
                    error = reader.steps(value, "error");
                    break;
                case "ignoreErrors":
                    Boolean flag = reader.bool(value, "ignoreErrors");
                    ignoreErrors = flag != null && flag;
                    break;
                case "loop":
                    loop = context.within("loop", () -> parseLoop(value, reader));
                    break;
                case "retry":
                    retry = context.within("retry", () -> parseRetry(value, reader));
                    break;
                default:
                    remaining.add(entry);
            }
        }

        Modifiers modifiers = new Modifiers(name, meta, input, output, error, ignoreErrors, loop, retry);
        return new Extraction(modifiers, remaining, reader.isValid());
    }

    static boolean opensCaseLabels(String key) {
        return StepKind.SWITCH.key().equals(key);
    }

    private Output parseOutput(Value value, FieldReader reader) {
        if (value instanceof ScalarValue scalar && !scalar.isNull()) {
            return new Output.Single(scalar.asString());
        }
        if (value instanceof SequenceValue sequence) {
            List<String> names = new ArrayList<>(sequence.size());
            for (Value item : sequence.items()) {
                if (!(item instanceof ScalarValue scalar) || scalar.isNull()) {
                    reader.malformed(item, "out", "a list of variable names");
                    return null;
                }
                names.add(scalar.asString());
            }
            return new Output.Names(names);
        }
        if (value instanceof MappingValue mapping) {
            List<Output.Binding> bindings = new ArrayList<>(mapping.size());
            for (MappingValue.Entry entry : mapping.entries()) {
                bindings.add(new Output.Binding(entry.key(), entry.value()));
            }
            return new Output.Bindings(bindings);
        }
        reader.malformed(value, "out", "a variable name, a list of names or a mapping");
        return null;
    }

    private Loop parseLoop(Value value, FieldReader stepReader) {
        MappingValue mapping = stepReader.mapping(value, "loop");
        if (mapping == null) {
            return null;
        }
        FieldReader reader = new FieldReader(stepReader.context(), DiagnosticKind.MALFORMED_MODIFIER, "loop.");
        Value items = null;
        LoopMode mode = LoopMode.SERIAL;
        Integer parallelism = null;

        for (MappingValue.Entry entry : mapping.entries()) {
            Value option = entry.value();
            switch (entry.key()) {
                case "items":
                    if (option instanceof SequenceValue
                            || (option instanceof ScalarValue scalar && !scalar.isNull())) {
                        items = option;
                    } else {
                        reader.malformed(option, "items", "a sequence or an expression");
                    }
                    break;
                case "mode":
                    mode = parseLoopMode(option, reader);
                    break;
                case "parallelism":
                    parallelism = reader.integer(option, "parallelism", 1);
                    break;
                default:
                    reader.unknown(entry, "loop");
            }
        }

        if (items == null && !mapping.containsKey("items")) {
            reader.missing(mapping.position(), "items", "The 'items' field is required in the loop");
        }
        if (!reader.isValid()) {
            stepReader.invalidate();
            return null;
        }
        return new Loop(items, mode, parallelism, mapping.position());
    }

    private LoopMode parseLoopMode(Value value, FieldReader reader) {
        String mode = reader.text(value, "mode");
        if (mode == null) {
            return LoopMode.SERIAL;
        }
        return LoopMode.fromKey(mode).orElseGet(() -> {
            reader.fail(DiagnosticKind.INVALID_ENUM, value.position(), "mode",
                    "Unexpected loop mode '" + mode + "'. Only 'parallel' and 'serial' are supported.");
            return LoopMode.SERIAL;
        });
    }

    private Retry parseRetry(Value value, FieldReader stepReader) {
        MappingValue mapping = stepReader.mapping(value, "retry");
        if (mapping == null) {
            return null;
        }
        FieldReader reader = new FieldReader(stepReader.context(), DiagnosticKind.MALFORMED_MODIFIER, "retry.");
        Integer times = 0;
        Double delay = 0.0;
        MappingValue input = null;

        for (MappingValue.Entry entry : mapping.entries()) {
            Value option = entry.value();
            switch (entry.key()) {
                case "times":
                    times = reader.integer(option, "times", 0);
                    break;
                case "delay":
                    delay = reader.number(option, "delay");
                    break;
                case "in":
                    input = reader.mapping(option, "in");
                    break;
                default:
                    reader.unknown(entry, "retry");
            }
        }

        if (!reader.isValid()) {
            stepReader.invalidate();
            return null;
        }
        return new Retry(times, delay, input, mapping.position());
    }
}
