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
import dev.mars.flowlang.model.Step;
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.SourcePosition;
import dev.mars.flowlang.value.Value;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Shape checks for the keys of one step, modifier or option block.
 *
 * <p>Every failed check reports a diagnostic and marks the reader invalid, so a
 * builder can run all of its checks, then decide once whether it produced a
 * usable result. Failures inside nested step sequences are handled by the
 * {@link StepListParser} and do not invalidate the reader.
 */
final class FieldReader {

    private final ParseContext context;
    private final DiagnosticKind malformedKind;
    private final String fieldPrefix;
    private boolean valid = true;

    FieldReader(ParseContext context, DiagnosticKind malformedKind) {
        this(context, malformedKind, "");
    }

    FieldReader(ParseContext context, DiagnosticKind malformedKind, String fieldPrefix) {
        this.context = context;
        this.malformedKind = malformedKind;
        this.fieldPrefix = fieldPrefix;
    }

    boolean isValid() {
        return valid;
    }

    /**
     * Marks the reader invalid without a diagnostic of its own, for failures
     * already reported by a nested reader.
     */
    void invalidate() {
        valid = false;
    }

    ParseContext context() {
        return context;
    }

    String qualified(String field) {
        return fieldPrefix + field;
    }

    void fail(DiagnosticKind kind, SourcePosition position, String field, String message) {
        valid = false;
        context.report(kind, position, qualified(field), message);
    }

    void malformed(Value value, String field, String expectation) {
        fail(malformedKind, value.position(), field,
                "'" + qualified(field) + "' must be " + expectation + ", got " + value.describe());
    }

    void missing(SourcePosition position, String field, String message) {
        fail(DiagnosticKind.MISSING_FIELD, position, field, message);
    }

    void unknown(MappingValue.Entry entry, String owner) {
        fail(DiagnosticKind.UNKNOWN_FIELD, entry.position(), entry.key(),
                "Unexpected " + owner + " element '" + entry.key() + "'");
    }

    /**
     * @return the string form of a non-null scalar, or null after reporting
     */
    String text(Value value, String field) {
        if (value instanceof ScalarValue scalar && !scalar.isNull()) {
            return scalar.asString();
        }
        malformed(value, field, "a scalar");
        return null;
    }

    MappingValue mapping(Value value, String field) {
        if (value instanceof MappingValue mapping) {
            return mapping;
        }
        malformed(value, field, "a mapping");
        return null;
    }

    SequenceValue sequence(Value value, String field) {
        if (value instanceof SequenceValue sequence) {
            return sequence;
        }
        malformed(value, field, "a sequence");
        return null;
    }

    Boolean bool(Value value, String field) {
        if (value instanceof ScalarValue scalar && scalar.toBoolean().isPresent()) {
            return scalar.toBoolean().get();
        }
        malformed(value, field, "a boolean");
        return null;
    }

    /**
     * @return the integer value if it lies within [min, Integer.MAX_VALUE], otherwise null after reporting
     */
    Integer integer(Value value, String field, int min) {
        if (value instanceof ScalarValue scalar) {
            OptionalLong number = scalar.toLong();
            if (number.isPresent() && number.getAsLong() >= min && number.getAsLong() <= Integer.MAX_VALUE) {
                return (int) number.getAsLong();
            }
        }
        malformed(value, field, min > 0 ? "a positive integer" : "a non-negative integer");
        return null;
    }

    Double number(Value value, String field) {
        if (value instanceof ScalarValue scalar) {
            OptionalDouble number = scalar.toDouble();
            if (number.isPresent() && number.getAsDouble() >= 0 && !Double.isInfinite(number.getAsDouble())) {
                return number.getAsDouble();
            }
        }
        malformed(value, field, "a non-negative number");
        return null;
    }

    /**
     * Parses a nested step sequence through the shared {@link StepListParser}.
     *
     * @param segment document path segment for the nested steps, e.g. {@code then}
     */
    List<Step> steps(Value value, String field, String segment) {
        SequenceValue sequence = sequence(value, field);
        if (sequence == null) {
            return null;
        }
        return context.within(segment, () -> context.stepListParser().parse(sequence, context));
    }

    List<Step> steps(Value value, String field) {
        return steps(value, field, field);
    }
}
