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
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.SourcePosition;
import dev.mars.flowlang.value.Value;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The document's {@code configuration} block.
 *
 * <p>The block is kept as an opaque mapping. The well-known accessors read through
 * to it and return empty when a key is absent or has an unexpected shape; they
 * never throw.
 *
 * @param values the raw configuration mapping
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record Configuration(MappingValue values) {

    public Configuration {
        Objects.requireNonNull(values, "values");
    }

    public SourcePosition position() {
        return values.position();
    }

    /**
     * @return the raw value under the key, or empty
     */
    public Optional<Value> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> runtime() {
        return scalar("runtime").map(ScalarValue::asString);
    }

    /**
     * @return the dependency URIs, or empty when absent or not a sequence of scalars
     */
    public Optional<List<String>> dependencies() {
        Value value = values.get("dependencies");
        if (!(value instanceof SequenceValue sequence)) {
            return Optional.empty();
        }
        List<String> result = new ArrayList<>(sequence.size());
        for (Value item : sequence.items()) {
            if (!(item instanceof ScalarValue scalar)) {
                return Optional.empty();
            }
            result.add(scalar.asString());
        }
        return Optional.of(List.copyOf(result));
    }

    public Optional<MappingValue> arguments() {
        return mapping("arguments");
    }

    public Optional<Boolean> debug() {
        return scalar("debug").flatMap(ScalarValue::toBoolean);
    }

    /**
     * @return the raw process timeout, e.g. {@code PT15M}
     */
    public Optional<String> processTimeout() {
        return scalar("processTimeout").map(ScalarValue::asString);
    }

    /**
     * @return the process timeout as an ISO-8601 duration, or empty when absent or unparseable
     */
    public Optional<Duration> processTimeoutDuration() {
        Optional<String> raw = processTimeout();
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.parse(raw.get()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public Optional<MappingValue> requirements() {
        return mapping("requirements");
    }

    private Optional<ScalarValue> scalar(String key) {
        Value value = values.get(key);
        return value instanceof ScalarValue scalar && !scalar.isNull() ? Optional.of(scalar) : Optional.empty();
    }

    private Optional<MappingValue> mapping(String key) {
        Value value = values.get(key);
        return value instanceof MappingValue mapping ? Optional.of(mapping) : Optional.empty();
    }
}
