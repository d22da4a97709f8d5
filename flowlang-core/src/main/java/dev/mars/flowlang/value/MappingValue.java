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

package dev.mars.flowlang.value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered mapping with unique string keys.
 *
 * <p>Entries are kept as an explicit list so that declaration order survives,
 * which matters for switch case labels, {@code out} bindings and form fields.
 * Non-string keys of the source document (e.g. {@code 123:}) are represented by
 * their source text.
 *
 * @param entries  the entries in source order
 * @param position source position, may be null
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record MappingValue(List<Entry> entries, SourcePosition position) implements Value {

    public MappingValue {
        Objects.requireNonNull(entries, "Mapping entries cannot be null");
        entries = List.copyOf(entries);
        Set<String> seen = new HashSet<>();
        for (Entry entry : entries) {
            if (!seen.add(entry.key())) {
                throw new IllegalArgumentException("Duplicate mapping key: " + entry.key());
            }
        }
    }

    public static MappingValue empty() {
        return new MappingValue(List.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public MappingValue withPosition(SourcePosition newPosition) {
        return new MappingValue(entries, newPosition);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean containsKey(String key) {
        return entry(key).isPresent();
    }

    /**
     * @return the value stored under the key, or {@code null} if there is none
     */
    public Value get(String key) {
        return entry(key).map(Entry::value).orElse(null);
    }

    public Optional<Entry> entry(String key) {
        for (Entry entry : entries) {
            if (entry.key().equals(key)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            keys.add(entry.key());
        }
        return keys;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(entries.get(i).key()).append('=').append(entries.get(i).value());
        }
        return sb.append('}').toString();
    }

    /**
     * A single key/value pair of a mapping.
     *
     * @param key         the key text
     * @param value       the value
     * @param keyPosition position of the key, may be null
     */
    public record Entry(String key, Value value, SourcePosition keyPosition) {

        public Entry {
            Objects.requireNonNull(key, "Entry key cannot be null");
            Objects.requireNonNull(value, "Entry value cannot be null");
        }

        public Entry(String key, Value value) {
            this(key, value, null);
        }

        /**
         * Position of the key when known, otherwise the position of the value.
         */
        public SourcePosition position() {
            return keyPosition != null ? keyPosition : value.position();
        }
    }

    /**
     * Builds mappings in code, mostly for hosts and tests that do not go through a decoder.
     */
    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();
        private SourcePosition position;

        private Builder() {
        }

        public Builder put(String key, Value value) {
            entries.add(new Entry(key, value));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, ScalarValue.of(value));
        }

        public Builder position(SourcePosition position) {
            this.position = position;
            return this;
        }

        public MappingValue build() {
            return new MappingValue(entries, position);
        }
    }
}
