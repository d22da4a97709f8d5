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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of values.
 *
 * @param items    the items in source order
 * @param position source position, may be null
 */
public record SequenceValue(List<Value> items, SourcePosition position) implements Value {

    public SequenceValue {
        Objects.requireNonNull(items, "Sequence items cannot be null");
        items = List.copyOf(items);
    }

    public static SequenceValue of(Value... items) {
        return new SequenceValue(Arrays.asList(items), null);
    }

    public static SequenceValue of(List<? extends Value> items) {
        return new SequenceValue(List.copyOf(items), null);
    }

    public SequenceValue withPosition(SourcePosition newPosition) {
        return new SequenceValue(items, newPosition);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Value get(int index) {
        return items.get(index);
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
