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

import java.util.Optional;

/**
 * A node of the generic document tree handed to the flow parser.
 *
 * <p>The tree has exactly three node kinds:
 * <ul>
 *   <li>{@link ScalarValue}: string, integer, float, boolean or null</li>
 *   <li>{@link SequenceValue}: an ordered list of values</li>
 *   <li>{@link MappingValue}: an ordered list of unique-key entries</li>
 * </ul>
 *
 * <p>Every node may carry the {@link SourcePosition} it was read from. Nodes are
 * immutable; the parser only ever reads them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public sealed interface Value permits ScalarValue, SequenceValue, MappingValue {

    /**
     * @return the source position, or {@code null} when the node was built in code
     */
    SourcePosition position();

    default Optional<SourcePosition> sourcePosition() {
        return Optional.ofNullable(position());
    }

    default boolean isScalar() {
        return this instanceof ScalarValue;
    }

    default boolean isSequence() {
        return this instanceof SequenceValue;
    }

    default boolean isMapping() {
        return this instanceof MappingValue;
    }

    /**
     * Short human readable name of the node kind, used in diagnostics.
     */
    default String describe() {
        if (this instanceof ScalarValue scalar) {
            return scalar.type().description();
        }
        return isSequence() ? "sequence" : "mapping";
    }
}
