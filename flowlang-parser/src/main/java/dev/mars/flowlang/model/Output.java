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

import dev.mars.flowlang.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * The {@code out} modifier. Three source shapes are accepted:
 * <ul>
 *   <li>{@code out: result}: {@link Single}</li>
 *   <li>{@code out: [x, y]}: {@link Names}</li>
 *   <li>{@code out: {result: ${expr}}}: {@link Bindings}, in declaration order</li>
 * </ul>
 */
public sealed interface Output permits Output.Single, Output.Names, Output.Bindings {

    /**
     * @return the names of all variables this output writes, in declaration order
     */
    List<String> variableNames();

    record Single(String name) implements Output {
        public Single {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public List<String> variableNames() {
            return List.of(name);
        }
    }

    record Names(List<String> names) implements Output {
        public Names {
            names = List.copyOf(names);
        }

        @Override
        public List<String> variableNames() {
            return names;
        }
    }

    record Bindings(List<Binding> bindings) implements Output {
        public Bindings {
            bindings = List.copyOf(bindings);
        }

        @Override
        public List<String> variableNames() {
            return bindings.stream().map(Binding::name).toList();
        }
    }

    /**
     * @param name       the variable to assign
     * @param expression the value, usually an expression string, kept opaque
     */
    record Binding(String name, Value expression) {
        public Binding {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(expression, "expression");
        }
    }
}
