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

import java.util.Objects;

/**
 * Where a script step gets its source text from.
 */
public sealed interface ScriptBody permits ScriptBody.Inline, ScriptBody.External {

    /**
     * @param text the script text given in the {@code body} key
     */
    record Inline(String text) implements ScriptBody {
        public Inline {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * @param reference path of a script resource, e.g. {@code scripts/hello.js}
     */
    record External(String reference) implements ScriptBody {
        public External {
            Objects.requireNonNull(reference, "reference");
        }
    }
}
