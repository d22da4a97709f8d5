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

import java.util.Optional;

/**
 * The step variants of the flow language, each identified by the discriminant
 * key whose presence in a step mapping selects it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public enum StepKind {
    LOG("log"),
    LOG_YAML("logYaml"),
    THROW("throw"),
    RETURN("return"),
    SET("set"),
    EXPR("expr"),
    TASK("task"),
    SCRIPT("script"),
    CALL("call"),
    CHECKPOINT("checkpoint"),
    SUSPEND("suspend"),
    FORM("form"),
    IF("if"),
    SWITCH("switch"),
    PARALLEL("parallel"),
    BLOCK("block"),
    TRY("try");

    private final String key;

    StepKind(String key) {
        this.key = key;
    }

    /**
     * @return the discriminant key, e.g. {@code logYaml}
     */
    public String key() {
        return key;
    }

    /**
     * Whether the variant owns nested step sequences.
     */
    public boolean isBlockStructured() {
        return this == IF || this == SWITCH || this == PARALLEL || this == BLOCK || this == TRY;
    }

    public static Optional<StepKind> fromKey(String key) {
        for (StepKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isDiscriminant(String key) {
        return fromKey(key).isPresent();
    }
}
