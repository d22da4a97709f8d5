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

import dev.mars.flowlang.config.FlowlangConfiguration;

/**
 * Options of a {@link FlowDocumentParser}.
 *
 * @param maxNestingDepth     maximum depth of nested step sequences, flow bodies counting as 1
 * @param checkFormReferences whether {@code form} steps naming undeclared forms produce warnings
 * @param metricsEnabled      whether parse metrics are recorded
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public record ParserOptions(int maxNestingDepth, boolean checkFormReferences, boolean metricsEnabled) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive: " + maxNestingDepth);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH, true, true);
    }

    public static ParserOptions from(FlowlangConfiguration configuration) {
        return new ParserOptions(
                configuration.getMaxNestingDepth(),
                configuration.isFormReferenceCheckEnabled(),
                configuration.isMetricsEnabled());
    }

    public ParserOptions withMaxNestingDepth(int depth) {
        return new ParserOptions(depth, checkFormReferences, metricsEnabled);
    }

    public ParserOptions withMetricsEnabled(boolean enabled) {
        return new ParserOptions(maxNestingDepth, checkFormReferences, enabled);
    }
}
