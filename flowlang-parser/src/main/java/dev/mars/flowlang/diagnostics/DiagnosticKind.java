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

package dev.mars.flowlang.diagnostics;

/**
 * Machine-readable classification of a {@link Diagnostic}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public enum DiagnosticKind {
    /** The document root is not a mapping. */
    MALFORMED_DOCUMENT(Severity.ERROR),
    /** A top-level section or flow body has the wrong shape. */
    MALFORMED_SECTION(Severity.ERROR),
    /** A step-list item is not a step mapping. */
    MALFORMED_STEP(Severity.ERROR),
    /** A step mapping carries no discriminant key. */
    MISSING_DISCRIMINANT(Severity.ERROR),
    /** A step mapping carries more than one discriminant key. */
    AMBIGUOUS_STEP(Severity.ERROR),
    /** A key that the step variant or option block does not accept. */
    UNKNOWN_FIELD(Severity.ERROR),
    /** A modifier of the wrong shape or out of range. */
    MALFORMED_MODIFIER(Severity.ERROR),
    /** A value outside a fixed set of choices. */
    INVALID_ENUM(Severity.ERROR),
    /** A required key is absent. */
    MISSING_FIELD(Severity.ERROR),
    /** A variant-specific key of the wrong shape. */
    MALFORMED_FIELD(Severity.ERROR),
    /** A form field declaration of the wrong shape. */
    MALFORMED_FORM_FIELD(Severity.ERROR),
    /** Step sequences nested past the configured limit. */
    NESTING_TOO_DEEP(Severity.ERROR),
    /** A reference to a flow or form the document does not declare. */
    DANGLING_REFERENCE(Severity.WARNING),
    /** A top-level key this parser does not know. */
    UNKNOWN_TOP_LEVEL_KEY(Severity.WARNING);

    private final Severity defaultSeverity;

    DiagnosticKind(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
