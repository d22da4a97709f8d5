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

import dev.mars.flowlang.value.SourcePosition;

import java.util.Objects;

/**
 * A single parse problem (error or warning).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class Diagnostic {

    private final DiagnosticKind kind;
    private final Severity severity;
    private final SourcePosition position;
    private final String documentPath;
    private final String field;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String message) {
        this(kind, kind.getDefaultSeverity(), null, null, null, message);
    }

    public Diagnostic(DiagnosticKind kind, SourcePosition position, String documentPath, String message) {
        this(kind, kind.getDefaultSeverity(), position, documentPath, null, message);
    }

    public Diagnostic(DiagnosticKind kind, Severity severity, SourcePosition position,
                      String documentPath, String field, String message) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.position = position;
        this.documentPath = documentPath;
        this.field = field;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * @return the source position, or null when unknown
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * @return -1 when the position is unknown
     */
    public int getLineNumber() {
        return position != null ? position.line() : -1;
    }

    /**
     * @return the path of the offending node, e.g. {@code flows.main[2].retry.times}
     */
    public String getDocumentPath() {
        return documentPath;
    }

    /**
     * @return the field the diagnostic is about (e.g. {@code out}, {@code loop.mode}), or null
     */
    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind &&
               severity == that.severity &&
               Objects.equals(position, that.position) &&
               Objects.equals(documentPath, that.documentPath) &&
               Objects.equals(field, that.field) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, position, documentPath, field, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name()).append(' ').append(kind.name());

        if (position != null) {
            sb.append(" (line ").append(position.line())
              .append(", column ").append(position.column()).append(")");
        }

        if (documentPath != null && !documentPath.isEmpty()) {
            sb.append(" [").append(documentPath).append("]");
        }

        sb.append(": ").append(message);

        return sb.toString();
    }
}
