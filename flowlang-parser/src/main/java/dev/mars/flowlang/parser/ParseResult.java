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

import dev.mars.flowlang.diagnostics.Diagnostic;
import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.model.FlowDocument;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one document: the AST built from everything that could be
 * parsed, plus every diagnostic in the order it was reported.
 *
 * @param document    the document AST, never null
 * @param diagnostics errors and warnings in report order
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public record ParseResult(FlowDocument document, List<Diagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(document, "document");
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if no error was reported; warnings do not count
     */
    public boolean isValid() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).toList();
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
    }
}
