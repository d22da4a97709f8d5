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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collector of {@link Diagnostic}s produced by one parse.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class Diagnostics {

    private final List<Diagnostic> entries;

    public Diagnostics() {
        this.entries = new ArrayList<>();
    }

    public Diagnostics(List<Diagnostic> diagnostics) {
        this.entries = new ArrayList<>(diagnostics != null ? diagnostics : List.of());
    }

    public void add(Diagnostic diagnostic) {
        entries.add(diagnostic);
    }

    public void report(DiagnosticKind kind, SourcePosition position, String documentPath, String message) {
        entries.add(new Diagnostic(kind, position, documentPath, message));
    }

    public void report(DiagnosticKind kind, SourcePosition position, String documentPath, String field, String message) {
        entries.add(new Diagnostic(kind, kind.getDefaultSeverity(), position, documentPath, field, message));
    }

    /**
     * @return all diagnostics in the order they were reported
     */
    public List<Diagnostic> getAll() {
        return List.copyOf(entries);
    }

    public List<Diagnostic> getErrors() {
        return entries.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> getWarnings() {
        return entries.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).toList();
    }

    public boolean isValid() {
        return entries.stream().noneMatch(Diagnostic::isError);
    }

    public boolean hasWarnings() {
        return entries.stream().anyMatch(d -> !d.isError());
    }

    public int getErrorCount() {
        return (int) entries.stream().filter(Diagnostic::isError).count();
    }

    public int getWarningCount() {
        return entries.size() - getErrorCount();
    }

    public int size() {
        return entries.size();
    }

    public Map<DiagnosticKind, Integer> countByKind() {
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic diagnostic : entries) {
            counts.merge(diagnostic.getKind(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Diagnostics{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(getErrorCount());
        sb.append(", warnings=").append(getWarningCount());
        sb.append("}");
        return sb.toString();
    }
}
