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

import dev.mars.flowlang.diagnostics.DiagnosticKind;
import dev.mars.flowlang.diagnostics.Diagnostics;
import dev.mars.flowlang.model.StepKind;
import dev.mars.flowlang.value.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Mutable state of a single parse call: the diagnostics collected so far, the
 * current document path, the nesting depth and a few counters. A new context
 * is created for every document, which keeps the parsers themselves stateless.
 */
final class ParseContext {

    private final ParserOptions options;
    private final StepListParser stepListParser;
    private final FormFieldParser formFieldParser;
    private final Diagnostics diagnostics = new Diagnostics();
    private final Deque<String> path = new ArrayDeque<>();
    private final List<FormReference> formReferences = new ArrayList<>();
    private final Map<StepKind, Integer> stepCounts = new EnumMap<>(StepKind.class);
    private int depth;
    private int rejectedSteps;

    ParseContext(ParserOptions options, StepListParser stepListParser, FormFieldParser formFieldParser) {
        this.options = options;
        this.stepListParser = stepListParser;
        this.formFieldParser = formFieldParser;
    }

    ParserOptions options() {
        return options;
    }

    StepListParser stepListParser() {
        return stepListParser;
    }

    FormFieldParser formFieldParser() {
        return formFieldParser;
    }

    Diagnostics diagnostics() {
        return diagnostics;
    }

    // Document path handling

    void enter(String segment) {
        path.addLast(segment);
    }

    void leave() {
        path.removeLast();
    }

    <T> T within(String segment, Supplier<T> action) {
        enter(segment);
        try {
            return action.get();
        } finally {
            leave();
        }
    }

    /**
     * @return the current path, e.g. {@code flows.main[3].then[0]}
     */
    String currentPath() {
        StringBuilder sb = new StringBuilder();
        Iterator<String> segments = path.iterator();
        while (segments.hasNext()) {
            String segment = segments.next();
            if (sb.length() > 0 && !segment.startsWith("[")) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    // Diagnostics

    void report(DiagnosticKind kind, SourcePosition position, String message) {
        diagnostics.report(kind, position, currentPath(), message);
    }

    void report(DiagnosticKind kind, SourcePosition position, String field, String message) {
        diagnostics.report(kind, position, currentPath(), field, message);
    }

    // Nesting guard

    /**
     * Enters one more level of step nesting.
     *
     * @return false if the level would exceed the configured maximum; the level is not entered then
     */
    boolean enterNesting() {
        if (depth >= options.maxNestingDepth()) {
            return false;
        }
        depth++;
        return true;
    }

    void leaveNesting() {
        depth--;
    }

    int depth() {
        return depth;
    }

    // Counters

    void rejectSteps(int count) {
        rejectedSteps += count;
    }

    int rejectedSteps() {
        return rejectedSteps;
    }

    void countStep(StepKind kind) {
        stepCounts.merge(kind, 1, Integer::sum);
    }

    Map<StepKind, Integer> stepCounts() {
        return stepCounts;
    }

    void addFormReference(String formName, SourcePosition position) {
        formReferences.add(new FormReference(formName, position, currentPath()));
    }

    List<FormReference> formReferences() {
        return formReferences;
    }

    record FormReference(String formName, SourcePosition position, String documentPath) {
    }
}
