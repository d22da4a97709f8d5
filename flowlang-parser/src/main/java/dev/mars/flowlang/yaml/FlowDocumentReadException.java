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

package dev.mars.flowlang.yaml;

import dev.mars.flowlang.exceptions.FlowlangException;

/**
 * Exception thrown when a flow document cannot be read into a value tree,
 * e.g. because the file is unreadable or the text is not well-formed YAML.
 * Problems inside a readable document are reported as diagnostics instead.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class FlowDocumentReadException extends FlowlangException {

    private final String sourceName;
    private final int lineNumber;
    private final String fieldPath;

    public FlowDocumentReadException(String message) {
        this(null, -1, null, message, null);
    }

    public FlowDocumentReadException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public FlowDocumentReadException(String sourceName, String message, Throwable cause) {
        this(sourceName, -1, null, message, cause);
    }

    public FlowDocumentReadException(String sourceName, int lineNumber, String fieldPath, String message) {
        this(sourceName, lineNumber, fieldPath, message, null);
    }

    public FlowDocumentReadException(String sourceName, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return the 1-based line of the problem, or -1 when unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (sourceName != null) {
            sb.append("Document '").append(sourceName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
