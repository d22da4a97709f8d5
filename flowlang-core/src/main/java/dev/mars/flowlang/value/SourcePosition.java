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

package dev.mars.flowlang.value;

/**
 * A location in the source document. Lines and columns are 1-based.
 *
 * @param line   line number, starting at 1
 * @param column column number, starting at 1
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record SourcePosition(int line, int column) {

    public SourcePosition {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be positive: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("Column must be positive: " + column);
        }
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
