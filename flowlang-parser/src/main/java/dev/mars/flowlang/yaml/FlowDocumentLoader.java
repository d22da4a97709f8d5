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

import dev.mars.flowlang.parser.ParseResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads flow documents from text or files and parses them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public interface FlowDocumentLoader {

    ParseResult parse(Path file) throws FlowDocumentReadException;

    ParseResult parseFromString(String content) throws FlowDocumentReadException;

    /**
     * Parses every document of a multi-document stream, in stream order.
     * Each document gets its own diagnostics.
     *
     * @param content the text of the stream
     * @return one result per document
     */
    List<ParseResult> parseAll(String content) throws FlowDocumentReadException;
}
