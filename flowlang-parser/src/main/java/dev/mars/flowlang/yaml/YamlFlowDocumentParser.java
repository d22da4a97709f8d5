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

import dev.mars.flowlang.config.FlowlangConfiguration;
import dev.mars.flowlang.parser.FlowDocumentParser;
import dev.mars.flowlang.parser.ParseResult;
import dev.mars.flowlang.parser.ParserOptions;
import dev.mars.flowlang.value.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * YAML front end of the flow document parser: reads the text with
 * {@link YamlValueReader} and hands the value tree to {@link FlowDocumentParser}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class YamlFlowDocumentParser implements FlowDocumentLoader {
    private static final Logger logger = Logger.getLogger(YamlFlowDocumentParser.class.getName());

    private final YamlValueReader reader;
    private final FlowDocumentParser parser;

    public YamlFlowDocumentParser() {
        this(new FlowlangConfiguration());
    }

    public YamlFlowDocumentParser(FlowlangConfiguration configuration) {
        this(new YamlValueReader(configuration), new FlowDocumentParser(ParserOptions.from(configuration)));
    }

    public YamlFlowDocumentParser(YamlValueReader reader, FlowDocumentParser parser) {
        this.reader = reader;
        this.parser = parser;
    }

    @Override
    public ParseResult parse(Path file) throws FlowDocumentReadException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FlowDocumentReadException(file.toString(), "Failed to read YAML file: " + file, e);
        }
        ParseResult result = parser.parse(reader.read(content, file.toString()));
        logResult(file.toString(), result);
        return result;
    }

    @Override
    public ParseResult parseFromString(String content) throws FlowDocumentReadException {
        return parser.parse(reader.read(content, null));
    }

    @Override
    public List<ParseResult> parseAll(String content) throws FlowDocumentReadException {
        List<ParseResult> results = new ArrayList<>();
        for (Value document : reader.readAll(content, null)) {
            results.add(parser.parse(document));
        }
        return results;
    }

    private static void logResult(String sourceName, ParseResult result) {
        if (result.isValid()) {
            logger.fine("Parsed " + sourceName + " with " + result.getWarnings().size() + " warnings");
        } else {
            logger.warning("Parsed " + sourceName + " with " + result.getErrors().size() + " errors");
        }
    }
}
