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
import dev.mars.flowlang.value.MappingValue;
import dev.mars.flowlang.value.ScalarType;
import dev.mars.flowlang.value.ScalarValue;
import dev.mars.flowlang.value.SequenceValue;
import dev.mars.flowlang.value.SourcePosition;
import dev.mars.flowlang.value.Value;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads YAML text into the generic value tree.
 *
 * <p>SnakeYAML composes the node graph and resolves the implicit scalar tags
 * (YAML 1.1 rules, so {@code yes} is a boolean). No Java objects are
 * constructed. Positions are converted to 1-based lines and columns. Merge keys
 * ({@code <<}) are expanded, with explicit keys taking precedence.
 *
 * <p>Instances are thread-safe: a SnakeYAML instance is created per call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class YamlValueReader {
    private static final Logger logger = Logger.getLogger(YamlValueReader.class.getName());

    private final FlowlangConfiguration configuration;

    public YamlValueReader() {
        this(FlowlangConfiguration.defaults());
    }

    public YamlValueReader(FlowlangConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Reads a single YAML document.
     *
     * @param content    the YAML text
     * @param sourceName name used in error messages, may be null
     * @throws FlowDocumentReadException if the text is empty, not well-formed
     *                                   or holds more than one document
     */
    public Value read(String content, String sourceName) throws FlowDocumentReadException {
        Node node;
        try {
            node = newYaml().compose(new StringReader(content));
        } catch (YAMLException e) {
            throw readFailure(sourceName, e);
        }
        if (node == null) {
            throw new FlowDocumentReadException(sourceName, 1, null, "Empty YAML document");
        }
        return new NodeConverter(sourceName).convert(node, "");
    }

    /**
     * Reads every document of a YAML stream, in stream order.
     */
    public List<Value> readAll(String content, String sourceName) throws FlowDocumentReadException {
        List<Value> documents = new ArrayList<>();
        try {
            for (Node node : newYaml().composeAll(new StringReader(content))) {
                documents.add(new NodeConverter(sourceName).convert(node, ""));
            }
        } catch (YAMLException e) {
            throw readFailure(sourceName, e);
        }
        logger.fine("Read " + documents.size() + " YAML documents from " + (sourceName != null ? sourceName : "string"));
        return documents;
    }

    private Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setNestingDepthLimit(configuration.getYamlMaxNestingDepth());
        loaderOptions.setMaxAliasesForCollections(configuration.getYamlMaxAliases());
        loaderOptions.setCodePointLimit(configuration.getYamlCodePointLimit());
        return new Yaml(loaderOptions);
    }

    private static FlowDocumentReadException readFailure(String sourceName, YAMLException e) {
        int line = -1;
        if (e instanceof MarkedYAMLException marked && marked.getProblemMark() != null) {
            line = marked.getProblemMark().getLine() + 1;
        }
        String problem = e instanceof MarkedYAMLException markedError && markedError.getProblem() != null
                ? markedError.getProblem() : e.getMessage();
        return new FlowDocumentReadException(sourceName, line, null, "YAML parsing failed: " + problem, e);
    }

    static SourcePosition positionOf(Node node) {
        Mark mark = node.getStartMark();
        return mark != null ? SourcePosition.of(mark.getLine() + 1, mark.getColumn() + 1) : null;
    }

    static ScalarType scalarTypeOf(Tag tag) {
        if (Tag.INT.equals(tag)) {
            return ScalarType.INTEGER;
        }
        if (Tag.FLOAT.equals(tag)) {
            return ScalarType.FLOAT;
        }
        if (Tag.BOOL.equals(tag)) {
            return ScalarType.BOOLEAN;
        }
        if (Tag.NULL.equals(tag)) {
            return ScalarType.NULL;
        }
        return ScalarType.STRING;
    }

    /**
     * Converts one composed node graph. Aliases share nodes, so the nodes on
     * the current path are tracked to reject recursive aliases.
     */
    private static final class NodeConverter {

        private final String sourceName;
        private final Set<Node> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

        NodeConverter(String sourceName) {
            this.sourceName = sourceName;
        }

        Value convert(Node node, String path) throws FlowDocumentReadException {
            if (node instanceof ScalarNode scalar) {
                return new ScalarValue(scalarTypeOf(scalar.getTag()), scalar.getValue(), positionOf(scalar));
            }
            if (!inProgress.add(node)) {
                throw failure(node, path, "Recursive alias is not supported");
            }
            try {
                if (node instanceof SequenceNode sequence) {
                    List<Value> items = new ArrayList<>(sequence.getValue().size());
                    for (int i = 0; i < sequence.getValue().size(); i++) {
                        items.add(convert(sequence.getValue().get(i), path + "[" + i + "]"));
                    }
                    return new SequenceValue(items, positionOf(sequence));
                }
                if (node instanceof MappingNode mapping) {
                    return convertMapping(mapping, path);
                }
                throw failure(node, path, "Unsupported YAML node: " + node.getNodeId());
            } finally {
                inProgress.remove(node);
            }
        }

        private MappingValue convertMapping(MappingNode mapping, String path) throws FlowDocumentReadException {
            Map<String, MappingValue.Entry> entries = new LinkedHashMap<>();
            List<MappingValue.Entry> merged = new ArrayList<>();

            for (NodeTuple tuple : mapping.getValue()) {
                Node keyNode = tuple.getKeyNode();
                if (Tag.MERGE.equals(keyNode.getTag())) {
                    collectMerged(tuple.getValueNode(), path, merged);
                    continue;
                }
                if (!(keyNode instanceof ScalarNode scalarKey)) {
                    throw failure(keyNode, path, "Mapping keys must be scalars");
                }
                String key = scalarKey.getValue();
                String childPath = path.isEmpty() ? key : path + "." + key;
                if (entries.containsKey(key)) {
                    throw failure(keyNode, childPath, "Duplicate key '" + key + "'");
                }
                Value value = convert(tuple.getValueNode(), childPath);
                entries.put(key, new MappingValue.Entry(key, value, positionOf(keyNode)));
            }

            List<MappingValue.Entry> result = new ArrayList<>(merged.size() + entries.size());
            for (MappingValue.Entry entry : merged) {
                if (!entries.containsKey(entry.key())
                        && result.stream().noneMatch(e -> e.key().equals(entry.key()))) {
                    result.add(entry);
                }
            }
            result.addAll(entries.values());
            return new MappingValue(result, positionOf(mapping));
        }

        private void collectMerged(Node source, String path, List<MappingValue.Entry> merged)
                throws FlowDocumentReadException {
            if (source instanceof SequenceNode sequence) {
                for (Node item : sequence.getValue()) {
                    collectMerged(item, path, merged);
                }
                return;
            }
            if (!(source instanceof MappingNode)) {
                throw failure(source, path, "Merge key '<<' must refer to a mapping");
            }
            Value value = convert(source, path);
            merged.addAll(((MappingValue) value).entries());
        }

        private FlowDocumentReadException failure(Node node, String path, String message) {
            Mark mark = node.getStartMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            return new FlowDocumentReadException(sourceName, line, path.isEmpty() ? null : path, message);
        }
    }
}
