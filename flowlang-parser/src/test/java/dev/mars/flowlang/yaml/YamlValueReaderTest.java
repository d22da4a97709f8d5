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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading YAML text into the value tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-06
 */
class YamlValueReaderTest {

    private YamlValueReader reader;

    @BeforeEach
    void setUp() {
        reader = new YamlValueReader();
    }

    @Test
    void testScalarTypes() throws FlowDocumentReadException {
        MappingValue root = (MappingValue) reader.read("""
                s: hello
                quoted: "123"
                i: 42
                f: 3.141519
                b: yes
                n: ~
                empty:
                """, "test");

        assertEquals(ScalarType.STRING, scalar(root, "s").type());
        assertEquals(ScalarType.STRING, scalar(root, "quoted").type());
        assertEquals(ScalarType.INTEGER, scalar(root, "i").type());
        assertEquals(ScalarType.FLOAT, scalar(root, "f").type());
        assertEquals("3.141519", scalar(root, "f").text());
        assertEquals(ScalarType.BOOLEAN, scalar(root, "b").type());
        assertEquals(Boolean.TRUE, scalar(root, "b").toBoolean().orElseThrow());
        assertTrue(scalar(root, "n").isNull());
        assertTrue(scalar(root, "empty").isNull());
    }

    @Test
    void testOrderAndPositions() throws FlowDocumentReadException {
        MappingValue root = (MappingValue) reader.read("""
                zeta: 1
                alpha:
                  - a
                  - b
                """, "test");

        assertEquals(List.of("zeta", "alpha"), root.keys());
        assertEquals(SourcePosition.of(1, 1), root.position());
        MappingValue.Entry alpha = root.entry("alpha").orElseThrow();
        assertEquals(SourcePosition.of(2, 1), alpha.keyPosition());

        SequenceValue items = (SequenceValue) alpha.value();
        assertEquals(SourcePosition.of(4, 5), items.get(1).position());
    }

    @Test
    void testBlockScalars() throws FlowDocumentReadException {
        MappingValue root = (MappingValue) reader.read("""
                literal: |
                  line1
                  line2
                folded: >
                  folded1
                  folded2
                """, "test");

        assertEquals("line1\nline2\n", scalar(root, "literal").text());
        assertEquals("folded1 folded2\n", scalar(root, "folded").text());
    }

    @Test
    void testAliasesAndMergeKeys() throws FlowDocumentReadException {
        MappingValue root = (MappingValue) reader.read("""
                defaults: &defaults
                  retries: 3
                  mode: serial
                job:
                  <<: *defaults
                  mode: parallel
                copy: *defaults
                """, "test");

        MappingValue job = (MappingValue) root.get("job");
        assertEquals(List.of("retries", "mode"), job.keys());
        assertEquals("parallel", scalar(job, "mode").text());
        assertEquals(root.get("defaults"), root.get("copy"));
    }

    @Test
    void testDuplicateKeysAreRejected() {
        FlowDocumentReadException e = assertThrows(FlowDocumentReadException.class,
                () -> reader.read("""
                        flows:
                          main: []
                          main: []
                        """, "dup.yaml"));

        assertEquals(3, e.getLineNumber());
        assertEquals("flows.main", e.getFieldPath());
        assertEquals("dup.yaml", e.getSourceName());
    }

    @Test
    void testComplexKeysAreRejected() {
        assertThrows(FlowDocumentReadException.class, () -> reader.read("""
                ? [a, b]
                : c
                """, "test"));
    }

    @Test
    void testRecursiveAliasIsRejected() {
        FlowDocumentReadException e = assertThrows(FlowDocumentReadException.class,
                () -> reader.read("""
                        a: &loop
                          b: *loop
                        """, "test"));

        assertTrue(e.getMessage().contains("Recursive alias"), e.getMessage());
    }

    @Test
    void testSyntaxErrorCarriesLine() {
        FlowDocumentReadException e = assertThrows(FlowDocumentReadException.class,
                () -> reader.read("""
                        flows:
                          main:
                            - log: "unterminated
                        """, "bad.yaml"));

        assertTrue(e.getLineNumber() > 0);
        assertNotNull(e.getCause());
        assertTrue(e.getMessage().startsWith("Document 'bad.yaml': Line "), e.getMessage());
    }

    @Test
    void testEmptyDocument() {
        assertThrows(FlowDocumentReadException.class, () -> reader.read("", "empty.yaml"));
        assertThrows(FlowDocumentReadException.class, () -> reader.read("# only a comment\n", "empty.yaml"));
    }

    @Test
    void testReadAll() throws FlowDocumentReadException {
        List<Value> documents = reader.readAll("""
                a: 1
                ---
                b: 2
                ---
                - c
                """, "stream");

        assertEquals(3, documents.size());
        assertTrue(documents.get(0).isMapping());
        assertTrue(documents.get(2).isSequence());
    }

    @Test
    void testAliasLimitFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(FlowlangConfiguration.YAML_MAX_ALIASES, "1");
        YamlValueReader strict = new YamlValueReader(new FlowlangConfiguration(properties));

        assertThrows(FlowDocumentReadException.class, () -> strict.read("""
                base: &b [1, 2]
                one: *b
                two: *b
                """, "aliases.yaml"));
    }

    private static ScalarValue scalar(MappingValue mapping, String key) {
        return (ScalarValue) mapping.get(key);
    }
}
