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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MappingValue} and {@link SequenceValue}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-02
 */
class MappingValueTest {

    @Test
    void testEntriesKeepInsertionOrder() {
        MappingValue mapping = MappingValue.builder()
                .put("zeta", "1")
                .put("alpha", "2")
                .put("mid", ScalarValue.ofInteger(3))
                .build();

        assertEquals(List.of("zeta", "alpha", "mid"), mapping.keys());
        assertEquals(3, mapping.size());
        assertEquals("2", ((ScalarValue) mapping.get("alpha")).asString());
        assertNull(mapping.get("missing"));
        assertTrue(mapping.entry("mid").isPresent());
    }

    @Test
    void testDuplicateKeysAreRejected() {
        List<MappingValue.Entry> entries = List.of(
                new MappingValue.Entry("a", ScalarValue.of("1")),
                new MappingValue.Entry("a", ScalarValue.of("2")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new MappingValue(entries, null));
        assertEquals("Duplicate mapping key: a", e.getMessage());
    }

    @Test
    void testEntryPositionPrefersKeyPosition() {
        ScalarValue value = ScalarValue.of("v").withPosition(SourcePosition.of(2, 10));

        MappingValue.Entry withKey = new MappingValue.Entry("k", value, SourcePosition.of(2, 3));
        MappingValue.Entry withoutKey = new MappingValue.Entry("k", value);

        assertEquals(SourcePosition.of(2, 3), withKey.position());
        assertEquals(SourcePosition.of(2, 10), withoutKey.position());
    }

    @Test
    void testEmptyMapping() {
        MappingValue mapping = MappingValue.empty();

        assertTrue(mapping.isEmpty());
        assertTrue(mapping.isMapping());
        assertEquals("mapping", mapping.describe());
    }

    @Test
    void testSequenceIsImmutable() {
        SequenceValue sequence = SequenceValue.of(ScalarValue.of("a"), ScalarValue.of("b"));

        assertEquals(2, sequence.size());
        assertEquals("sequence", sequence.describe());
        assertThrows(UnsupportedOperationException.class, () -> sequence.items().add(ScalarValue.of("c")));
    }
}
