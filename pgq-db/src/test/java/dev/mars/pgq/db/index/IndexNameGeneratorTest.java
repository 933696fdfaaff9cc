package dev.mars.pgq.db.index;

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

import dev.mars.pgq.api.model.IndexType;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;
import dev.mars.pgq.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class IndexNameGeneratorTest {

    @Test
    void testSingleColumnName() {
        // sha256("created_at") = e878a9d9...
        assertEquals("events_created_at_e878a9d9_idx",
            IndexNameGenerator.generate("events", List.of("created_at"), IndexType.BTREE));
    }

    @Test
    void testMultiColumnNameHashesOriginalCommaJoinedColumns() {
        // sha256("created_at,(metadata->>'tenant')") = e91a1321...
        assertEquals("events_created_at_metadata_tenant_e91a1321_idx",
            IndexNameGenerator.generate("events", List.of("created_at", "(metadata->>'tenant')"), IndexType.BTREE));
    }

    @Test
    void testExpressionNameWithNonDefaultType() {
        // sha256("(metadata->>'tenant')") = a3fafd89...
        assertEquals("events_metadata_tenant_gin_a3fafd89_idx",
            IndexNameGenerator.generate("events", List.of("(metadata->>'tenant')"), IndexType.GIN));
    }

    @Test
    void testDeterministic() {
        List<String> columns = List.of("created_at", "(metadata->>'tenant')");
        assertEquals(IndexNameGenerator.generate("events", columns, IndexType.BTREE),
            IndexNameGenerator.generate("events", columns, IndexType.BTREE));
    }

    @Test
    void testNonDefaultTypeIsIncluded() {
        assertEquals("events_payload_gin_239f59ed_idx",
            IndexNameGenerator.generate("events", List.of("payload"), IndexType.GIN));

        String btree = IndexNameGenerator.generate("events", List.of("payload"), IndexType.BTREE);
        assertFalse(btree.contains("btree"));
    }

    @Test
    void testExpressionsAreCleaned() {
        assertEquals("metadata_tenant", IndexNameGenerator.clean("(metadata->>'tenant')"));
        assertEquals("payload_a_b", IndexNameGenerator.clean("payload->'a'->>'b'"));
        assertEquals("lowername", IndexNameGenerator.clean("lower(\"name\")"));
    }

    @Test
    void testLongExpressionsStillDiffer() {
        // both clean to the same 20 byte prefix
        String a = IndexNameGenerator.generate("events",
            List.of("(metadata->>'customer_reference_a')"), IndexType.BTREE);
        String b = IndexNameGenerator.generate("events",
            List.of("(metadata->>'customer_reference_b')"), IndexType.BTREE);
        assertNotEquals(a, b);
        assertTrue(a.startsWith("events_metadata_customer_re_"), a);
    }

    @Test
    void testColumnOrderChangesHash() {
        assertNotEquals(IndexNameGenerator.columnHash(List.of("a", "b")),
            IndexNameGenerator.columnHash(List.of("b", "a")));
        assertEquals("e878a9d9", IndexNameGenerator.columnHash(List.of("created_at")));
    }

    @Test
    void testNameFitsIdentifierLimit() {
        String table = "t".repeat(50);
        String name = IndexNameGenerator.generate(table,
            List.of("first_column_name", "second_column_name", "third_column_name"), IndexType.BRIN);
        assertTrue(PostgreSqlIdentifierValidator.byteLength(name) <= PostgreSqlIdentifierValidator.MAX_IDENTIFIER_LENGTH);
        assertTrue(PostgreSqlIdentifierValidator.isValid(name));
    }
}
