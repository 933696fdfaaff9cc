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

import dev.mars.pgq.api.model.CustomIndex;
import dev.mars.pgq.api.model.IndexType;
import dev.mars.pgq.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class IndexDefinitionParserTest {

    @Test
    void testPlainBtree() {
        CustomIndex index = IndexDefinitionParser.parse("ix",
            "CREATE INDEX ix ON public.orders USING btree (created_at)");
        assertEquals("ix", index.name());
        assertEquals(List.of("created_at"), index.columns());
        assertEquals(IndexType.BTREE, index.type());
        assertFalse(index.isPartial());
    }

    @Test
    void testMultiColumnPartialGin() {
        CustomIndex index = IndexDefinitionParser.parse("ix",
            "CREATE INDEX ix ON public.orders USING gin (payload, metadata) WHERE (processed_at IS NULL)");
        assertEquals(List.of("payload", "metadata"), index.columns());
        assertEquals(IndexType.GIN, index.type());
        assertEquals("(processed_at IS NULL)", index.where());
    }

    @Test
    void testExpressionColumns() {
        CustomIndex index = IndexDefinitionParser.parse("ix",
            "CREATE INDEX ix ON app.orders USING btree (((metadata ->> 'tenant'::text)), created_at)");
        assertEquals(List.of("((metadata ->> 'tenant'::text))", "created_at"), index.columns());
    }

    @Test
    void testFunctionArgumentsAreNotSplit() {
        assertEquals(List.of("COALESCE(scheduled_for, created_at)"),
            IndexDefinitionParser.parseColumns(
                "CREATE INDEX ix ON public.orders USING btree (COALESCE(scheduled_for, created_at))"));
    }

    @Test
    void testQuotedIdentifiers() {
        assertEquals(List.of("\"weird(col\"", "id"),
            IndexDefinitionParser.parseColumns(
                "CREATE INDEX ix ON public.orders USING btree (\"weird(col\", id)"));
        assertEquals(List.of("id"),
            IndexDefinitionParser.parseColumns(
                "CREATE INDEX ix ON public.\"odd(name\" USING btree (id)"));
    }

    @Test
    void testTypes() {
        assertEquals(IndexType.HASH, IndexDefinitionParser.parseType("CREATE INDEX i ON s.t USING hash (id)"));
        assertEquals(IndexType.BRIN, IndexDefinitionParser.parseType("CREATE INDEX i ON s.t USING brin (created_at)"));
        assertEquals(IndexType.GIST, IndexDefinitionParser.parseType("CREATE INDEX i ON s.t USING gist (p)"));
        assertEquals(IndexType.BTREE, IndexDefinitionParser.parseType("CREATE INDEX i ON s.t USING btree (id)"));
    }

    @Test
    void testWhere() {
        assertEquals("", IndexDefinitionParser.parseWhere("CREATE INDEX i ON s.t USING btree (id)"));
        assertEquals("((consumed_count > 0) AND (processed_at IS NULL))",
            IndexDefinitionParser.parseWhere(
                "CREATE INDEX i ON s.t USING btree (id) WHERE ((consumed_count > 0) AND (processed_at IS NULL))"));
    }

    @Test
    void testParsedIndexMatchesDeclaredIndex() {
        CustomIndex declared = new CustomIndex("ix", List.of("created_at"), IndexType.BTREE, "processed_at IS NULL");
        CustomIndex parsed = IndexDefinitionParser.parse("ix",
            "CREATE INDEX ix ON public.orders USING btree (created_at) WHERE (processed_at IS NULL)");
        assertTrue(declared.definitionEquals(parsed));
    }

    @Test
    void testNonAsciiIdentifiersKeepPredicateIntact() {
        String definition = "CREATE INDEX ix ON public.\"straße\" USING btree (a) WHERE (a > 1)";
        assertEquals("(a > 1)", IndexDefinitionParser.parseWhere(definition));
        assertEquals(List.of("a"), IndexDefinitionParser.parseColumns(definition));

        CustomIndex declared = new CustomIndex("ix", List.of("a"), IndexType.BTREE, "a > 1");
        assertTrue(declared.definitionEquals(IndexDefinitionParser.parse("ix", definition)));

        assertEquals("(\"größe\" > 1)", IndexDefinitionParser.parseWhere(
            "CREATE INDEX ix ON public.q USING btree (\"größe\") where (\"größe\" > 1)"));
    }

    @Test
    void testWhereInsideQuotedTableNameIsIgnored() {
        assertEquals("", IndexDefinitionParser.parseWhere(
            "CREATE INDEX ix ON public.\"a WHERE b\" USING btree (id)"));
    }
}
