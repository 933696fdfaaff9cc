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
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CustomIndexSqlTest {

    private static final SchemaName SCHEMA = new SchemaName("app");
    private static final QueueName QUEUE = new QueueName("orders");

    @Test
    void testBtreeIndexOmitsUsing() {
        String sql = CustomIndexManager.createIndexSql(SCHEMA, QUEUE,
            new CustomIndex("orders_tenant_idx", List.of("(metadata->>'tenant')", "created_at"), IndexType.BTREE, ""));
        assertEquals("CREATE INDEX IF NOT EXISTS \"orders_tenant_idx\" ON \"app\".\"orders\" "
            + "((metadata->>'tenant'), created_at)", sql);
    }

    @Test
    void testPartialGinIndex() {
        String sql = CustomIndexManager.createIndexSql(SCHEMA, QUEUE,
            new CustomIndex("orders_payload_idx", List.of("payload"), IndexType.GIN, "processed_at IS NULL"));
        assertEquals("CREATE INDEX IF NOT EXISTS \"orders_payload_idx\" ON \"app\".\"orders\" "
            + "USING gin (payload) WHERE processed_at IS NULL", sql);
    }

    @Test
    void testDropIsSchemaQualified() {
        assertEquals("DROP INDEX IF EXISTS \"app\".\"orders_payload_idx\"",
            CustomIndexManager.dropIndexSql(SCHEMA, "orders_payload_idx"));
    }
}
