package dev.mars.pgq.db.queue;

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

import dev.mars.pgq.api.model.Queue;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;

/**
 * SQL text for queue tables. Identifiers are always quoted; nothing here is parameterised
 * because PostgreSQL does not accept bind parameters in DDL.
 */
public final class QueueTableSql {

    static final String EXISTS_SQL = """
        SELECT EXISTS (
            SELECT 1 FROM pg_tables
            WHERE schemaname = $1 AND tablename = $2
        )
        """;

    static final String IS_PARTITIONED_SQL = """
        SELECT EXISTS (
            SELECT 1 FROM pg_partitioned_table pt
            JOIN pg_class c ON pt.partrelid = c.oid
            JOIN pg_namespace n ON c.relnamespace = n.oid
            WHERE n.nspname = $1 AND c.relname = $2
        )
        """;

    private static final String COLUMNS = """
            id             UUID        NOT NULL DEFAULT gen_random_uuid(),
            created_at     TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
            started_at     TIMESTAMPTZ,
            locked_until   TIMESTAMPTZ,
            scheduled_for  TIMESTAMPTZ,
            processed_at   TIMESTAMPTZ,
            consumed_count INTEGER     NOT NULL DEFAULT 0,
            error_detail   TEXT,
            payload        JSONB       NOT NULL,
            metadata       JSONB       NOT NULL,
        """;

    private QueueTableSql() {
    }

    /**
     * @return {@code "schema"."name"}
     */
    public static String qualified(SchemaName schema, QueueName name) {
        return schema.quoted() + "." + name.quoted();
    }

    public static String createTable(SchemaName schema, QueueName name, boolean partitioned) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
            .append(qualified(schema, name))
            .append(" (\n")
            .append(COLUMNS);
        if (partitioned) {
            sql.append("    PRIMARY KEY (id, created_at)\n) PARTITION BY RANGE (created_at)");
        } else {
            sql.append("    PRIMARY KEY (id)\n)");
        }
        return sql.toString();
    }

    public static String createStandardIndex(SchemaName schema, QueueName name, StandardIndex index) {
        return "CREATE INDEX IF NOT EXISTS "
            + PostgreSqlIdentifierValidator.quote(index.indexName(name))
            + " ON " + qualified(schema, name)
            + " " + index.definition();
    }

    public static String createTemplate(SchemaName schema, QueueName name) {
        return "CREATE TABLE IF NOT EXISTS "
            + qualified(schema, Queue.templateNameFor(name))
            + " (LIKE " + qualified(schema, name) + " INCLUDING ALL)";
    }

    public static String dropTable(SchemaName schema, QueueName name) {
        return "DROP TABLE IF EXISTS " + qualified(schema, name) + " CASCADE";
    }
}
