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

import dev.mars.pgq.api.error.QueueDdlException;
import dev.mars.pgq.api.model.CustomIndex;
import dev.mars.pgq.api.model.FullyQualifiedName;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;
import dev.mars.pgq.db.queue.QueueTableSql;
import dev.mars.pgq.db.queue.StandardIndex;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates, lists and drops the custom indexes of a queue table.
 *
 * <p>Creation runs on a connection supplied by the caller, who owns the transaction and
 * therefore the atomicity of a batch. Drops run one statement at a time on the pool;
 * each is idempotent on its own.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class CustomIndexManager {
    private static final Logger logger = LoggerFactory.getLogger(CustomIndexManager.class);

    private static final String LIST_INDEXES_SQL = """
        SELECT
            i.relname AS index_name,
            pg_get_indexdef(i.oid) AS index_def
        FROM pg_index x
        JOIN pg_class t ON t.oid = x.indrelid
        JOIN pg_class i ON i.oid = x.indexrelid
        JOIN pg_namespace n ON n.oid = t.relnamespace
        WHERE n.nspname = $1
          AND t.relname = $2
          AND i.relname NOT LIKE '%\\_pkey'
          AND i.relname NOT IN ($3, $4, $5, $6)
        ORDER BY i.relname
        """;

    private final Pool pool;

    public CustomIndexManager(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Creates each index in order on {@code tx}. Unnamed indexes get their generated name.
     * This never begins or commits a transaction.
     *
     * @return the indexes as created, all of them named
     */
    public Future<List<CustomIndex>> create(SqlConnection tx, SchemaName schema, QueueName name, List<CustomIndex> indexes) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        List<CustomIndex> named = new ArrayList<>(indexes.size());
        try {
            for (CustomIndex index : indexes) {
                CustomIndex resolved = IndexReconciliationPlan.withResolvedName(name, index);
                validate(name, resolved);
                named.add(resolved);
            }
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        Future<Void> chain = Future.succeededFuture();
        for (CustomIndex index : named) {
            String sql = createIndexSql(schema, name, index);
            chain = chain.compose(v -> {
                logger.debug("Creating custom index {} on {}: {}", index.name(), fqn, sql);
                return tx.query(sql).execute()
                    .<Void>mapEmpty()
                    .recover(err -> {
                        logger.error("Failed to create custom index {} on {}: {}", index.name(), fqn, err.getMessage());
                        return Future.failedFuture(
                            new QueueDdlException("create_custom_index_" + index.name(), fqn, err));
                    });
            });
        }
        return chain.map(v -> {
            if (!named.isEmpty()) {
                logger.info("Created {} custom index(es) on {}", named.size(), fqn);
            }
            return List.copyOf(named);
        });
    }

    /**
     * Lists the custom indexes of a table, excluding its primary key and its standard
     * indexes, ordered by name.
     */
    public Future<List<CustomIndex>> get(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        Tuple params = Tuple.tuple()
            .addString(schema.value())
            .addString(name.value());
        for (String reserved : StandardIndex.indexNames(name)) {
            params.addString(reserved);
        }

        return pool.preparedQuery(LIST_INDEXES_SQL)
            .execute(params)
            .map(rows -> {
                List<CustomIndex> indexes = new ArrayList<>();
                for (Row row : rows) {
                    indexes.add(IndexDefinitionParser.parse(row.getString("index_name"), row.getString("index_def")));
                }
                return indexes;
            })
            .recover(err -> {
                logger.error("Failed to read custom indexes of {}: {}", fqn, err.getMessage());
                return Future.failedFuture(new QueueDdlException("get_custom_indexes", fqn, err));
            });
    }

    /**
     * Drops the named indexes one by one. Absent indexes are skipped by PostgreSQL.
     */
    public Future<Void> drop(SchemaName schema, QueueName name, List<String> indexNames) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        Future<Void> chain = Future.succeededFuture();
        for (String indexName : indexNames) {
            String sql = dropIndexSql(schema, indexName);
            chain = chain.compose(v -> pool.query(sql).execute()
                .<Void>mapEmpty()
                .onSuccess(r -> logger.info("Dropped custom index {} on {}", indexName, fqn))
                .recover(err -> {
                    logger.error("Failed to drop custom index {} on {}: {}", indexName, fqn, err.getMessage());
                    return Future.failedFuture(new QueueDdlException("drop_custom_index_" + indexName, fqn, err));
                }));
        }
        return chain;
    }

    static String createIndexSql(SchemaName schema, QueueName name, CustomIndex index) {
        StringBuilder sql = new StringBuilder("CREATE INDEX IF NOT EXISTS ")
            .append(PostgreSqlIdentifierValidator.quote(index.name()))
            .append(" ON ")
            .append(QueueTableSql.qualified(schema, name));
        if (!index.type().isDefault()) {
            sql.append(" USING ").append(index.type().sqlName());
        }
        sql.append(" (").append(String.join(", ", index.columns())).append(')');
        if (index.isPartial()) {
            sql.append(" WHERE ").append(index.where());
        }
        return sql.toString();
    }

    static String dropIndexSql(SchemaName schema, String indexName) {
        return "DROP INDEX IF EXISTS " + schema.quoted() + "." + PostgreSqlIdentifierValidator.quote(indexName);
    }

    /**
     * @throws IllegalArgumentException for an invalid or reserved name, or an empty column list
     */
    static void validate(QueueName table, CustomIndex index) {
        PostgreSqlIdentifierValidator.validate(index.name(), "index");
        if (StandardIndex.isReserved(table, index.name())) {
            throw new IllegalArgumentException(
                "Custom index name '" + index.name() + "' is reserved for a standard index of " + table.value());
        }
        if (index.columns().isEmpty()) {
            throw new IllegalArgumentException("Custom index '" + index.name() + "' must have at least one column");
        }
    }
}
