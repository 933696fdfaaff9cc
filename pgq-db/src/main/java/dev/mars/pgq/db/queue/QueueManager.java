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

import dev.mars.pgq.api.error.QueueAlreadyExistsException;
import dev.mars.pgq.api.error.QueueDdlException;
import dev.mars.pgq.api.error.QueueNotFoundException;
import dev.mars.pgq.api.error.QueueSchemaException;
import dev.mars.pgq.api.model.FullyQualifiedName;
import dev.mars.pgq.api.model.PartitionConfig;
import dev.mars.pgq.api.model.Queue;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;
import dev.mars.pgq.db.partman.PartitionManager;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates, probes and drops queue tables.
 *
 * <p>Table, standard indexes and (for partitioned queues) the template table are created
 * in one transaction, so a failure never leaves part of a queue behind. Registration with
 * pg_partman follows in a second transaction once the parent table is committed; if that
 * step fails the table exists but is unregistered, and the failure is reported as a
 * {@link dev.mars.pgq.api.error.PartmanException}.
 *
 * <p>Nothing is cached: every probe queries the catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class QueueManager {
    private static final Logger logger = LoggerFactory.getLogger(QueueManager.class);

    private final Pool pool;
    private final PartitionManager partitionManager;

    public QueueManager(Pool pool, PartitionManager partitionManager) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.partitionManager = Objects.requireNonNull(partitionManager, "partitionManager");
    }

    public Future<Void> createSimple(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);

        return validate(schema, name)
            .compose(v -> validateStandardIndexNames(name))
            .compose(v -> requireAbsent(schema, name))
            .compose(v -> pool.withTransaction(conn -> createTable(conn, schema, name, false)
                .compose(v2 -> createStandardIndexes(conn, schema, name))))
            .recover(err -> failed("create", fqn, err))
            .onSuccess(v -> logger.info("Created queue {}", fqn));
    }

    /**
     * Creates a range-partitioned queue on {@code created_at}, its template table, and
     * registers it with pg_partman.
     */
    public Future<Void> createPartitioned(SchemaName schema, QueueName name, PartitionConfig config) {
        Objects.requireNonNull(config, "config");
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);

        return validate(schema, name)
            .compose(v -> validateStandardIndexNames(name))
            .compose(v -> validateTemplateName(name))
            .compose(v -> requireAbsent(schema, name))
            .compose(v -> pool.withTransaction(conn -> createTable(conn, schema, name, true)
                .compose(v2 -> createStandardIndexes(conn, schema, name))
                .compose(v2 -> createTemplate(conn, schema, name))))
            .recover(err -> failed("create", fqn, err))
            .onSuccess(v -> logger.info("Created partitioned queue {} with template {}",
                fqn, FullyQualifiedName.of(schema, Queue.templateNameFor(name))))
            .compose(v -> partitionManager.registerParent(schema, name, config));
    }

    /**
     * @return whether a table {@code schema.name} exists; never fails for an absent table
     */
    public Future<Boolean> exists(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return pool.preparedQuery(QueueTableSql.EXISTS_SQL)
            .execute(Tuple.of(schema.value(), name.value()))
            .map(rows -> rows.iterator().next().getBoolean(0))
            .recover(err -> failed("check_exists", fqn, err));
    }

    public Future<Boolean> isPartitioned(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return pool.preparedQuery(QueueTableSql.IS_PARTITIONED_SQL)
            .execute(Tuple.of(schema.value(), name.value()))
            .map(rows -> rows.iterator().next().getBoolean(0))
            .recover(err -> failed("check_partitioned", fqn, err));
    }

    /**
     * Probes a queue. Fails with {@link QueueNotFoundException} when the table is absent.
     */
    public Future<Queue> get(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return validate(schema, name)
            .compose(v -> exists(schema, name))
            .compose(present -> {
                if (!present) {
                    return Future.failedFuture(new QueueNotFoundException(fqn));
                }
                return isPartitioned(schema, name)
                    .map(partitioned -> new Queue(name, schema, partitioned));
            });
    }

    /**
     * Drops the queue table and everything that depends on it. Dropping an absent queue
     * succeeds.
     */
    public Future<Void> drop(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return validate(schema, name)
            .compose(v -> execute(QueueTableSql.dropTable(schema, name)))
            .recover(err -> failed("drop", fqn, err))
            .onSuccess(v -> logger.info("Dropped queue {}", fqn));
    }

    /**
     * Drops the template table of a partitioned queue. {@code LIKE ... INCLUDING ALL} copies
     * structure without creating a dependency, so the parent's cascade does not remove it.
     */
    public Future<Void> dropTemplate(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return validate(schema, name)
            .compose(v -> validateTemplateName(name))
            .compose(v -> execute(QueueTableSql.dropTable(schema, Queue.templateNameFor(name))))
            .recover(err -> failed("drop_template", fqn, err))
            .onSuccess(v -> logger.debug("Dropped template table of {}", fqn));
    }

    private Future<Void> requireAbsent(SchemaName schema, QueueName name) {
        return exists(schema, name).compose(present -> {
            if (present) {
                return Future.failedFuture(new QueueAlreadyExistsException(FullyQualifiedName.of(schema, name)));
            }
            return Future.<Void>succeededFuture();
        });
    }

    private Future<Void> createTable(SqlConnection conn, SchemaName schema, QueueName name, boolean partitioned) {
        return execute(conn, QueueTableSql.createTable(schema, name, partitioned), "create_table", schema, name);
    }

    private Future<Void> createStandardIndexes(SqlConnection conn, SchemaName schema, QueueName name) {
        Future<Void> chain = Future.succeededFuture();
        for (StandardIndex index : StandardIndex.values()) {
            chain = chain.compose(v -> execute(conn, QueueTableSql.createStandardIndex(schema, name, index),
                "create_index" + index.suffix(), schema, name));
        }
        return chain;
    }

    private Future<Void> createTemplate(SqlConnection conn, SchemaName schema, QueueName name) {
        return execute(conn, QueueTableSql.createTemplate(schema, name), "create_template", schema, name);
    }

    private Future<Void> execute(SqlConnection conn, String sql, String operation, SchemaName schema, QueueName name) {
        logger.debug("Executing {}: {}", operation, sql);
        return conn.query(sql).execute()
            .<Void>mapEmpty()
            .recover(err -> {
                FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
                logger.error("Queue {} failed for {}: {}", operation, fqn, err.getMessage());
                return Future.failedFuture(QueueDdlException.wrap(operation, fqn, err));
            });
    }

    private Future<Void> execute(String sql) {
        logger.debug("Executing: {}", sql);
        return pool.query(sql).execute().mapEmpty();
    }

    private <T> Future<T> failed(String operation, FullyQualifiedName fqn, Throwable err) {
        if (err instanceof IllegalArgumentException || err instanceof QueueSchemaException) {
            return Future.failedFuture(err);
        }
        logger.error("Queue {} failed for {}: {}", operation, fqn, err.getMessage());
        return Future.failedFuture(new QueueDdlException(operation, fqn, err));
    }

    /**
     * Rejects invalid identifiers before any SQL reaches the database.
     */
    public static Future<Void> validate(SchemaName schema, QueueName name) {
        try {
            PostgreSqlIdentifierValidator.validate(schema.value(), "schema name");
            PostgreSqlIdentifierValidator.validate(name.value(), "queue name");
            return Future.succeededFuture();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    private static Future<Void> validateStandardIndexNames(QueueName name) {
        try {
            StandardIndex.validateNames(name);
            return Future.succeededFuture();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    private static Future<Void> validateTemplateName(QueueName name) {
        try {
            PostgreSqlIdentifierValidator.validate(Queue.templateNameFor(name).value(), "template table name");
            return Future.succeededFuture();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }
}
