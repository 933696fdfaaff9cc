package dev.mars.pgq.db.partman;

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

import dev.mars.pgq.api.error.PartmanException;
import dev.mars.pgq.api.model.FullyQualifiedName;
import dev.mars.pgq.api.model.PartitionConfig;
import dev.mars.pgq.api.model.Queue;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;
import dev.mars.pgq.db.PgqDefaults;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Bridges queue partition policies to pg_partman.
 *
 * <p>Interval, premake, retention, datetime string and optimize constraint live in
 * {@code part_config} and are read back from there. Whether a default partition exists
 * is read from the inheritance catalog instead, because it is a property of the live
 * table structure and can drift from what was requested at registration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PartitionManager {
    private static final Logger logger = LoggerFactory.getLogger(PartitionManager.class);

    private static final String DEFAULT_PARTITION_SQL = """
        SELECT EXISTS (
            SELECT 1 FROM pg_inherits i
            JOIN pg_class parent ON i.inhparent = parent.oid
            JOIN pg_class child ON i.inhrelid = child.oid
            JOIN pg_namespace n ON parent.relnamespace = n.oid
            WHERE n.nspname = $1
              AND parent.relname = $2
              AND child.relname LIKE '%\\_default'
        )
        """;

    private final Pool pool;
    private final String partmanSchema;
    private final int undoBatchSize;

    public PartitionManager(Pool pool) {
        this(pool, PgqDefaults.DEFAULT_PARTMAN_SCHEMA, PgqDefaults.DEFAULT_UNDO_BATCH_SIZE);
    }

    public PartitionManager(Pool pool, String partmanSchema, int undoBatchSize) {
        this.pool = Objects.requireNonNull(pool, "pool");
        PostgreSqlIdentifierValidator.validate(partmanSchema, "partman schema");
        if (undoBatchSize < 1) {
            throw new IllegalArgumentException("Undo batch size must be at least 1");
        }
        this.partmanSchema = PostgreSqlIdentifierValidator.quote(partmanSchema);
        this.undoBatchSize = undoBatchSize;
    }

    /**
     * Registers a committed parent table with pg_partman and immediately corrects the
     * {@code part_config} fields that {@code create_parent} fills with its own defaults.
     * Both statements run in one transaction of their own.
     */
    public Future<Void> registerParent(SchemaName schema, QueueName name, PartitionConfig config) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        String templateTable = FullyQualifiedName.of(schema, Queue.templateNameFor(name)).value();

        Tuple createParams = Tuple.of(
                fqn.value(),
                PgqDefaults.PARTITION_CONTROL_COLUMN,
                config.getInterval(),
                PgqDefaults.PARTITION_TYPE,
                config.getPremake())
            .addBoolean(config.isDefaultPartition())
            .addString("on")
            .addString(templateTable)
            .addBoolean(true);

        return pool.withTransaction(conn -> conn.preparedQuery(createParentSql())
                .execute(createParams)
                .recover(err -> Future.failedFuture(PartmanException.wrap("create_parent", fqn, err)))
                .compose(rs -> conn.preparedQuery(fixupConfigSql())
                    .execute(Tuple.of(fqn.value(), config.getRetention(), config.getDatetimeString(),
                        config.getOptimizeConstraint()))
                    .recover(err -> Future.failedFuture(PartmanException.wrap("update_config", fqn, err))))
                .<Void>mapEmpty())
            .recover(err -> failed("register", fqn, err))
            .onSuccess(v -> logger.info("Registered {} with pg_partman (interval={}, premake={}, retention={})",
                fqn, config.getInterval(), config.getPremake(), config.getRetention()));
    }

    /**
     * Reads the effective partition policy of a registered parent table.
     */
    public Future<PartitionConfig> getPartitionConfig(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);

        return pool.preparedQuery(selectConfigSql())
            .execute(Tuple.of(fqn.value()))
            .recover(err -> Future.failedFuture(PartmanException.wrap("get_config", fqn, err)))
            .compose(rows -> {
                RowIterator<Row> iterator = rows.iterator();
                if (!iterator.hasNext()) {
                    return Future.failedFuture(new PartmanException("get_config", fqn,
                        new IllegalStateException("No part_config row for parent table " + fqn)));
                }
                Row row = iterator.next();
                PartitionConfig.Builder builder = PartitionConfig.builder()
                    .interval(row.getString(0))
                    .premake(row.getInteger(1))
                    .retention(row.getString(2))
                    .datetimeString(row.getString(3))
                    .optimizeConstraint(row.getInteger(4));
                return pool.preparedQuery(DEFAULT_PARTITION_SQL)
                    .execute(Tuple.of(schema.value(), name.value()))
                    .recover(err -> Future.failedFuture(PartmanException.wrap("check_default_partition", fqn, err)))
                    .map(rs -> builder.defaultPartition(rs.iterator().next().getBoolean(0)).build());
            })
            .recover(err -> failed("get_config", fqn, err));
    }

    /**
     * Writes the stored policy fields. {@code defaultPartition} is structural and is not
     * touched, and {@code create_parent} is not called again.
     */
    public Future<Void> updatePartitionConfig(SchemaName schema, QueueName name, PartitionConfig config) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        Tuple params = Tuple.of(fqn.value(), config.getInterval(), config.getPremake(),
            config.getRetention(), config.getDatetimeString(), config.getOptimizeConstraint());

        return pool.preparedQuery(updateConfigSql())
            .execute(params)
            .<Void>mapEmpty()
            .recover(err -> failed("update_config", fqn, err))
            .onSuccess(v -> logger.info("Updated pg_partman config for {}: {}", fqn, config));
    }

    /**
     * Undoes partitioning of a parent table without keeping the emptied child tables.
     * Callers deleting a queue treat a failure here as non-fatal.
     */
    public Future<Void> removePartmanConfig(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);

        return pool.preparedQuery(undoPartitionSql())
            .execute(Tuple.of(fqn.value(), undoBatchSize))
            .<Void>mapEmpty()
            .recover(err -> Future.failedFuture(PartmanException.wrap("undo_partition", fqn, err)))
            .onSuccess(v -> logger.info("Undid pg_partman partitioning for {}", fqn));
    }

    /**
     * Deletes a leftover {@code part_config} row for a parent table that no longer exists.
     */
    public Future<Void> purgeConfig(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);

        return pool.preparedQuery("DELETE FROM " + partmanSchema + ".part_config WHERE parent_table = $1")
            .execute(Tuple.of(fqn.value()))
            .recover(err -> Future.failedFuture(PartmanException.wrap("purge_config", fqn, err)))
            .map(rs -> {
                if (rs.rowCount() > 0) {
                    logger.info("Removed stale pg_partman config for {}", fqn);
                }
                return null;
            });
    }

    private <T> Future<T> failed(String operation, FullyQualifiedName fqn, Throwable err) {
        logger.error("pg_partman {} failed for {}: {}", operation, fqn, err.getMessage());
        return Future.failedFuture(PartmanException.wrap(operation, fqn, err));
    }

    String createParentSql() {
        return "SELECT " + partmanSchema + """
            .create_parent(
                p_parent_table          := $1::text,
                p_control               := $2::text,
                p_interval              := $3::text,
                p_type                  := $4::text,
                p_premake               := $5::int,
                p_default_table         := $6::boolean,
                p_automatic_maintenance := $7::text,
                p_template_table        := $8::text,
                p_jobmon                := $9::boolean
            )
            """;
    }

    String fixupConfigSql() {
        return "UPDATE " + partmanSchema + """
            .part_config
            SET retention = $2,
                retention_keep_index = TRUE,
                retention_keep_table = FALSE,
                datetime_string = $3,
                optimize_constraint = $4,
                ignore_default_data = TRUE
            WHERE parent_table = $1
            """;
    }

    String selectConfigSql() {
        return "SELECT partition_interval::text, premake, retention::text, datetime_string, optimize_constraint "
            + "FROM " + partmanSchema + ".part_config WHERE parent_table = $1";
    }

    String updateConfigSql() {
        return "UPDATE " + partmanSchema + """
            .part_config
            SET partition_interval = $2, premake = $3, retention = $4,
                datetime_string = $5, optimize_constraint = $6
            WHERE parent_table = $1
            """;
    }

    String undoPartitionSql() {
        return "SELECT " + partmanSchema
            + ".undo_partition(p_parent_table := $1::text, p_loop_count := $2::int, p_keep_table := false)";
    }
}
