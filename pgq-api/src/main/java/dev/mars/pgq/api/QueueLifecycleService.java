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
package dev.mars.pgq.api;

import dev.mars.pgq.api.model.QueueDefinition;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.QueueState;
import dev.mars.pgq.api.model.SchemaName;
import io.vertx.core.Future;

import java.util.concurrent.CompletableFuture;

/**
 * Declarative lifecycle of queue tables: create, read, update and delete keyed by
 * schema and queue name.
 *
 * <p>External API uses CompletableFuture for non-Vert.x consumers; the
 * {@code ...Reactive} defaults give Vert.x callers a {@link Future}. Failures complete the
 * future exceptionally with a {@link dev.mars.pgq.api.error.QueueSchemaException} subclass,
 * or with {@link IllegalArgumentException} for rejected input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public interface QueueLifecycleService {

    /**
     * Creates the queue table, its standard indexes, and for a partitioned queue the
     * template table and the partition engine registration; then creates the custom
     * indexes of the definition in one further transaction.
     *
     * @param definition the desired queue
     * @return the state read back after creation
     */
    CompletableFuture<QueueState> create(QueueDefinition definition);

    /**
     * Reads the live state of a queue. Completes with
     * {@link dev.mars.pgq.api.error.QueueNotFoundException} when the table is absent.
     */
    CompletableFuture<QueueState> read(SchemaName schema, QueueName name);

    /**
     * Converges a queue from its observed state to a desired definition: the partition
     * policy is written through and the custom indexes are diffed by name, dropped, then
     * created.
     *
     * @param observed the state last read for this queue
     * @param desired  the target definition for the same schema and name
     * @return the state read back after the update
     */
    CompletableFuture<QueueState> update(QueueState observed, QueueDefinition desired);

    /**
     * Drops the queue. Unregistering a partitioned queue from the partition engine is
     * best effort; dropping an absent queue succeeds.
     */
    CompletableFuture<Void> delete(SchemaName schema, QueueName name);

    /**
     * Reads an existing queue identified by its {@code schema.queue} string.
     */
    CompletableFuture<QueueState> importQueue(String id);

    default Future<QueueState> createReactive(QueueDefinition definition) {
        return Future.fromCompletionStage(create(definition));
    }

    default Future<QueueState> readReactive(SchemaName schema, QueueName name) {
        return Future.fromCompletionStage(read(schema, name));
    }

    default Future<QueueState> updateReactive(QueueState observed, QueueDefinition desired) {
        return Future.fromCompletionStage(update(observed, desired));
    }

    default Future<Void> deleteReactive(SchemaName schema, QueueName name) {
        return Future.fromCompletionStage(delete(schema, name));
    }
}
