package dev.mars.pgq.db.reconcile;

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

import dev.mars.pgq.api.QueueLifecycleService;
import dev.mars.pgq.api.model.CustomIndex;
import dev.mars.pgq.api.model.FullyQualifiedName;
import dev.mars.pgq.api.model.PartitionConfig;
import dev.mars.pgq.api.model.Queue;
import dev.mars.pgq.api.model.QueueDefinition;
import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.model.QueueState;
import dev.mars.pgq.api.model.SchemaName;
import dev.mars.pgq.db.index.CustomIndexManager;
import dev.mars.pgq.db.index.IndexReconciliationPlan;
import dev.mars.pgq.db.partman.PartitionManager;
import dev.mars.pgq.db.queue.QueueManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Converges queue tables towards declared definitions.
 *
 * <p>Each call is one sequential chain over the shared pool. Calls for different queues
 * are independent; calls racing on the same queue are not serialised here, so callers
 * that need mutual exclusion across create and partition registration must lock
 * externally (for example with an advisory lock keyed on the fully qualified name).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class QueueReconciler implements QueueLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(QueueReconciler.class);

    private final Pool pool;
    private final QueueManager queueManager;
    private final CustomIndexManager customIndexManager;
    private final PartitionManager partitionManager;
    private final PartitionConfig defaultPartitionConfig;
    private final MeterRegistry meter;

    public QueueReconciler(Pool pool, QueueManager queueManager, CustomIndexManager customIndexManager,
                           PartitionManager partitionManager, PartitionConfig defaultPartitionConfig,
                           MeterRegistry meter) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.queueManager = Objects.requireNonNull(queueManager, "queueManager");
        this.customIndexManager = Objects.requireNonNull(customIndexManager, "customIndexManager");
        this.partitionManager = Objects.requireNonNull(partitionManager, "partitionManager");
        this.defaultPartitionConfig = Objects.requireNonNull(defaultPartitionConfig, "defaultPartitionConfig");
        this.meter = meter;
    }

    @Override
    public CompletableFuture<QueueState> create(QueueDefinition definition) {
        return toCompletableFuture("create", createInternal(definition));
    }

    @Override
    public CompletableFuture<QueueState> read(SchemaName schema, QueueName name) {
        return toCompletableFuture("read", readInternal(schema, name));
    }

    @Override
    public CompletableFuture<QueueState> update(QueueState observed, QueueDefinition desired) {
        return toCompletableFuture("update", updateInternal(observed, desired));
    }

    @Override
    public CompletableFuture<Void> delete(SchemaName schema, QueueName name) {
        return toCompletableFuture("delete", deleteInternal(schema, name));
    }

    @Override
    public CompletableFuture<QueueState> importQueue(String id) {
        Future<QueueState> result;
        try {
            FullyQualifiedName.Parts parts = new FullyQualifiedName(id).split();
            result = readInternal(parts.schema(), parts.name());
        } catch (IllegalArgumentException e) {
            result = Future.failedFuture(e);
        }
        return toCompletableFuture("import", result);
    }

    Future<QueueState> createInternal(QueueDefinition definition) {
        SchemaName schema = definition.getSchema();
        QueueName name = definition.getName();
        logger.debug("Creating queue {} (partitioned={})", definition.fqn(), definition.isPartitioned());
        try {
            // custom indexes are created after the queue commits; reject bad ones first
            IndexReconciliationPlan.compute(name, List.of(), definition.getCustomIndexes());
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        Future<Void> created = definition.isPartitioned()
            ? queueManager.createPartitioned(schema, name, definition.getPartitionConfig().orElse(defaultPartitionConfig))
            : queueManager.createSimple(schema, name);

        return created
            .compose(v -> createIndexes(schema, name, definition.getCustomIndexes()))
            .compose(v -> readInternal(schema, name));
    }

    Future<QueueState> readInternal(SchemaName schema, QueueName name) {
        return queueManager.get(schema, name).compose(queue -> readPartitionConfig(queue)
            .compose(config -> readCustomIndexes(queue)
                .map(indexes -> new QueueState(queue, config, indexes))));
    }

    Future<QueueState> updateInternal(QueueState observed, QueueDefinition desired) {
        Queue queue = observed.getQueue();
        FullyQualifiedName fqn = queue.fqn();
        if (!fqn.equals(desired.fqn())) {
            return Future.failedFuture(new IllegalArgumentException(
                "Cannot update " + fqn + " to a different queue " + desired.fqn()));
        }
        if (queue.partitioned() != desired.isPartitioned()) {
            return Future.failedFuture(new IllegalArgumentException(
                "Changing partitioning of " + fqn + " requires replacing the queue"));
        }

        return updatePartitionConfig(observed, desired)
            .compose(v -> observedIndexes(observed))
            .compose(state -> applyIndexPlan(queue,
                IndexReconciliationPlan.compute(queue.name(), state, desired.getCustomIndexes())))
            .compose(v -> readInternal(queue.schema(), queue.name()));
    }

    Future<Void> deleteInternal(SchemaName schema, QueueName name) {
        FullyQualifiedName fqn = FullyQualifiedName.of(schema, name);
        return QueueManager.validate(schema, name)
            .compose(v -> queueManager.isPartitioned(schema, name))
            .compose(partitioned -> {
                if (!partitioned) {
                    return queueManager.drop(schema, name);
                }
                return partitionManager.removePartmanConfig(schema, name)
                    .recover(err -> {
                        logger.warn("Failed to remove pg_partman config for {}, dropping table anyway: {}",
                            fqn, err.getMessage());
                        return Future.succeededFuture();
                    })
                    .compose(v -> queueManager.drop(schema, name))
                    .compose(v -> queueManager.dropTemplate(schema, name))
                    .compose(v -> partitionManager.purgeConfig(schema, name)
                        .recover(err -> {
                            logger.warn("Failed to purge pg_partman config for {}: {}", fqn, err.getMessage());
                            return Future.succeededFuture();
                        }));
            });
    }

    private Future<Void> createIndexes(SchemaName schema, QueueName name, List<CustomIndex> indexes) {
        if (indexes.isEmpty()) {
            return Future.succeededFuture();
        }
        return pool.withTransaction(conn -> customIndexManager.create(conn, schema, name, indexes))
            .mapEmpty();
    }

    private Future<PartitionConfig> readPartitionConfig(Queue queue) {
        if (!queue.partitioned()) {
            return Future.succeededFuture(null);
        }
        return partitionManager.getPartitionConfig(queue.schema(), queue.name())
            .recover(err -> {
                logger.warn("Could not read partition config of {}: {}", queue.fqn(), err.getMessage());
                return Future.succeededFuture(null);
            });
    }

    private Future<List<CustomIndex>> readCustomIndexes(Queue queue) {
        return customIndexManager.get(queue.schema(), queue.name())
            .recover(err -> {
                logger.warn("Could not read custom indexes of {}: {}", queue.fqn(), err.getMessage());
                return Future.succeededFuture(null);
            });
    }

    private Future<Void> updatePartitionConfig(QueueState observed, QueueDefinition desired) {
        if (!desired.isPartitioned()) {
            return Future.succeededFuture();
        }
        Queue queue = observed.getQueue();
        PartitionConfig target = desired.getPartitionConfig().orElse(defaultPartitionConfig);
        Optional<PartitionConfig> current = observed.getPartitionConfig();

        if (current.isPresent() && current.get().isDefaultPartition() != target.isDefaultPartition()) {
            logger.warn("Default partition of {} is {} but {} was requested; it is only set when the queue is created",
                queue.fqn(), current.get().isDefaultPartition(), target.isDefaultPartition());
        }
        if (current.isPresent() && current.get().storedFieldsEqual(target)) {
            logger.debug("Partition config of {} unchanged", queue.fqn());
            return Future.succeededFuture();
        }
        return partitionManager.updatePartitionConfig(queue.schema(), queue.name(), target);
    }

    private Future<List<CustomIndex>> observedIndexes(QueueState observed) {
        Optional<List<CustomIndex>> known = observed.getCustomIndexes();
        if (known.isPresent()) {
            return Future.succeededFuture(known.get());
        }
        Queue queue = observed.getQueue();
        return customIndexManager.get(queue.schema(), queue.name());
    }

    private Future<Void> applyIndexPlan(Queue queue, IndexReconciliationPlan plan) {
        if (plan.isEmpty()) {
            logger.debug("Custom indexes of {} unchanged", queue.fqn());
            return Future.succeededFuture();
        }
        logger.info("Reconciling custom indexes of {}: {}", queue.fqn(), plan);
        return customIndexManager.drop(queue.schema(), queue.name(), plan.getToDrop())
            .compose(v -> createIndexes(queue.schema(), queue.name(), plan.getToCreate()));
    }

    private <T> CompletableFuture<T> toCompletableFuture(String operation, Future<T> future) {
        return future
            .onSuccess(v -> count(operation, "success"))
            .onFailure(err -> count(operation, "failure"))
            .toCompletionStage()
            .toCompletableFuture();
    }

    private void count(String operation, String outcome) {
        if (meter != null) {
            Counter.builder("pgq.schema.operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meter)
                .increment();
        }
    }
}
