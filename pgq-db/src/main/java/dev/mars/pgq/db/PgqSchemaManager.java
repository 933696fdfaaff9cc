package dev.mars.pgq.db;

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
import dev.mars.pgq.db.config.PgqConfiguration;
import dev.mars.pgq.db.connection.PgConnectionManager;
import dev.mars.pgq.db.index.CustomIndexManager;
import dev.mars.pgq.db.partman.PartitionManager;
import dev.mars.pgq.db.queue.QueueManager;
import dev.mars.pgq.db.reconcile.QueueReconciler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;

/**
 * Wires the queue schema components onto one shared pool.
 *
 * <pre>{@code
 * try (PgqSchemaManager manager = new PgqSchemaManager(new PgqConfiguration())) {
 *     QueueState state = manager.getLifecycleService()
 *         .create(QueueDefinition.builder().name("orders").build())
 *         .get();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgqSchemaManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgqSchemaManager.class);

    private final PgqConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final PgConnectionManager connectionManager;
    private final Pool pool;
    private final PartitionManager partitionManager;
    private final QueueManager queueManager;
    private final CustomIndexManager customIndexManager;
    private final QueueReconciler reconciler;

    public PgqSchemaManager(PgqConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null);
    }

    /**
     * @param vertx an application Vert.x instance to reuse, or null to create and own one
     */
    public PgqSchemaManager(PgqConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
        }

        this.connectionManager = new PgConnectionManager(this.vertx, meterRegistry);
        this.pool = connectionManager.getOrCreateReactivePool(PgqDefaults.DEFAULT_POOL_ID,
            configuration.getDatabaseConfig(), configuration.getPoolConfig());
        this.partitionManager = new PartitionManager(pool, configuration.getPartmanSchema(),
            configuration.getUndoBatchSize());
        this.queueManager = new QueueManager(pool, partitionManager);
        this.customIndexManager = new CustomIndexManager(pool);
        this.reconciler = new QueueReconciler(pool, queueManager, customIndexManager, partitionManager,
            configuration.getDefaultPartitionConfig(), meterRegistry);

        logger.info("Initialized pgq schema manager (profile={}, partman schema={})",
            configuration.getProfile(), configuration.getPartmanSchema());
    }

    public Future<Void> closeReactive() {
        return connectionManager.closeAsync()
            .compose(v -> {
                if (!vertxOwnedByManager) {
                    return Future.<Void>succeededFuture();
                }
                return vertx.close().recover(e -> {
                    if (e instanceof RejectedExecutionException || e.getCause() instanceof RejectedExecutionException) {
                        logger.debug("Vert.x event executor terminated during close; treating as closed.");
                        return Future.succeededFuture();
                    }
                    logger.warn("Error closing Vert.x instance", e);
                    return Future.succeededFuture();
                });
            });
    }

    /**
     * Blocks until pools and (when owned) Vert.x are closed. Must not be called on an
     * event loop thread.
     */
    @Override
    public void close() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            logger.warn("Blocking close() called on event loop thread; closing asynchronously instead");
            closeReactive();
            return;
        }
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing pgq schema manager");
        } catch (Exception e) {
            logger.error("Error closing pgq schema manager", e);
        }
    }

    public QueueLifecycleService getLifecycleService() { return reconciler; }
    public QueueManager getQueueManager() { return queueManager; }
    public CustomIndexManager getCustomIndexManager() { return customIndexManager; }
    public PartitionManager getPartitionManager() { return partitionManager; }
    public PgqConfiguration getConfiguration() { return configuration; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public Pool getPool() { return pool; }
}
