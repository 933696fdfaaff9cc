package dev.mars.pgq.db.connection;

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

import dev.mars.pgq.db.PgqDefaults;
import dev.mars.pgq.db.config.PgConnectionConfig;
import dev.mars.pgq.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.net.ClientSSLOptions;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Owns the Vert.x reactive pools used for schema operations.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final MeterRegistry meter;
    private final Map<String, Pool> reactivePools = new ConcurrentHashMap<>();
    private final Vertx vertx;

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
    }

    /**
     * Creates or retrieves the pool registered under {@code serviceId}.
     *
     * @param serviceId        pool identifier, or null for the default pool
     * @param connectionConfig connection parameters
     * @param poolConfig       pool sizing
     * @return the pool
     */
    public Pool getOrCreateReactivePool(String serviceId,
                                        PgConnectionConfig connectionConfig,
                                        PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        return reactivePools.computeIfAbsent(resolveServiceId(serviceId), id -> {
            Pool pool = createReactivePool(connectionConfig, poolConfig);
            logger.info("Created reactive pool for service '{}' ({}:{}/{}, sslmode={})", id,
                connectionConfig.getHost(), connectionConfig.getPort(),
                connectionConfig.getDatabase(), connectionConfig.getSslMode());
            if (meter != null) {
                Counter.builder("pgq.db.pool.created")
                    .tag("service", id)
                    .register(meter)
                    .increment();
            }
            return pool;
        });
    }

    /**
     * @return the existing pool, or null when none was created for {@code serviceId}
     */
    public Pool getExistingPool(String serviceId) {
        return reactivePools.get(resolveServiceId(serviceId));
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank())
            ? PgqDefaults.DEFAULT_POOL_ID
            : serviceId;
    }

    private Pool createReactivePool(PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        PgConnectOptions connectOptions = toConnectOptions(connectionConfig);

        return PgBuilder.pool()
            .with(toPoolOptions(poolConfig))
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Timeouts are passed in milliseconds, the unit they are configured in; 0 disables them.
     */
    static PoolOptions toPoolOptions(PgPoolConfig poolConfig) {
        return new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout(toMillis(poolConfig.getConnectionTimeout()))
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout(toMillis(poolConfig.getIdleTimeout()))
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS);
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(duration.toMillis(), Integer.MAX_VALUE);
    }

    /**
     * Maps the libpq style configuration onto Vert.x connect options. The non-verifying
     * modes trust any server certificate, as libpq does.
     */
    static PgConnectOptions toConnectOptions(PgConnectionConfig connectionConfig) {
        SslMode sslMode = SslMode.of(connectionConfig.getSslMode());
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword())
            .setSslMode(sslMode);

        if (sslMode == SslMode.ALLOW || sslMode == SslMode.PREFER || sslMode == SslMode.REQUIRE) {
            connectOptions.setSslOptions(new ClientSSLOptions()
                .setTrustAll(true)
                .setHostnameVerificationAlgorithm(""));
        }
        return connectOptions;
    }

    public Future<Void> closePoolAsync(String serviceId) {
        String id = resolveServiceId(serviceId);
        Pool pool = reactivePools.remove(id);
        if (pool == null) {
            logger.debug("No pool found for service: {}", id);
            return Future.succeededFuture();
        }
        return pool.close()
            .onSuccess(v -> logger.debug("Closed reactive pool for service: {}", id))
            .onFailure(err -> logger.warn("Failed to close reactive pool for service: {}", id, err));
    }

    public Future<Void> closeAsync() {
        if (reactivePools.isEmpty()) {
            return Future.succeededFuture();
        }
        List<Future<Void>> closeFutures = new ArrayList<>();
        for (String serviceId : reactivePools.keySet()) {
            closeFutures.add(closePoolAsync(serviceId));
        }
        return Future.all(closeFutures)
            .<Void>mapEmpty()
            .recover(throwable -> {
                logger.warn("Some pools failed to close cleanly: {}", throwable.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Synchronous wrapper for AutoCloseable compatibility. Prefer {@link #closeAsync()}.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing pools");
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }
}
