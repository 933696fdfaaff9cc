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

import dev.mars.pgq.db.config.PgConnectionConfig;
import dev.mars.pgq.db.config.PgPoolConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.testcontainers.containers.PostgreSQLContainer;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Helpers shared by the pgq-db tests.
 */
public final class PgqTestSupport {

    private PgqTestSupport() {
    }

    public static PgConnectionConfig connectionConfig(PostgreSQLContainer<?> postgres) {
        return new PgConnectionConfig.Builder()
                .host(postgres.getHost())
                .port(postgres.getFirstMappedPort())
                .database(postgres.getDatabaseName())
                .username(postgres.getUsername())
                .password(postgres.getPassword())
                .sslMode("disable")
                .build();
    }

    public static PgPoolConfig poolConfig() {
        return new PgPoolConfig.Builder().maxSize(4).build();
    }

    /**
     * A pool that is never connected. Building one does not touch the network, so it
     * serves tests that fail before any SQL is issued.
     */
    public static Pool unconnectedPool(Vertx vertx) {
        return PgBuilder.pool()
                .with(new PoolOptions().setMaxSize(1))
                .connectingTo(new PgConnectOptions().setHost("localhost").setPort(1).setDatabase("none").setUser("none"))
                .using(vertx)
                .build();
    }

    /** A fresh queue name so tests sharing a reused container never collide. */
    public static String uniqueName(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 10);
    }

    public static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }

    /**
     * Waits for {@code future} to fail and returns the failure cause.
     */
    public static Throwable awaitFailure(Future<?> future) throws Exception {
        try {
            future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        return fail("Expected the operation to fail");
    }
}
