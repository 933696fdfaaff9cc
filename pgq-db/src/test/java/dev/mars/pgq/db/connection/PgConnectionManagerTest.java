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
import dev.mars.pgq.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pool bookkeeping and option mapping. Pools are built lazily, so nothing here connects.
 */
@Tag(TestCategories.CORE)
public class PgConnectionManagerTest {

    private PgConnectionManager connectionManager;
    private SimpleMeterRegistry registry;
    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        registry = new SimpleMeterRegistry();
        connectionManager = new PgConnectionManager(vertx, registry);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (connectionManager != null) {
            connectionManager.close();
        }
        if (vertx != null) {
            vertx.close().toCompletionStage().toCompletableFuture().get();
        }
    }

    private static PgConnectionConfig config(String sslMode) {
        return new PgConnectionConfig.Builder()
                .host("db.example")
                .port(6543)
                .database("queues")
                .username("pgq")
                .password("secret")
                .sslMode(sslMode)
                .build();
    }

    @Test
    void testGetOrCreateReactivePoolReturnsSameInstance() {
        PgPoolConfig poolConfig = new PgPoolConfig.Builder().maxSize(5).build();

        Pool pool = connectionManager.getOrCreateReactivePool("test-service", config("disable"), poolConfig);
        Pool pool2 = connectionManager.getOrCreateReactivePool("test-service", config("disable"), poolConfig);

        assertNotNull(pool);
        assertSame(pool, pool2);
        assertSame(pool, connectionManager.getExistingPool("test-service"));
        assertEquals(1.0, registry.get("pgq.db.pool.created").tag("service", "test-service").counter().count());
    }

    @Test
    void testBlankServiceIdUsesDefaultPool() {
        Pool pool = connectionManager.getOrCreateReactivePool(null, config("disable"),
            new PgPoolConfig.Builder().build());

        assertSame(pool, connectionManager.getExistingPool(PgqDefaults.DEFAULT_POOL_ID));
        assertSame(pool, connectionManager.getExistingPool(" "));
        assertNull(connectionManager.getExistingPool("unknown"));
    }

    @Test
    void testClosePoolRemovesIt() throws Exception {
        connectionManager.getOrCreateReactivePool("closing", config("disable"), new PgPoolConfig.Builder().build());

        connectionManager.closePoolAsync("closing").toCompletionStage().toCompletableFuture().get();

        assertNull(connectionManager.getExistingPool("closing"));
    }

    @Test
    void testConnectOptionsMapping() {
        PgConnectOptions options = PgConnectionManager.toConnectOptions(config("disable"));

        assertEquals("db.example", options.getHost());
        assertEquals(6543, options.getPort());
        assertEquals("queues", options.getDatabase());
        assertEquals("pgq", options.getUser());
        assertEquals("secret", options.getPassword());
        assertEquals(SslMode.DISABLE, options.getSslMode());
    }

    @Test
    void testNonVerifyingSslModesTrustServer() {
        for (String mode : new String[] {"allow", "prefer", "require"}) {
            PgConnectOptions options = PgConnectionManager.toConnectOptions(config(mode));
            assertEquals(SslMode.of(mode), options.getSslMode());
            assertTrue(options.getSslOptions().isTrustAll(), mode);
        }
    }

    @Test
    void testVerifyingSslModesDoNotTrustAll() {
        PgConnectOptions options = PgConnectionManager.toConnectOptions(config("VERIFY-FULL"));
        assertEquals(SslMode.VERIFY_FULL, options.getSslMode());
        assertTrue(options.getSslOptions() == null || !options.getSslOptions().isTrustAll());
    }

    @Test
    void testInvalidSslModeRejected() {
        assertThrows(IllegalArgumentException.class, () -> config("sometimes"));
    }

    @Test
    void testNullVertxRejected() {
        assertThrows(NullPointerException.class, () -> new PgConnectionManager(null));
    }

    @Test
    void testClosePoolWithNullIdClosesDefaultPool() throws Exception {
        PgPoolConfig poolConfig = new PgPoolConfig.Builder().build();
        connectionManager.getOrCreateReactivePool(null, config("disable"), poolConfig);
        assertNotNull(connectionManager.getExistingPool(PgqDefaults.DEFAULT_POOL_ID));

        connectionManager.closePoolAsync(null).toCompletionStage().toCompletableFuture().get();

        assertNull(connectionManager.getExistingPool(PgqDefaults.DEFAULT_POOL_ID));
        // nothing left to close
        connectionManager.closePoolAsync(null).toCompletionStage().toCompletableFuture().get();
    }

    @Test
    void testSubSecondTimeoutsAreKept() {
        PgPoolConfig poolConfig = new PgPoolConfig.Builder()
                .maxSize(7)
                .connectionTimeout(Duration.ofMillis(250))
                .idleTimeout(Duration.ofMillis(1500))
                .build();

        PoolOptions options = PgConnectionManager.toPoolOptions(poolConfig);

        assertEquals(7, options.getMaxSize());
        assertEquals(250, options.getConnectionTimeout());
        assertEquals(TimeUnit.MILLISECONDS, options.getConnectionTimeoutUnit());
        assertEquals(1500, options.getIdleTimeout());
        assertEquals(TimeUnit.MILLISECONDS, options.getIdleTimeoutUnit());
    }
}
