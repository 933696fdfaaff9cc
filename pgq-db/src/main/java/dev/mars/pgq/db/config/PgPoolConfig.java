package dev.mars.pgq.db.config;

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

import java.time.Duration;
import java.util.Objects;

/**
 * Reactive PostgreSQL pool configuration for Vert.x 5.x.
 *
 * <p>Schema reconciliation runs one strictly sequential chain per request, so the
 * defaults are much smaller than a message-processing pool would use.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;

    private PgPoolConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
    }

    /**
     * Maximum number of connections in the pool.
     * Maps directly to Vert.x PoolOptions.setMaxSize().
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Maximum number of requests that can wait for a connection.
     * Maps directly to Vert.x PoolOptions.setMaxWaitQueueSize().
     */
    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    @Override
    public String toString() {
        return "PgPoolConfig{" +
            "maxSize=" + maxSize +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", connectionTimeout=" + connectionTimeout +
            ", idleTimeout=" + idleTimeout +
            '}';
    }

    public static final class Builder {
        private int maxSize = 4;
        private int maxWaitQueueSize = 32;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            return this;
        }

        public PgPoolConfig build() {
            if (maxSize < 1) {
                throw new IllegalArgumentException("Pool max size must be at least 1");
            }
            return new PgPoolConfig(this);
        }
    }
}
