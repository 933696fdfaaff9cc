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

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration for PostgreSQL database connections.
 *
 * <p>Mirrors the libpq connection parameters used by the surrounding tooling:
 * host, port, database, user, password and {@code sslmode}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgConnectionConfig {

    /**
     * The libpq {@code sslmode} values, in increasing order of strictness.
     */
    public static final List<String> SSL_MODES =
        List.of("disable", "allow", "prefer", "require", "verify-ca", "verify-full");

    public static final String DEFAULT_SSL_MODE = "prefer";

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final String sslMode;

    private PgConnectionConfig(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.password = builder.password;
        this.sslMode = Objects.requireNonNull(builder.sslMode, "SSL mode cannot be null");
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getSslMode() {
        return sslMode;
    }

    /**
     * Creates a JDBC URL for this configuration.
     *
     * @return The JDBC URL
     */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database + "?sslmode=" + sslMode;
    }

    @Override
    public String toString() {
        return "PgConnectionConfig{" +
            "host='" + host + '\'' +
            ", port=" + port +
            ", database='" + database + '\'' +
            ", username='" + username + '\'' +
            ", sslMode='" + sslMode + '\'' +
            '}';
    }

    /**
     * Builder for PgConnectionConfig.
     */
    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password = "";
        private String sslMode = DEFAULT_SSL_MODE;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder sslMode(String sslMode) {
            this.sslMode = sslMode;
            return this;
        }

        public PgConnectionConfig build() {
            sslMode = sslMode == null ? DEFAULT_SSL_MODE : sslMode.toLowerCase(Locale.ROOT);
            if (!SSL_MODES.contains(sslMode)) {
                throw new IllegalArgumentException("Unsupported sslmode '" + sslMode + "', expected one of " + SSL_MODES);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Database port must be between 1 and 65535");
            }
            return new PgConnectionConfig(this);
        }
    }
}
