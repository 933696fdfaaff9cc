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

import dev.mars.pgq.api.model.PartitionConfig;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;
import dev.mars.pgq.db.PgqDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration for the queue schema manager.
 *
 * <p>Sources, lowest precedence first:
 * <ol>
 *   <li>{@code /pgq-default.properties} on the classpath</li>
 *   <li>{@code /pgq-<profile>.properties} when a profile other than {@code default} is active</li>
 *   <li>libpq environment variables ({@code PGHOST}, {@code PGPORT}, {@code PGDATABASE},
 *       {@code PGUSER}, {@code PGPASSWORD}, {@code PGSSLMODE})</li>
 *   <li>{@code PGQ_*} environment variables, e.g. {@code PGQ_PARTMAN_SCHEMA}</li>
 *   <li>{@code pgq.*} system properties</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgqConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgqConfiguration.class);

    public static final String DATABASE_HOST = "pgq.database.host";
    public static final String DATABASE_PORT = "pgq.database.port";
    public static final String DATABASE_NAME = "pgq.database.name";
    public static final String DATABASE_USERNAME = "pgq.database.username";
    public static final String DATABASE_PASSWORD = "pgq.database.password";
    public static final String DATABASE_SSLMODE = "pgq.database.sslmode";
    public static final String PARTMAN_SCHEMA = "pgq.partman.schema";
    public static final String PARTMAN_UNDO_BATCH_SIZE = "pgq.partman.undo.batch.size";

    private static final Map<String, String> LIBPQ_VARIABLES = Map.of(
        "PGHOST", DATABASE_HOST,
        "PGPORT", DATABASE_PORT,
        "PGDATABASE", DATABASE_NAME,
        "PGUSER", DATABASE_USERNAME,
        "PGPASSWORD", DATABASE_PASSWORD,
        "PGSSLMODE", DATABASE_SSLMODE);

    private final Properties properties;
    private final String profile;

    public PgqConfiguration() {
        this(getActiveProfile());
    }

    public PgqConfiguration(String profile) {
        this(profile, System.getenv());
    }

    PgqConfiguration(String profile, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        validateConfiguration();
        logger.info("Loaded pgq configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgq.profile",
               System.getenv("PGQ_PROFILE") != null ? System.getenv("PGQ_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgq-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgq-" + profile + ".properties");
        }

        LIBPQ_VARIABLES.forEach((variable, propKey) -> {
            String value = environment.get(variable);
            if (value != null && !value.isEmpty()) {
                props.setProperty(propKey, value);
            }
        });

        // PGQ_PARTMAN_SCHEMA -> pgq.partman.schema
        environment.forEach((key, value) -> {
            if (key.startsWith("PGQ_") && !"PGQ_PROFILE".equals(key)) {
                props.setProperty(key.toLowerCase().replace("_", "."), value);
            }
        });

        // System properties last so tests can override via -D or System.setProperty
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgq.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validatePartmanConfig(errors);
        validatePartitionDefaults(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString(DATABASE_HOST, "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt(DATABASE_PORT, 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString(DATABASE_NAME, "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString(DATABASE_USERNAME, "").isEmpty()) {
            errors.add("Database username is required");
        }

        String sslMode = getString(DATABASE_SSLMODE, PgConnectionConfig.DEFAULT_SSL_MODE).toLowerCase();
        if (!PgConnectionConfig.SSL_MODES.contains(sslMode)) {
            errors.add("Database sslmode must be one of " + PgConnectionConfig.SSL_MODES);
        }

        if (getInt("pgq.database.pool.max-size", 4) < 1) {
            errors.add("Pool max size must be at least 1");
        }
    }

    private void validatePartmanConfig(List<String> errors) {
        if (!PostgreSqlIdentifierValidator.isValid(getPartmanSchema())) {
            errors.add("Partman schema must be a valid PostgreSQL identifier");
        }
        if (getUndoBatchSize() < 1) {
            errors.add("Partman undo batch size must be at least 1");
        }
    }

    private void validatePartitionDefaults(List<String> errors) {
        if (getString("pgq.partition.interval", PartitionConfig.DEFAULT_INTERVAL).isBlank()) {
            errors.add("Default partition interval is required");
        }
        if (getInt("pgq.partition.premake", PartitionConfig.DEFAULT_PREMAKE) < 0) {
            errors.add("Default partition premake must be non-negative");
        }
        if (getInt("pgq.partition.optimize-constraint", PartitionConfig.DEFAULT_OPTIMIZE_CONSTRAINT) < 0) {
            errors.add("Default partition optimize constraint must be non-negative");
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // Specific configuration builders
    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString(DATABASE_HOST, "localhost"))
            .port(getInt(DATABASE_PORT, 5432))
            .database(getString(DATABASE_NAME, "postgres"))
            .username(getString(DATABASE_USERNAME, "postgres"))
            .password(getString(DATABASE_PASSWORD, ""))
            .sslMode(getString(DATABASE_SSLMODE, PgConnectionConfig.DEFAULT_SSL_MODE))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("pgq.database.pool.max-size", 4))
            .maxWaitQueueSize(getInt("pgq.database.pool.max-wait-queue-size", 32))
            .connectionTimeout(Duration.ofMillis(getLong("pgq.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("pgq.database.pool.idle-timeout-ms", 600000)))
            .build();
    }

    /**
     * @return the partition policy applied to partitioned queues that do not specify one
     */
    public PartitionConfig getDefaultPartitionConfig() {
        return PartitionConfig.builder()
            .interval(getString("pgq.partition.interval", PartitionConfig.DEFAULT_INTERVAL))
            .premake(getInt("pgq.partition.premake", PartitionConfig.DEFAULT_PREMAKE))
            .retention(getString("pgq.partition.retention", PartitionConfig.DEFAULT_RETENTION))
            .datetimeString(getString("pgq.partition.datetime-string", PartitionConfig.DEFAULT_DATETIME_STRING))
            .optimizeConstraint(getInt("pgq.partition.optimize-constraint", PartitionConfig.DEFAULT_OPTIMIZE_CONSTRAINT))
            .defaultPartition(getBoolean("pgq.partition.default-partition", PartitionConfig.DEFAULT_DEFAULT_PARTITION))
            .build();
    }

    public String getPartmanSchema() {
        return getString(PARTMAN_SCHEMA, PgqDefaults.DEFAULT_PARTMAN_SCHEMA);
    }

    public int getUndoBatchSize() {
        return getInt(PARTMAN_UNDO_BATCH_SIZE, PgqDefaults.DEFAULT_UNDO_BATCH_SIZE);
    }

    public String getProfile() { return profile; }
    public Properties getProperties() { return new Properties(properties); }
}
