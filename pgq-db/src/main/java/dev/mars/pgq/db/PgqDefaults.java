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

/**
 * Default constants for the queue schema manager.
 *
 * <p>These values are shared by the configuration layer and the partition manager.
 * External consumers should configure them through {@code pgq-default.properties}
 * or {@code pgq.*} system properties rather than referencing them directly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PgqDefaults {

    /**
     * Identifier of the single pool that backs all schema operations.
     */
    public static final String DEFAULT_POOL_ID = "pgq-schema";

    /**
     * Schema in which the pg_partman extension is installed.
     */
    public static final String DEFAULT_PARTMAN_SCHEMA = "partman";

    /**
     * Number of child partitions moved per loop when undoing partitioning.
     */
    public static final int DEFAULT_UNDO_BATCH_SIZE = 20;

    /**
     * Column every partitioned queue is ranged on.
     */
    public static final String PARTITION_CONTROL_COLUMN = "created_at";

    public static final String PARTITION_TYPE = "range";

    private PgqDefaults() {
        // Prevent instantiation
    }
}
