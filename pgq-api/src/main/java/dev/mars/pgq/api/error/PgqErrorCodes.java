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
package dev.mars.pgq.api.error;

/**
 * Error codes carried by {@link QueueSchemaException}.
 *
 * Codes use the PGQERR0150-0199 range.
 */
public final class PgqErrorCodes {

    private PgqErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // Queue Schema Errors (0150-0199)
    // ========================================================================
    public static final String QUEUE_NOT_FOUND = "PGQERR0150";
    public static final String QUEUE_ALREADY_EXISTS = "PGQERR0151";
    public static final String QUEUE_DDL_FAILED = "PGQERR0152";
    public static final String PARTMAN_FAILED = "PGQERR0153";
}
