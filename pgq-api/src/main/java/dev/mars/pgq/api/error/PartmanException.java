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

import dev.mars.pgq.api.model.FullyQualifiedName;

/**
 * A call into the partition maintenance engine failed: registration, the configuration
 * fix-up after it, reading or writing {@code part_config}, or undoing partitioning.
 */
public class PartmanException extends QueueSchemaException {

    public PartmanException(String operation, FullyQualifiedName fqn, Throwable cause) {
        super(PgqErrorCodes.PARTMAN_FAILED, operation, fqn,
            "pg_partman error during " + operation + " on " + fqn + ": " + QueueDdlException.describe(cause), cause);
    }

    public static QueueSchemaException wrap(String operation, FullyQualifiedName fqn, Throwable cause) {
        if (cause instanceof QueueSchemaException) {
            return (QueueSchemaException) cause;
        }
        return new PartmanException(operation, fqn, cause);
    }
}
