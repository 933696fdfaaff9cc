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
 * A database error raised while changing or probing the schema of a queue.
 */
public class QueueDdlException extends QueueSchemaException {

    public QueueDdlException(String operation, FullyQualifiedName fqn, Throwable cause) {
        super(PgqErrorCodes.QUEUE_DDL_FAILED, operation, fqn,
            "DDL error during " + operation + " on " + fqn + ": " + describe(cause), cause);
    }

    /**
     * Wraps {@code cause} unless it is already a {@link QueueSchemaException}, which is
     * passed through unchanged so the original category survives nested compositions.
     */
    public static QueueSchemaException wrap(String operation, FullyQualifiedName fqn, Throwable cause) {
        if (cause instanceof QueueSchemaException) {
            return (QueueSchemaException) cause;
        }
        return new QueueDdlException(operation, fqn, cause);
    }

    static String describe(Throwable cause) {
        return cause == null ? "unknown cause" : cause.getMessage();
    }
}
