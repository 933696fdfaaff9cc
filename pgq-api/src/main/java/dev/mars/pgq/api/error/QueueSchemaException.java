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

import java.util.Objects;

/**
 * Base of the typed failures raised by queue schema operations.
 *
 * <p>Callers branch on the concrete subclass, or on {@link #getErrorCode()}, instead of
 * parsing messages. Every instance names the affected queue and, where the failure came
 * from the database, keeps the driver error as its cause.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public abstract class QueueSchemaException extends RuntimeException {

    private final String operation;
    private final FullyQualifiedName fqn;
    private final String errorCode;

    QueueSchemaException(String errorCode, String operation, FullyQualifiedName fqn, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.operation = operation;
        this.fqn = fqn;
    }

    /**
     * @return the operation that failed, e.g. {@code create_table}
     */
    public String getOperation() {
        return operation;
    }

    public FullyQualifiedName getFqn() {
        return fqn;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
