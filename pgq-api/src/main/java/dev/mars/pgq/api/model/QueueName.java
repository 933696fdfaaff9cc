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
package dev.mars.pgq.api.model;

import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;

import java.util.Objects;

/**
 * Name of a queue table, kept apart from {@link SchemaName} so the two cannot be swapped.
 *
 * <p>Construction never validates; callers check {@link #isValid()} (or the managers
 * reject the name) before any DDL is issued.
 */
public record QueueName(String value) {

    public QueueName {
        Objects.requireNonNull(value, "value");
    }

    public static QueueName of(String value) {
        return new QueueName(value);
    }

    public boolean isValid() {
        return PostgreSqlIdentifierValidator.isValid(value);
    }

    /**
     * @return the name as a delimited SQL identifier
     */
    public String quoted() {
        return PostgreSqlIdentifierValidator.quote(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
