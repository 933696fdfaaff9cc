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

import java.util.Objects;

/**
 * The {@code schema.queue} identity of a queue table.
 *
 * <p>This is the key used by every operation and carried by every error. It is composed
 * by plain concatenation and split at the first separator, so the round trip holds for
 * every schema name without a {@code .}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public record FullyQualifiedName(String value) {

    public static final char SEPARATOR = '.';

    public FullyQualifiedName {
        Objects.requireNonNull(value, "value");
    }

    public static FullyQualifiedName of(SchemaName schema, QueueName name) {
        return new FullyQualifiedName(schema.value() + SEPARATOR + name.value());
    }

    /**
     * Splits this name back into its schema and queue parts.
     *
     * @return the schema and queue name
     * @throws IllegalArgumentException if the value contains no separator
     */
    public Parts split() {
        int separator = value.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException(
                "Invalid fully qualified name format: '" + value + "' (expected schema.queue)");
        }
        return new Parts(
            new SchemaName(value.substring(0, separator)),
            new QueueName(value.substring(separator + 1)));
    }

    /**
     * Both sides of a split fully qualified name.
     */
    public record Parts(SchemaName schema, QueueName name) {
    }

    @Override
    public String toString() {
        return value;
    }
}
