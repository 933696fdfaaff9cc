package dev.mars.pgq.db.queue;

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

import dev.mars.pgq.api.model.QueueName;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;

import java.util.List;

/**
 * The four indexes every queue table is created with. Their names, and the primary key's
 * {@code <queue>_pkey}, are reserved: indexes carrying them are never reported or
 * reconciled as custom indexes.
 *
 * <p>PostgreSQL silently truncates longer identifiers, which would detach the stored names
 * from the reserved ones, so a queue is only created when every standard index name fits.
 */
public enum StandardIndex {
    CREATED_AT("_created_at_idx", "(created_at)"),
    PROCESSED_AT_NULL("_processed_at_null_idx", "(processed_at) WHERE (processed_at IS NULL)"),
    SCHEDULED_FOR("_scheduled_for_idx", "(scheduled_for ASC NULLS LAST) WHERE (processed_at IS NULL)"),
    METADATA("_metadata_idx", "USING GIN(metadata) WHERE processed_at IS NULL");

    private final String suffix;
    private final String definition;

    StandardIndex(String suffix, String definition) {
        this.suffix = suffix;
        this.definition = definition;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * @return everything that follows {@code ON <table>} in the CREATE INDEX statement
     */
    public String definition() {
        return definition;
    }

    public String indexName(QueueName queue) {
        return queue.value() + suffix;
    }

    public static String primaryKeyName(QueueName queue) {
        return queue.value() + "_pkey";
    }

    public static boolean isReserved(QueueName queue, String indexName) {
        return primaryKeyName(queue).equals(indexName) || indexNames(queue).contains(indexName);
    }

    /**
     * @throws IllegalArgumentException if any standard index name of {@code queue} exceeds
     *         the identifier limit
     */
    public static void validateNames(QueueName queue) {
        for (StandardIndex index : values()) {
            String indexName = index.indexName(queue);
            int length = PostgreSqlIdentifierValidator.byteLength(indexName);
            if (length > PostgreSqlIdentifierValidator.MAX_IDENTIFIER_LENGTH) {
                throw new IllegalArgumentException(String.format(
                    "Queue name '%s' is too long: its index name '%s' exceeds %d bytes (length: %d)",
                    queue.value(), indexName, PostgreSqlIdentifierValidator.MAX_IDENTIFIER_LENGTH, length));
            }
        }
    }

    public static List<String> indexNames(QueueName queue) {
        return List.of(
            CREATED_AT.indexName(queue),
            PROCESSED_AT_NULL.indexName(queue),
            SCHEDULED_FOR.indexName(queue),
            METADATA.indexName(queue));
    }
}
