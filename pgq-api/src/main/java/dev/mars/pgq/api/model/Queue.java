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

/**
 * Observed state of a queue table.
 *
 * <p>Instances are always produced by probing the database and are discarded after use;
 * {@code partitioned} comes from the partitioned-table catalog, never from a stored flag.
 */
public record Queue(QueueName name, SchemaName schema, boolean partitioned) {

    public static final String TEMPLATE_SUFFIX = "_template";

    public FullyQualifiedName fqn() {
        return FullyQualifiedName.of(schema, name);
    }

    /**
     * @return the name of the structural template table used by the partition engine
     */
    public QueueName templateName() {
        return templateNameFor(name);
    }

    public FullyQualifiedName templateFqn() {
        return FullyQualifiedName.of(schema, templateName());
    }

    public static QueueName templateNameFor(QueueName name) {
        return new QueueName(name.value() + TEMPLATE_SUFFIX);
    }
}
