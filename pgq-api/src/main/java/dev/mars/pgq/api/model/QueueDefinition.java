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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Desired state of a queue: where it lives, whether it is time-partitioned, the
 * partitioning policy and the set of custom indexes.
 */
public final class QueueDefinition {
    private final SchemaName schema;
    private final QueueName name;
    private final boolean partitioned;
    private final PartitionConfig partitionConfig;
    private final List<CustomIndex> customIndexes;

    private QueueDefinition(Builder builder) {
        this.schema = Objects.requireNonNull(builder.schema, "schema");
        this.name = Objects.requireNonNull(builder.name, "name");
        this.partitioned = builder.partitioned;
        this.partitionConfig = builder.partitionConfig;
        this.customIndexes = List.copyOf(builder.customIndexes);
    }

    public SchemaName getSchema() { return schema; }
    public QueueName getName() { return name; }
    public boolean isPartitioned() { return partitioned; }

    /**
     * @return the requested partition policy; empty means the configured default applies
     */
    public Optional<PartitionConfig> getPartitionConfig() { return Optional.ofNullable(partitionConfig); }

    public List<CustomIndex> getCustomIndexes() { return customIndexes; }

    public FullyQualifiedName fqn() {
        return FullyQualifiedName.of(schema, name);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "QueueDefinition{" +
            "fqn=" + fqn() +
            ", partitioned=" + partitioned +
            ", partitionConfig=" + partitionConfig +
            ", customIndexes=" + customIndexes +
            '}';
    }

    public static class Builder {
        private SchemaName schema = SchemaName.PUBLIC;
        private QueueName name;
        private boolean partitioned = false;
        private PartitionConfig partitionConfig;
        private final List<CustomIndex> customIndexes = new ArrayList<>();

        public Builder schema(SchemaName schema) { this.schema = schema; return this; }
        public Builder schema(String schema) { this.schema = new SchemaName(schema); return this; }
        public Builder name(QueueName name) { this.name = name; return this; }
        public Builder name(String name) { this.name = new QueueName(name); return this; }
        public Builder partitioned(boolean partitioned) { this.partitioned = partitioned; return this; }
        public Builder partitionConfig(PartitionConfig partitionConfig) { this.partitionConfig = partitionConfig; return this; }
        public Builder customIndex(CustomIndex index) { this.customIndexes.add(index); return this; }
        public Builder customIndexes(List<CustomIndex> indexes) { this.customIndexes.addAll(indexes); return this; }

        public QueueDefinition build() {
            return new QueueDefinition(this);
        }
    }
}
