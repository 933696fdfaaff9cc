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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything read back for one queue: the probed {@link Queue}, its partitioning policy
 * when partitioned, and its live custom indexes.
 *
 * <p>An empty {@link Optional} means the part could not be read (the failure is logged),
 * not that it is absent. A simple queue always reports an empty partition config.
 */
public final class QueueState {
    private final Queue queue;
    private final PartitionConfig partitionConfig;
    private final List<CustomIndex> customIndexes;

    public QueueState(Queue queue, PartitionConfig partitionConfig, List<CustomIndex> customIndexes) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.partitionConfig = partitionConfig;
        this.customIndexes = customIndexes == null ? null : List.copyOf(customIndexes);
    }

    public Queue getQueue() { return queue; }

    public Optional<PartitionConfig> getPartitionConfig() {
        return Optional.ofNullable(partitionConfig);
    }

    public Optional<List<CustomIndex>> getCustomIndexes() {
        return Optional.ofNullable(customIndexes);
    }

    public FullyQualifiedName fqn() {
        return queue.fqn();
    }

    @Override
    public String toString() {
        return "QueueState{" +
            "queue=" + queue +
            ", partitionConfig=" + partitionConfig +
            ", customIndexes=" + customIndexes +
            '}';
    }
}
