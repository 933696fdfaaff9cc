package dev.mars.pgq.db.index;

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

import dev.mars.pgq.api.model.CustomIndex;
import dev.mars.pgq.api.model.QueueName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The drop and create sets that move a table's custom indexes from an observed set to a
 * desired set.
 *
 * <p>Both sides are keyed by name. A name only in the observed set is dropped; a name
 * only in the desired set is created; a name on both sides whose definitions differ is
 * dropped and created again, since PostgreSQL cannot alter an index definition in place.
 * Drops are applied before creates.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class IndexReconciliationPlan {

    private final List<String> toDrop;
    private final List<CustomIndex> toCreate;
    private final List<CustomIndex> unchanged;

    private IndexReconciliationPlan(List<String> toDrop, List<CustomIndex> toCreate, List<CustomIndex> unchanged) {
        this.toDrop = Collections.unmodifiableList(toDrop);
        this.toCreate = Collections.unmodifiableList(toCreate);
        this.unchanged = Collections.unmodifiableList(unchanged);
    }

    /**
     * Computes the plan. Unnamed desired indexes are given their generated name first.
     *
     * @param table   the queue table the indexes belong to
     * @param state   indexes observed on the table
     * @param desired indexes that should exist afterwards
     * @throws IllegalArgumentException if a desired index is invalid or has a reserved name,
     *         or two desired indexes resolve to the same name
     */
    public static IndexReconciliationPlan compute(QueueName table, List<CustomIndex> state, List<CustomIndex> desired) {
        Map<String, CustomIndex> stateByName = new LinkedHashMap<>();
        for (CustomIndex index : state) {
            stateByName.put(index.name(), index);
        }

        Map<String, CustomIndex> planByName = new LinkedHashMap<>();
        for (CustomIndex index : desired) {
            CustomIndex named = withResolvedName(table, index);
            CustomIndexManager.validate(table, named);
            if (planByName.putIfAbsent(named.name(), named) != null) {
                throw new IllegalArgumentException("Duplicate custom index name: " + named.name());
            }
        }

        List<String> drops = new ArrayList<>();
        for (Map.Entry<String, CustomIndex> entry : stateByName.entrySet()) {
            CustomIndex planned = planByName.get(entry.getKey());
            if (planned == null || !entry.getValue().definitionEquals(planned)) {
                drops.add(entry.getKey());
            }
        }

        List<CustomIndex> creates = new ArrayList<>();
        List<CustomIndex> unchanged = new ArrayList<>();
        for (Map.Entry<String, CustomIndex> entry : planByName.entrySet()) {
            CustomIndex observed = stateByName.get(entry.getKey());
            if (observed == null || !observed.definitionEquals(entry.getValue())) {
                creates.add(entry.getValue());
            } else {
                unchanged.add(entry.getValue());
            }
        }

        return new IndexReconciliationPlan(drops, creates, unchanged);
    }

    static CustomIndex withResolvedName(QueueName table, CustomIndex index) {
        if (index.isNamed()) {
            return index;
        }
        return index.withName(IndexNameGenerator.generate(table.value(), index.columns(), index.type()));
    }

    public List<String> getToDrop() {
        return toDrop;
    }

    public List<CustomIndex> getToCreate() {
        return toCreate;
    }

    public List<CustomIndex> getUnchanged() {
        return unchanged;
    }

    public boolean isEmpty() {
        return toDrop.isEmpty() && toCreate.isEmpty();
    }

    @Override
    public String toString() {
        return "IndexReconciliationPlan{" +
            "toDrop=" + toDrop +
            ", toCreate=" + toCreate.stream().map(CustomIndex::name).toList() +
            ", unchanged=" + unchanged.size() +
            '}';
    }
}
