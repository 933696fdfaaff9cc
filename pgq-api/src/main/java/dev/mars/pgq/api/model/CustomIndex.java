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

/**
 * A secondary index on a queue table that is managed declaratively.
 *
 * <p>{@code columns} is ordered and is part of the index identity. An empty
 * {@code name} means the name is derived from the table, columns and type.
 * An empty {@code where} means the index is unconditional.
 *
 * @param name    index name, empty when it should be generated
 * @param columns column expressions in index order
 * @param type    access method
 * @param where   partial-index predicate, empty for none
 */
public record CustomIndex(String name, List<String> columns, IndexType type, String where) {

    public CustomIndex {
        name = name == null ? "" : name;
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        type = type == null ? IndexType.BTREE : type;
        where = where == null ? "" : where.trim();
    }

    public static CustomIndex of(List<String> columns) {
        return new CustomIndex("", columns, IndexType.BTREE, "");
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    public boolean isPartial() {
        return !where.isEmpty();
    }

    public CustomIndex withName(String newName) {
        return new CustomIndex(newName, columns, type, where);
    }

    /**
     * Structural equality used by reconciliation. Names are compared first; then type,
     * predicate and the ordered column list must all match.
     *
     * <p>Predicates are compared after {@link #normalizePredicate(String)} because the
     * catalog hands back {@code processed_at IS NULL} as {@code (processed_at IS NULL)}.
     */
    public boolean definitionEquals(CustomIndex other) {
        if (other == null || !name.equals(other.name)) {
            return false;
        }
        if (type != other.type) {
            return false;
        }
        if (!normalizePredicate(where).equals(normalizePredicate(other.where))) {
            return false;
        }
        return columns.equals(other.columns);
    }

    /**
     * Strips enclosing parentheses that wrap the whole predicate and collapses runs of
     * whitespace.
     */
    public static String normalizePredicate(String predicate) {
        if (predicate == null) {
            return "";
        }
        String result = predicate.trim().replaceAll("\\s+", " ");
        while (result.length() >= 2 && result.charAt(0) == '(' && closingParen(result, 0) == result.length() - 1) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
