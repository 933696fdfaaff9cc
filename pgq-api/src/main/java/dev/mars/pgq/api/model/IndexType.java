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

import java.util.Locale;

/**
 * Index access methods a custom index may use. {@link #BTREE} is the default and is
 * never written into generated SQL or generated index names.
 */
public enum IndexType {
    BTREE("btree"),
    GIN("gin"),
    GIST("gist"),
    HASH("hash"),
    BRIN("brin");

    private final String sqlName;

    IndexType(String sqlName) {
        this.sqlName = sqlName;
    }

    public String sqlName() {
        return sqlName;
    }

    public boolean isDefault() {
        return this == BTREE;
    }

    /**
     * Parses an access method name. {@code null} and blank map to {@link #BTREE}.
     *
     * @throws IllegalArgumentException for anything outside btree, gin, gist, hash, brin
     */
    public static IndexType fromString(String value) {
        if (value == null || value.isBlank()) {
            return BTREE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IndexType type : values()) {
            if (type.sqlName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            "Unsupported index type: '" + value + "'. Expected one of btree, gin, gist, hash, brin");
    }

    @Override
    public String toString() {
        return sqlName;
    }
}
