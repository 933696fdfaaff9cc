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

import dev.mars.pgq.api.model.IndexType;
import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.StringJoiner;

/**
 * Derives names for custom indexes declared without one.
 *
 * <p>The name is {@code <table>_<col>..[_<type>]_<hash>_idx}: each column expression is
 * stripped of parentheses and quotes, JSON path operators and spaces become underscores,
 * and the result is cut to {@value #MAX_COLUMN_NAME_LENGTH} bytes. The hash is the first
 * {@value #HASH_LENGTH} hex characters of SHA-256 over the original comma-joined column
 * list, so expressions that clean to the same prefix still get distinct names. Changing
 * any step renames every generated index on the next reconciliation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class IndexNameGenerator {

    static final int MAX_COLUMN_NAME_LENGTH = 20;
    static final int HASH_LENGTH = 8;

    private IndexNameGenerator() {
    }

    public static String generate(String tableName, List<String> columns, IndexType type) {
        StringJoiner base = new StringJoiner("_");
        base.add(tableName);
        for (String column : columns) {
            base.add(PostgreSqlIdentifierValidator.truncateToBytes(clean(column), MAX_COLUMN_NAME_LENGTH));
        }

        StringBuilder name = new StringBuilder(base.toString());
        if (type != null && !type.isDefault()) {
            name.append('_').append(type.sqlName());
        }
        name.append('_').append(columnHash(columns)).append("_idx");

        return PostgreSqlIdentifierValidator.truncateToBytes(name.toString(),
            PostgreSqlIdentifierValidator.MAX_IDENTIFIER_LENGTH);
    }

    static String clean(String column) {
        return column
            .replace("(", "")
            .replace(")", "")
            .replace("'", "")
            .replace("\"", "")
            .replace("->>", "_")
            .replace("->", "_")
            .replace(" ", "_");
    }

    static String columnHash(List<String> columns) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join(",", columns).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
