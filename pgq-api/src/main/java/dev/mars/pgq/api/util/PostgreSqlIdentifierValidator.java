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
package dev.mars.pgq.api.util;

import java.nio.charset.StandardCharsets;

/**
 * Utility class for validating, quoting and truncating PostgreSQL identifiers.
 *
 * <p>The rules applied here are deliberately narrow:
 * <ul>
 *   <li>Non-empty</li>
 *   <li>At most 63 bytes (UTF-8), the PostgreSQL {@code NAMEDATALEN - 1} limit</li>
 *   <li>Must start with a letter (a-z, A-Z) or underscore (_)</li>
 * </ul>
 *
 * <p>Identifiers are never corrected. A name that fails validation is rejected before
 * any DDL is issued; every identifier that does reach SQL text goes through
 * {@link #quote(String)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-06
 * @version 2.0
 */
public final class PostgreSqlIdentifierValidator {

    /**
     * PostgreSQL maximum identifier length in bytes.
     * @see <a href="https://www.postgresql.org/docs/current/sql-syntax-lexical.html#SQL-SYNTAX-IDENTIFIERS">PostgreSQL Documentation</a>
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private PostgreSqlIdentifierValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Checks if an identifier is valid without throwing an exception.
     *
     * @param identifier The identifier to check
     * @return true if valid, false otherwise
     */
    public static boolean isValid(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        if (byteLength(identifier) > MAX_IDENTIFIER_LENGTH) {
            return false;
        }
        char first = identifier.charAt(0);
        return (first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z') || first == '_';
    }

    /**
     * Validates that an identifier meets PostgreSQL requirements.
     *
     * @param identifier The identifier to validate
     * @param identifierType Type of identifier for error messages (e.g., "schema", "queue")
     * @throws IllegalArgumentException if validation fails
     */
    public static void validate(String identifier, String identifierType) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException(identifierType + " name cannot be null or empty");
        }

        int length = byteLength(identifier);
        if (length > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s name '%s' exceeds PostgreSQL maximum length of %d bytes (length: %d)",
                    identifierType, identifier, MAX_IDENTIFIER_LENGTH, length));
        }

        if (!isValid(identifier)) {
            throw new IllegalArgumentException(
                String.format("Invalid %s name: '%s'. Must start with a letter or underscore.",
                    identifierType, identifier));
        }
    }

    /**
     * Quotes an identifier for interpolation into SQL text.
     *
     * <p>Embedded double quotes are doubled and NUL characters are removed, so the
     * result is always a single delimited identifier.
     *
     * @param identifier The identifier to quote
     * @return The delimited identifier, e.g. {@code "my_queue"}
     */
    public static String quote(String identifier) {
        String cleaned = identifier.replace("\u0000", "");
        return '"' + cleaned.replace("\"", "\"\"") + '"';
    }

    /**
     * Truncates a string to at most {@code maxBytes} UTF-8 bytes without splitting a character.
     *
     * @param value The value to truncate
     * @param maxBytes Maximum encoded length
     * @return The value itself when it already fits, otherwise its longest fitting prefix
     */
    public static String truncateToBytes(String value, int maxBytes) {
        if (byteLength(value) <= maxBytes) {
            return value;
        }
        int bytes = 0;
        int end = 0;
        while (end < value.length()) {
            int codePoint = value.codePointAt(end);
            int charCount = Character.charCount(codePoint);
            int size = value.substring(end, end + charCount).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > maxBytes) {
                break;
            }
            bytes += size;
            end += charCount;
        }
        return value.substring(0, end);
    }

    public static int byteLength(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
