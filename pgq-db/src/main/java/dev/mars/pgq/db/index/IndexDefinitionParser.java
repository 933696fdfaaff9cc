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
import dev.mars.pgq.api.model.IndexType;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a {@link CustomIndex} from the text returned by {@code pg_get_indexdef}, e.g.
 * {@code CREATE INDEX ix ON public.q USING gin (metadata) WHERE (processed_at IS NULL)}.
 *
 * <ul>
 *   <li>type: the {@code USING <method>} clause, btree when none of the others appear</li>
 *   <li>columns: the parenthesised list after {@code USING}, split on top-level {@code ", "}</li>
 *   <li>predicate: whatever follows the first {@code WHERE} after the column list, trimmed</li>
 * </ul>
 */
public final class IndexDefinitionParser {

    private static final String WHERE = " WHERE ";

    private IndexDefinitionParser() {
    }

    public static CustomIndex parse(String name, String definition) {
        return new CustomIndex(name, parseColumns(definition), parseType(definition), parseWhere(definition));
    }

    static IndexType parseType(String definition) {
        for (IndexType type : IndexType.values()) {
            if (!type.isDefault() && definition.contains(" USING " + type.sqlName() + " ")) {
                return type;
            }
        }
        return IndexType.BTREE;
    }

    static List<String> parseColumns(String definition) {
        List<String> columns = new ArrayList<>();
        int start = columnListStart(definition);
        if (start < 0) {
            return columns;
        }
        int end = matchingParen(definition, start);
        if (end < 0) {
            end = definition.lastIndexOf(')');
        }
        if (end <= start) {
            return columns;
        }
        String list = definition.substring(start + 1, end);
        int where = indexOfIgnoreCase(list, WHERE, 0);
        if (where >= 0) {
            list = list.substring(0, where);
        }
        return splitTopLevel(list);
    }

    static String parseWhere(String definition) {
        int from = 0;
        int start = columnListStart(definition);
        if (start >= 0) {
            int end = matchingParen(definition, start);
            if (end > start) {
                from = end;
            }
        }
        int where = indexOfIgnoreCase(definition, WHERE, from);
        if (where < 0) {
            return "";
        }
        return definition.substring(where + WHERE.length()).trim();
    }

    // pg_get_indexdef always names the access method; a quoted table name may contain '('
    private static int columnListStart(String definition) {
        int using = definition.indexOf(" USING ");
        return definition.indexOf('(', Math.max(using, 0));
    }

    // Offsets index the original text; upper-casing can change its length (straße)
    static int indexOfIgnoreCase(String text, String token, int from) {
        for (int i = Math.max(from, 0); i + token.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, token, 0, token.length())) {
                return i;
            }
        }
        return -1;
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    // Expressions such as coalesce(a, b) contain ", " themselves
    private static List<String> splitTopLevel(String list) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int from = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && c == ',' && i + 1 < list.length() && list.charAt(i + 1) == ' ') {
                parts.add(list.substring(from, i));
                from = i + 2;
                i++;
            }
        }
        parts.add(list.substring(from));
        return parts;
    }
}
