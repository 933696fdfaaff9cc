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

import dev.mars.pgq.api.util.PostgreSqlIdentifierValidator;

import java.util.Objects;

/**
 * Name of the PostgreSQL schema a queue table lives in.
 */
public record SchemaName(String value) {

    public static final SchemaName PUBLIC = new SchemaName("public");

    public SchemaName {
        Objects.requireNonNull(value, "value");
    }

    public static SchemaName of(String value) {
        return new SchemaName(value);
    }

    public boolean isValid() {
        return PostgreSqlIdentifierValidator.isValid(value);
    }

    public String quoted() {
        return PostgreSqlIdentifierValidator.quote(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
