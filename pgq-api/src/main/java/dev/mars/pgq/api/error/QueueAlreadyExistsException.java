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
package dev.mars.pgq.api.error;

import dev.mars.pgq.api.model.FullyQualifiedName;

/**
 * Creation was attempted for a queue whose table already exists.
 */
public class QueueAlreadyExistsException extends QueueSchemaException {

    public QueueAlreadyExistsException(FullyQualifiedName fqn) {
        super(PgqErrorCodes.QUEUE_ALREADY_EXISTS, "create", fqn,
            "Queue already exists: " + fqn, null);
    }
}
