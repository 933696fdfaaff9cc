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
 * The queue table does not exist. Orchestrating callers usually treat this as
 * "resource gone" rather than as a hard failure.
 */
public class QueueNotFoundException extends QueueSchemaException {

    public QueueNotFoundException(FullyQualifiedName fqn) {
        super(PgqErrorCodes.QUEUE_NOT_FOUND, "get", fqn,
            "Queue not found: " + fqn, null);
    }
}
