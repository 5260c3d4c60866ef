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
package dev.mars.tasklist.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A single stored to-do entry.
 *
 * <p>The identifier and creation timestamp are assigned by the database at insert time
 * and never change afterwards. Items are never updated or deleted by the service.</p>
 *
 * @param id        database-assigned identifier, unique and increasing
 * @param name      the author of the entry, never blank
 * @param task      the description of the entry, never blank
 * @param createdAt insertion time as recorded by the database
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public record TaskItem(long id, String name, String task, Instant createdAt) {

    public TaskItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
