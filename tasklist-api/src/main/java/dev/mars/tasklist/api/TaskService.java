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

import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Data operations offered by the task list.
 *
 * <p>Every call is an independent acquire-use-release cycle against the database;
 * implementations keep no state shared between calls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public interface TaskService {

    /**
     * Lists every stored item, newest first. Items with the same creation timestamp
     * are ordered by identifier, highest first.
     *
     * @return a freshly materialized list, failed with
     *         {@link dev.mars.tasklist.api.error.ConnectionException} when no connection could be
     *         acquired or {@link dev.mars.tasklist.api.error.DataAccessException} when the query failed
     */
    Future<List<TaskItem>> listItems();

    /**
     * Stores a new item.
     *
     * <p>Both values are trimmed first. When either is empty, or the author exceeds the
     * configured length limit, nothing is written, the database is not contacted and the
     * returned future succeeds with an empty optional.</p>
     *
     * @param name the author
     * @param task the description
     * @return the stored item, or empty when the input was ignored
     */
    Future<Optional<TaskItem>> createItem(String name, String task);
}
