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
package dev.mars.tasklist.db.repository;

import dev.mars.tasklist.api.TaskItem;
import dev.mars.tasklist.api.TaskService;
import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.api.error.DataAccessException;
import dev.mars.tasklist.db.connection.PgConnectionManager;
import dev.mars.tasklist.db.metrics.TaskListMetrics;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link TaskService}.
 *
 * <p>Each call opens its own connection through {@link PgConnectionManager}, runs a single
 * statement, and releases the connection before its future completes. Inserts always go
 * through a prepared statement with bound parameters. Failed statements are reported as
 * {@link DataAccessException} and never retried.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class PgTaskRepository implements TaskService {
    private static final Logger logger = LoggerFactory.getLogger(PgTaskRepository.class);

    static final String SELECT_ITEMS =
        "SELECT id, name, task, created_at FROM todos ORDER BY created_at DESC, id DESC";

    static final String INSERT_ITEM =
        "INSERT INTO todos (name, task) VALUES ($1, $2) RETURNING id, name, task, created_at";

    private final PgConnectionManager connectionManager;
    private final TaskListMetrics metrics;
    private final int maxNameLength;

    public PgTaskRepository(PgConnectionManager connectionManager, TaskListMetrics metrics, int maxNameLength) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (maxNameLength < 1) {
            throw new IllegalArgumentException("maxNameLength must be at least 1");
        }
        this.maxNameLength = maxNameLength;
    }

    @Override
    public Future<List<TaskItem>> listItems() {
        return connectionManager.withConnection(conn ->
                conn.query(SELECT_ITEMS).execute().map(PgTaskRepository::toItems))
            .recover(error -> failed("list items", error));
    }

    @Override
    public Future<Optional<TaskItem>> createItem(String name, String task) {
        String trimmedName = name == null ? "" : name.trim();
        String trimmedTask = task == null ? "" : task.trim();

        if (trimmedName.isEmpty() || trimmedTask.isEmpty()) {
            logger.debug("Ignoring create request with blank name or task");
            metrics.recordItemIgnored();
            return Future.succeededFuture(Optional.empty());
        }
        // VARCHAR length counts characters, not UTF-16 units
        if (trimmedName.codePointCount(0, trimmedName.length()) > maxNameLength) {
            logger.debug("Ignoring create request with name longer than {} characters", maxNameLength);
            metrics.recordItemIgnored();
            return Future.succeededFuture(Optional.empty());
        }

        return connectionManager.withConnection(conn ->
                conn.preparedQuery(INSERT_ITEM)
                    .execute(Tuple.of(trimmedName, trimmedTask))
                    .map(rows -> toItems(rows).get(0)))
            .map(item -> {
                metrics.recordItemCreated();
                logger.debug("Stored task item {}", item.id());
                return Optional.of(item);
            })
            .recover(error -> failed("create item", error));
    }

    private static List<TaskItem> toItems(RowSet<Row> rows) {
        List<TaskItem> items = new ArrayList<>(rows.size());
        for (Row row : rows) {
            OffsetDateTime createdAt = row.getOffsetDateTime("created_at");
            items.add(new TaskItem(
                row.getLong("id"),
                row.getString("name"),
                row.getString("task"),
                createdAt.toInstant()));
        }
        return items;
    }

    private static <T> Future<T> failed(String operation, Throwable error) {
        if (error instanceof ConnectionException || error instanceof DataAccessException) {
            return Future.failedFuture(error);
        }
        logger.error("Failed to {}: {}", operation, error.getMessage());
        return Future.failedFuture(new DataAccessException("Failed to " + operation, error));
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }
}
