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
package dev.mars.tasklist.db.health;

import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.api.health.HealthService;
import dev.mars.tasklist.api.health.HealthStatusInfo;
import dev.mars.tasklist.db.TaskListDefaults;
import dev.mars.tasklist.db.config.RetryPolicy;
import dev.mars.tasklist.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reports database reachability as a binary health status.
 *
 * <p>Each check makes one bounded acquisition through the same {@link PgConnectionManager}
 * path used by requests and schema setup, and closes the connection straight away. The check
 * is bounded by its retry policy, so a health check never waits indefinitely on a stopped database.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class DatabaseHealthReporter implements HealthService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseHealthReporter.class);

    private final PgConnectionManager connectionManager;
    private final RetryPolicy policy;

    public DatabaseHealthReporter(PgConnectionManager connectionManager, RetryPolicy policy) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public Future<HealthStatusInfo> checkHealth() {
        long startNanos = System.nanoTime();

        return connectionManager.acquire(policy)
            .compose(conn -> conn.close()
                .recover(err -> {
                    logger.debug("Failed to close health check connection: {}", err.getMessage());
                    return Future.succeededFuture();
                }))
            .map(v -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("responseTimeMs", elapsedMillis(startNanos));
                return HealthStatusInfo.healthy(TaskListDefaults.DATABASE_COMPONENT, details);
            })
            .recover(error -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("responseTimeMs", elapsedMillis(startNanos));
                if (error instanceof ConnectionException) {
                    ConnectionException ce = (ConnectionException) error;
                    details.put("attempts", ce.getAttempts());
                    details.put("exhausted", ce.isExhausted());
                }
                String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
                logger.warn("Database health check failed: {}", message);
                return Future.succeededFuture(
                    HealthStatusInfo.unhealthy(TaskListDefaults.DATABASE_COMPONENT, message, details));
            });
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
