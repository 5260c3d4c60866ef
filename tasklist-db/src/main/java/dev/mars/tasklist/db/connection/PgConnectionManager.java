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
package dev.mars.tasklist.db.connection;

import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.db.config.RetryPolicy;
import dev.mars.tasklist.db.metrics.TaskListMetrics;
import dev.mars.tasklist.db.retry.BoundedRetry;
import dev.mars.tasklist.db.retry.RetryExhaustedException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Hands out database connections, absorbing the start-up race with the database server.
 *
 * <p>The database is not guaranteed to accept connections when the application starts.
 * {@link #acquire()} therefore retries the connect at a fixed interval up to a fixed number
 * of attempts. An attempt that has not produced a session by the policy's attempt timeout
 * counts as failed, so a server that accepts TCP but never answers cannot stall the caller.
 * Each failed attempt is logged and counted; once the ceiling is reached the
 * returned future fails with an exhausted {@link ConnectionException} carrying the cause of
 * the final attempt.</p>
 *
 * <p>Connections are neither pooled nor cached. Every call opens one new session that the
 * caller owns; {@link #withConnection(Function)} closes it on every exit path.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class PgConnectionManager {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final Vertx vertx;
    private final ConnectionFactory connectionFactory;
    private final RetryPolicy defaultPolicy;
    private final TaskListMetrics metrics;

    public PgConnectionManager(Vertx vertx, ConnectionFactory connectionFactory,
                               RetryPolicy defaultPolicy, TaskListMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        logger.info("Initialized PgConnectionManager with {} attempts every {}, {} per attempt",
            defaultPolicy.maxAttempts(), defaultPolicy.interval(), defaultPolicy.attemptTimeout());
    }

    /**
     * Opens a connection using the default retry policy.
     */
    public Future<SqlConnection> acquire() {
        return acquire(defaultPolicy);
    }

    /**
     * Opens a connection, retrying under the given policy.
     *
     * @param policy attempt ceiling and interval for this acquisition
     * @return a live connection owned by the caller, or a failed future holding a {@link ConnectionException}
     */
    public Future<SqlConnection> acquire(RetryPolicy policy) {
        BoundedRetry retry = new BoundedRetry(vertx, policy, "Database connection", this::onAttemptFailed);

        return retry.execute(() -> {
                metrics.recordConnectionAttempt();
                return connectWithDeadline(policy);
            })
            .onSuccess(conn -> metrics.recordConnectionAcquired())
            .recover(error -> {
                ConnectionException failure = toConnectionException(error);
                metrics.recordConnectionExhausted();
                logger.error("Giving up on database connection after {} attempts: {}",
                    failure.getAttempts(), causeMessage(failure.getLastCause()));
                return Future.failedFuture(failure);
            });
    }

    /**
     * Acquires a connection, runs the operation on it, and closes it whether the operation
     * succeeded, failed, or threw.
     */
    public <T> Future<T> withConnection(Function<SqlConnection, Future<T>> operation) {
        return withConnection(defaultPolicy, operation);
    }

    public <T> Future<T> withConnection(RetryPolicy policy, Function<SqlConnection, Future<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        return acquire(policy).compose(conn -> {
            Future<T> result;
            try {
                result = operation.apply(conn);
            } catch (RuntimeException e) {
                result = Future.failedFuture(e);
            }
            return result.eventually(() -> conn.close()
                .recover(err -> {
                    logger.warn("Failed to close database connection: {}", err.getMessage());
                    return Future.succeededFuture();
                }));
        });
    }

    private Future<SqlConnection> connectWithDeadline(RetryPolicy policy) {
        long timeoutMs = policy.attemptTimeout().toMillis();
        Future<SqlConnection> attempt = connectionFactory.connect();

        return attempt.timeout(timeoutMs, TimeUnit.MILLISECONDS)
            .recover(error -> {
                if (attempt.failed()) {
                    return Future.failedFuture(attempt.cause());
                }
                // The session may still be established after the deadline; nobody owns it then
                attempt.onSuccess(late -> {
                    logger.debug("Closing database connection that arrived after the {}ms deadline", timeoutMs);
                    late.close().onFailure(err ->
                        logger.debug("Failed to close late database connection: {}", err.getMessage()));
                });
                return Future.failedFuture(new TimeoutException(
                    "No response from database within " + timeoutMs + "ms"));
            });
    }

    private void onAttemptFailed(int attempt, int maxAttempts, Throwable cause) {
        metrics.recordConnectionAttemptFailed();
        logger.warn("Database connection attempt {}/{} failed: {}", attempt, maxAttempts, causeMessage(cause));
    }

    private static ConnectionException toConnectionException(Throwable error) {
        if (error instanceof RetryExhaustedException) {
            RetryExhaustedException exhausted = (RetryExhaustedException) error;
            return ConnectionException.exhausted(exhausted.getAttempts(), exhausted.getCause());
        }
        return new ConnectionException("Database connection failed: " + causeMessage(error), 1, false, error);
    }

    private static String causeMessage(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
