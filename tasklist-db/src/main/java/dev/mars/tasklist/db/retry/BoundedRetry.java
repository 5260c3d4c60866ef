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
package dev.mars.tasklist.db.retry;

import dev.mars.tasklist.db.config.RetryPolicy;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation until it succeeds or the policy's attempt ceiling is reached,
 * waiting a fixed interval between attempts.
 *
 * <p>Waits are scheduled with {@code vertx.setTimer()} so no thread is blocked while the
 * database is still starting. There is no backoff: the interval is the same for every attempt.
 * The first attempt runs immediately; after the last failed attempt the returned future fails
 * with {@link RetryExhaustedException} without waiting again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class BoundedRetry {
    private static final Logger logger = LoggerFactory.getLogger(BoundedRetry.class);

    private final Vertx vertx;
    private final RetryPolicy policy;
    private final String operationName;
    private final RetryListener listener;

    public BoundedRetry(Vertx vertx, RetryPolicy policy, String operationName) {
        this(vertx, policy, operationName, RetryListener.NONE);
    }

    public BoundedRetry(Vertx vertx, RetryPolicy policy, String operationName, RetryListener listener) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.operationName = Objects.requireNonNull(operationName, "operationName");
        this.listener = listener != null ? listener : RetryListener.NONE;
    }

    /**
     * Executes the operation under this policy.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @return the first successful result, or a failure carrying the last attempt's cause
     */
    public <T> Future<T> execute(Supplier<Future<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        Promise<T> promise = Promise.promise();
        attempt(operation, 1, promise);
        return promise.future();
    }

    private <T> void attempt(Supplier<Future<T>> operation, int attempt, Promise<T> promise) {
        Future<T> result;
        try {
            result = Objects.requireNonNull(operation.get(), "operation returned null");
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        result.onComplete(ar -> {
            if (ar.succeeded()) {
                if (attempt > 1) {
                    logger.debug("{} succeeded on attempt {}/{}", operationName, attempt, policy.maxAttempts());
                }
                promise.complete(ar.result());
                return;
            }

            Throwable cause = ar.cause();
            try {
                listener.onAttemptFailed(attempt, policy.maxAttempts(), cause);
            } catch (RuntimeException e) {
                logger.warn("Retry listener for {} threw: {}", operationName, e.getMessage());
            }

            if (attempt >= policy.maxAttempts()) {
                promise.fail(new RetryExhaustedException(operationName, attempt, cause));
                return;
            }

            long delayMs = policy.interval().toMillis();
            if (delayMs < 1) {
                vertx.runOnContext(v -> attempt(operation, attempt + 1, promise));
            } else {
                vertx.setTimer(delayMs, id -> attempt(operation, attempt + 1, promise));
            }
        });
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
