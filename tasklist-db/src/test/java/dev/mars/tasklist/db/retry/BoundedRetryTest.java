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
import dev.mars.tasklist.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CORE tests for {@link BoundedRetry}.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class BoundedRetryTest {

    @Test
    void firstAttemptSuccessDoesNotRetry(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(5, Duration.ofMillis(10)), "test op");

        retry.execute(() -> {
                calls.incrementAndGet();
                return Future.succeededFuture("ok");
            })
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("ok", result);
                assertEquals(1, calls.get());
                testContext.completeNow();
            })));
    }

    @Test
    void succeedsOnSixthAttemptAfterFiveFailures(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(30, Duration.ofMillis(10)), "cold start");

        retry.execute(() -> {
                int attempt = calls.incrementAndGet();
                return attempt < 6
                    ? Future.failedFuture(new IllegalStateException("not ready " + attempt))
                    : Future.succeededFuture(attempt);
            })
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(6, result);
                assertEquals(6, calls.get());
                testContext.completeNow();
            })));
    }

    @Test
    void stopsAfterExactlyMaxAttemptsWithLastCause(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(4, Duration.ofMillis(5)), "always down");

        retry.<String>execute(() -> Future.failedFuture(new IllegalStateException("down #" + calls.incrementAndGet())))
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertInstanceOf(RetryExhaustedException.class, error);
                RetryExhaustedException exhausted = (RetryExhaustedException) error;
                assertEquals(4, exhausted.getAttempts());
                assertEquals("always down", exhausted.getOperation());
                assertEquals("down #4", exhausted.getCause().getMessage());
                assertEquals(4, calls.get());
                testContext.completeNow();
            })));
    }

    @Test
    void singleAttemptPolicyNeverWaits(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(1, Duration.ofHours(1)), "one shot");

        retry.<Void>execute(() -> {
                calls.incrementAndGet();
                return Future.failedFuture(new IllegalStateException("refused"));
            })
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertEquals(1, calls.get());
                assertEquals(1, ((RetryExhaustedException) error).getAttempts());
                testContext.completeNow();
            })));
    }

    @Test
    void attemptsAreSpacedByTheInterval(Vertx vertx, VertxTestContext testContext) {
        List<Long> startTimes = new CopyOnWriteArrayList<>();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(3, Duration.ofMillis(100)), "spaced");

        retry.<Void>execute(() -> {
                startTimes.add(System.nanoTime());
                return Future.failedFuture(new IllegalStateException("refused"));
            })
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertEquals(3, startTimes.size());
                for (int i = 1; i < startTimes.size(); i++) {
                    long gapMs = (startTimes.get(i) - startTimes.get(i - 1)) / 1_000_000L;
                    assertTrue(gapMs >= 90, "gap between attempts was only " + gapMs + "ms");
                }
                testContext.completeNow();
            })));
    }

    @Test
    void supplierThatThrowsCountsAsFailedAttempt(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(3, Duration.ZERO), "throwing");

        retry.execute(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalArgumentException("bad input");
                }
                return Future.succeededFuture("recovered");
            })
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("recovered", result);
                assertEquals(3, calls.get());
                testContext.completeNow();
            })));
    }

    @Test
    void listenerSeesEveryFailedAttempt(Vertx vertx, VertxTestContext testContext) {
        List<String> seen = new CopyOnWriteArrayList<>();
        RetryListener listener = (attempt, max, cause) -> seen.add(attempt + "/" + max + ":" + cause.getMessage());
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(3, Duration.ofMillis(1)), "listened", listener);

        retry.<Void>execute(() -> Future.failedFuture(new IllegalStateException("nope")))
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                assertEquals(List.of("1/3:nope", "2/3:nope", "3/3:nope"), seen);
                testContext.completeNow();
            })));
    }

    @Test
    void throwingListenerDoesNotBreakTheRetryLoop(Vertx vertx, VertxTestContext testContext) {
        AtomicInteger calls = new AtomicInteger();
        RetryListener listener = (attempt, max, cause) -> {
            throw new IllegalStateException("listener bug");
        };
        BoundedRetry retry = new BoundedRetry(vertx, RetryPolicy.of(5, Duration.ZERO), "guarded", listener);

        retry.execute(() -> calls.incrementAndGet() < 2
                ? Future.failedFuture(new IllegalStateException("first fails"))
                : Future.succeededFuture(calls.get()))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(2, result);
                testContext.completeNow();
            })));
    }
}
