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
package dev.mars.tasklist.db.config;

import dev.mars.tasklist.db.TaskListDefaults;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-interval, fixed-ceiling retry settings.
 *
 * @param maxAttempts    total number of attempts, including the first one
 * @param interval       wait between a failed attempt and the next one
 * @param attemptTimeout deadline for a single attempt; an attempt still pending at the deadline counts as failed
 */
public record RetryPolicy(int maxAttempts, Duration interval, Duration attemptTimeout) {

    public RetryPolicy {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        if (attemptTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("attemptTimeout must be at least 1ms");
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration interval) {
        return new RetryPolicy(maxAttempts, interval, TaskListDefaults.CONNECTION_ATTEMPT_TIMEOUT);
    }

    public static RetryPolicy of(int maxAttempts, Duration interval, Duration attemptTimeout) {
        return new RetryPolicy(maxAttempts, interval, attemptTimeout);
    }

    /**
     * Longest time spent waiting between attempts before the policy gives up.
     */
    public Duration maxWait() {
        return interval.multipliedBy(maxAttempts - 1L);
    }

    /**
     * Upper bound on the whole operation: every attempt running into its deadline plus every wait.
     */
    public Duration maxDuration() {
        return attemptTimeout.multipliedBy(maxAttempts).plus(maxWait());
    }
}
