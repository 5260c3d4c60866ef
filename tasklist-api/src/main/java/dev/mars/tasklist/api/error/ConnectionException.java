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
package dev.mars.tasklist.api.error;

/**
 * Raised when no database connection could be opened within the configured number of attempts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class ConnectionException extends RuntimeException {

    private final int attempts;
    private final boolean exhausted;

    public ConnectionException(String message, int attempts, boolean exhausted, Throwable lastCause) {
        super(message, lastCause);
        this.attempts = attempts;
        this.exhausted = exhausted;
    }

    public static ConnectionException exhausted(int attempts, Throwable lastCause) {
        String cause = lastCause != null ? lastCause.getMessage() : "unknown";
        return new ConnectionException(
            "Could not connect to database after " + attempts + " attempts: " + cause,
            attempts, true, lastCause);
    }

    /**
     * Number of connection attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * True when the full retry budget was used up.
     */
    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * The failure of the final attempt.
     */
    public Throwable getLastCause() {
        return getCause();
    }
}
