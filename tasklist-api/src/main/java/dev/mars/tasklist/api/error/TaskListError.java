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

import java.time.Instant;

/**
 * Error body sent to HTTP clients. Carries a generic message only; the underlying
 * cause stays in the server log.
 *
 * @param code      the error code from {@link TaskListErrorCodes}
 * @param message   human-readable message
 * @param timestamp when the error occurred
 */
public record TaskListError(
    String code,
    String message,
    Instant timestamp
) {
    public static TaskListError of(String code, String message) {
        return new TaskListError(code, message, Instant.now());
    }

    public static TaskListError invalidRequest(String message) {
        return of(TaskListErrorCodes.INVALID_REQUEST, message);
    }

    public static TaskListError validationFailed(String message) {
        return of(TaskListErrorCodes.VALIDATION_FAILED, message);
    }

    public static TaskListError databaseUnavailable() {
        return of(TaskListErrorCodes.DATABASE_UNAVAILABLE, "Database is unavailable, try again later");
    }

    public static TaskListError dataAccessFailed() {
        return of(TaskListErrorCodes.DATA_ACCESS_FAILED, "The request could not be completed");
    }

    public static TaskListError internalError() {
        return of(TaskListErrorCodes.INTERNAL_ERROR, "Internal server error");
    }
}
