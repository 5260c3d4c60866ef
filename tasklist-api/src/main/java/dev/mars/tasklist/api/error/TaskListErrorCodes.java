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
 * Stable error codes returned by the HTTP surface.
 *
 * Format: TLERR followed by a four digit number.
 * - 0001-0049: client errors
 * - 0050-0099: dependency and server errors
 */
public final class TaskListErrorCodes {

    private TaskListErrorCodes() {
        // Constants class
    }

    public static final String INVALID_REQUEST = "TLERR0001";
    public static final String VALIDATION_FAILED = "TLERR0002";

    public static final String DATABASE_UNAVAILABLE = "TLERR0050";
    public static final String DATA_ACCESS_FAILED = "TLERR0051";
    public static final String INTERNAL_ERROR = "TLERR0099";
}
