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
package dev.mars.tasklist.test.categories;

/**
 * Test category constants used with JUnit 5 {@code @Tag} annotations.
 *
 * <ul>
 *   <li><strong>CORE</strong> - fast unit tests with stubbed or mocked collaborators, no Docker needed</li>
 *   <li><strong>INTEGRATION</strong> - tests against a real PostgreSQL started by TestContainers</li>
 * </ul>
 *
 * <p>Integration tests are skipped automatically when no Docker daemon is available.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public final class TestCategories {

    public static final String CORE = "core";
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        // Utility class
    }
}
