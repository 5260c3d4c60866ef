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
package dev.mars.tasklist.rest.handlers;

import dev.mars.tasklist.api.TaskItem;
import dev.mars.tasklist.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TodoPageHandlerTest {

    @Test
    void escapesMarkupCharacters() {
        assertEquals("&lt;b&gt;Tom &amp; &quot;Jerry&quot; &#39;s&lt;/b&gt;",
            TodoPageHandler.escape("<b>Tom & \"Jerry\" 's</b>"));
    }

    @Test
    void emptyListShowsPlaceholderAndForm() {
        String html = TodoPageHandler.renderHtml(List.of());

        assertTrue(html.contains("No tasks yet."));
        assertTrue(html.contains("action=\"/add\""));
        assertTrue(html.contains("name=\"name\""));
        assertTrue(html.contains("name=\"task\""));
    }

    @Test
    void rendersItemsInGivenOrderWithUtcTimestamp() {
        String html = TodoPageHandler.renderHtml(List.of(
            new TaskItem(2, "Bob", "Walk dog", Instant.parse("2025-06-01T10:15:30Z")),
            new TaskItem(1, "Alice", "Buy milk", Instant.parse("2025-06-01T09:00:00Z"))));

        assertTrue(html.indexOf("Bob") < html.indexOf("Alice"));
        assertTrue(html.contains("2025-06-01 10:15:30"));
    }
}
