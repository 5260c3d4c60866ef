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
package dev.mars.tasklist.rest;

import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.api.error.DataAccessException;
import dev.mars.tasklist.api.error.TaskListErrorCodes;
import dev.mars.tasklist.api.health.HealthStatusInfo;
import dev.mars.tasklist.db.metrics.TaskListMetrics;
import dev.mars.tasklist.rest.config.RestServerConfig;
import dev.mars.tasklist.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.ConnectException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CORE tests for {@link TaskListRestServer} routes, deployed against in-memory services.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
public class TaskListRestServerTest {

    private InMemoryTaskService taskService;
    private AtomicReference<HealthStatusInfo> health;
    private TaskListMetrics metrics;
    private WebClient client;
    private int port;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        taskService = new InMemoryTaskService();
        health = new AtomicReference<>(HealthStatusInfo.healthy("database"));
        metrics = TaskListMetrics.standalone("rest-test");

        TaskListRestServer server = new TaskListRestServer(new RestServerConfig(0, "tasklist"),
            taskService, () -> Future.succeededFuture(health.get()), metrics);

        client = WebClient.create(vertx, new WebClientOptions()
            .setDefaultHost("localhost")
            .setFollowRedirects(false));

        vertx.deployVerticle(server).onComplete(testContext.succeeding(id -> {
            port = server.getActualPort();
            testContext.completeNow();
        }));
    }

    private static MultiMap form(String name, String task) {
        return MultiMap.caseInsensitiveMultiMap().add("name", name).add("task", task);
    }

    @Test
    void rootListsItemsNewestFirst(VertxTestContext testContext) {
        taskService.add("Alice", "Buy milk", Instant.parse("2025-06-01T09:00:00Z"));
        taskService.add("Bob", "Walk dog", Instant.parse("2025-06-01T10:00:00Z"));

        client.get(port, "localhost", "/").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(200, response.statusCode());
                assertTrue(response.getHeader("Content-Type").startsWith("text/html"));
                String body = response.bodyAsString();
                assertTrue(body.indexOf("Bob") < body.indexOf("Alice"));
                testContext.completeNow();
            })));
    }

    @Test
    void rootEscapesStoredMarkup(VertxTestContext testContext) {
        taskService.add("<script>alert(1)</script>", "x & y", Instant.now());

        client.get(port, "localhost", "/").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                String body = response.bodyAsString();
                assertFalse(body.contains("<script>alert(1)</script>"));
                assertTrue(body.contains("&lt;script&gt;alert(1)&lt;/script&gt;"));
                assertTrue(body.contains("x &amp; y"));
                testContext.completeNow();
            })));
    }

    @Test
    void addStoresItemAndRedirectsToRoot(VertxTestContext testContext) {
        client.post(port, "localhost", "/add").sendForm(form("Alice", "Buy milk"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(302, response.statusCode());
                assertEquals("/", response.getHeader("Location"));
                assertEquals(1, taskService.stored().size());
                assertEquals("Alice", taskService.stored().get(0).name());
                testContext.completeNow();
            })));
    }

    @Test
    void addWithBlankFieldRedirectsWithoutStoring(VertxTestContext testContext) {
        client.post(port, "localhost", "/add").sendForm(form("Alice", "   "))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(302, response.statusCode());
                assertTrue(taskService.stored().isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void addWithMissingFieldsRedirectsWithoutStoring(VertxTestContext testContext) {
        client.post(port, "localhost", "/add").sendForm(MultiMap.caseInsensitiveMultiMap())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(302, response.statusCode());
                assertTrue(taskService.stored().isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void storageFailureIsA500WithoutInternals(VertxTestContext testContext) {
        taskService.failWith(new DataAccessException("relation \"todos\" does not exist", null));

        client.get(port, "localhost", "/").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(500, response.statusCode());
                assertFalse(response.bodyAsString().contains("relation"));
                assertFalse(response.bodyAsString().contains("Exception"));
                testContext.completeNow();
            })));
    }

    @Test
    void unreachableDatabaseIsA503(VertxTestContext testContext) {
        taskService.failWith(ConnectionException.exhausted(30, new ConnectException("Connection refused")));

        client.post(port, "localhost", "/add").sendForm(form("Alice", "Buy milk"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(503, response.statusCode());
                assertFalse(response.bodyAsString().contains("Connection refused"));
                testContext.completeNow();
            })));
    }

    @Test
    void apiListsItemsWithIsoTimestamps(VertxTestContext testContext) {
        taskService.add("Alice", "Buy milk", Instant.parse("2025-06-01T09:00:00Z"));

        client.get(port, "localhost", "/api/items").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(200, response.statusCode());
                JsonArray items = response.bodyAsJsonArray();
                assertEquals(1, items.size());
                JsonObject item = items.getJsonObject(0);
                assertEquals("Alice", item.getString("name"));
                assertEquals("Buy milk", item.getString("task"));
                assertEquals(1L, item.getLong("id"));
                assertEquals("2025-06-01T09:00:00Z", item.getString("createdAt"));
                testContext.completeNow();
            })));
    }

    @Test
    void apiCreateReturns201WithItem(VertxTestContext testContext) {
        client.post(port, "localhost", "/api/items")
            .sendJsonObject(new JsonObject().put("name", "Bob").put("task", "Walk dog"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(201, response.statusCode());
                JsonObject item = response.bodyAsJsonObject();
                assertEquals("Bob", item.getString("name"));
                assertNotNull(item.getString("createdAt"));
                assertEquals(1, taskService.stored().size());
                testContext.completeNow();
            })));
    }

    @Test
    void apiCreateRejectsBlankInput(VertxTestContext testContext) {
        client.post(port, "localhost", "/api/items")
            .sendJsonObject(new JsonObject().put("name", "").put("task", "Walk dog"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(400, response.statusCode());
                assertEquals(TaskListErrorCodes.VALIDATION_FAILED, response.bodyAsJsonObject().getString("code"));
                assertTrue(taskService.stored().isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    void apiCreateRejectsMalformedJson(VertxTestContext testContext) {
        client.post(port, "localhost", "/api/items")
            .putHeader("Content-Type", "application/json")
            .sendBuffer(Buffer.buffer("{not json"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(400, response.statusCode());
                assertEquals(TaskListErrorCodes.INVALID_REQUEST, response.bodyAsJsonObject().getString("code"));
                testContext.completeNow();
            })));
    }

    @Test
    void apiCreateRejectsNonStringFields(VertxTestContext testContext) {
        client.post(port, "localhost", "/api/items")
            .sendJsonObject(new JsonObject().put("name", 42).put("task", "Walk dog"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(400, response.statusCode());
                testContext.completeNow();
            })));
    }

    @Test
    void apiFailureUsesJsonErrorBody(VertxTestContext testContext) {
        taskService.failWith(ConnectionException.exhausted(30, new ConnectException("Connection refused")));

        client.get(port, "localhost", "/api/items").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(503, response.statusCode());
                JsonObject body = response.bodyAsJsonObject();
                assertEquals(TaskListErrorCodes.DATABASE_UNAVAILABLE, body.getString("code"));
                assertNotNull(body.getLong("timestamp"));
                testContext.completeNow();
            })));
    }

    @Test
    void healthyDatabaseIs200(VertxTestContext testContext) {
        client.get(port, "localhost", "/health").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(200, response.statusCode());
                JsonObject body = response.bodyAsJsonObject();
                assertEquals("healthy", body.getString("status"));
                assertEquals("tasklist", body.getString("service"));
                assertEquals("database", body.getString("component"));
                testContext.completeNow();
            })));
    }

    @Test
    void unhealthyDatabaseIs500WithDetail(VertxTestContext testContext) {
        health.set(HealthStatusInfo.unhealthy("database",
            "Could not connect to database after 3 attempts: Connection refused",
            Map.of("attempts", 3, "exhausted", true)));

        client.get(port, "localhost", "/health").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(500, response.statusCode());
                JsonObject body = response.bodyAsJsonObject();
                assertEquals("unhealthy", body.getString("status"));
                assertTrue(body.getString("detail").contains("Connection refused"));
                assertEquals("3", body.getJsonObject("details").getString("attempts"));
                testContext.completeNow();
            })));
    }

    @Test
    void metricsExposeCounters(VertxTestContext testContext) {
        metrics.recordItemCreated();
        metrics.recordItemCreated();

        client.get(port, "localhost", "/metrics").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(200, response.statusCode());
                assertTrue(response.bodyAsString()
                    .contains("tasklist_items_created_total{instance=\"rest-test\"} 2"));
                testContext.completeNow();
            })));
    }

    @Test
    void unknownRouteIs404(VertxTestContext testContext) {
        client.get(port, "localhost", "/nope").send()
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(404, response.statusCode());
                testContext.completeNow();
            })));
    }
}
