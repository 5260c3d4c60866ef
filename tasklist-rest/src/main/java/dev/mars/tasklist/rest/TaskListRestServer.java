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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.tasklist.api.TaskService;
import dev.mars.tasklist.api.health.HealthService;
import dev.mars.tasklist.db.metrics.TaskListMetrics;
import dev.mars.tasklist.rest.config.RestServerConfig;
import dev.mars.tasklist.rest.handlers.HealthHandler;
import dev.mars.tasklist.rest.handlers.MetricsHandler;
import dev.mars.tasklist.rest.handlers.TaskApiHandler;
import dev.mars.tasklist.rest.handlers.TodoPageHandler;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HTTP front end of the task list.
 *
 * <p>Routes:</p>
 * <ul>
 *   <li>{@code GET /} - HTML list of items with the add form</li>
 *   <li>{@code POST /add} - form submission, redirects to {@code /}</li>
 *   <li>{@code GET /api/items}, {@code POST /api/items} - JSON access to the same data</li>
 *   <li>{@code GET /health} - database reachability</li>
 *   <li>{@code GET /metrics} - connection and item counters</li>
 * </ul>
 *
 * <p>The verticle only depends on the {@link TaskService} and {@link HealthService} contracts,
 * so tests can deploy it against stubs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TaskListRestServer extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(TaskListRestServer.class);

    private final RestServerConfig config;
    private final TaskService taskService;
    private final HealthService healthService;
    private final TaskListMetrics metrics;
    private final ObjectMapper objectMapper;

    private HttpServer server;

    public TaskListRestServer(RestServerConfig config, TaskService taskService,
                              HealthService healthService, TaskListMetrics metrics) {
        this.config = Objects.requireNonNull(config, "RestServerConfig must not be null");
        this.taskService = Objects.requireNonNull(taskService, "TaskService must not be null");
        this.healthService = Objects.requireNonNull(healthService, "HealthService must not be null");
        this.metrics = Objects.requireNonNull(metrics, "TaskListMetrics must not be null");
        this.objectMapper = createObjectMapper();
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Future.succeededFuture()
                .compose(v -> {
                    Router router = createRouter();
                    logger.debug("Router created successfully");
                    return vertx.createHttpServer()
                            .requestHandler(router)
                            .listen(config.port());
                })
                .compose(httpServer -> {
                    server = httpServer;
                    logger.info("Task list server started on port {}", httpServer.actualPort());
                    return Future.<Void>succeededFuture();
                })
                .onSuccess(v -> startPromise.complete())
                .onFailure(cause -> {
                    logger.error("Failed to start task list server", cause);
                    startPromise.fail(cause);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (server == null) {
            stopPromise.complete();
            return;
        }
        logger.info("Stopping task list server");
        server.close()
                .onSuccess(v -> {
                    logger.info("Task list server stopped");
                    stopPromise.complete();
                })
                .onFailure(stopPromise::fail);
    }

    Router createRouter() {
        Router router = Router.router(vertx);

        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create().setBodyLimit(64 * 1024));

        TodoPageHandler pageHandler = new TodoPageHandler(taskService);
        TaskApiHandler apiHandler = new TaskApiHandler(taskService, objectMapper);
        HealthHandler healthHandler = new HealthHandler(healthService, config.serviceName());
        MetricsHandler metricsHandler = new MetricsHandler(metrics);

        router.get("/").handler(pageHandler::renderPage);
        router.post("/add").handler(pageHandler::addItem);

        router.get("/api/items").handler(apiHandler::listItems);
        router.post("/api/items").handler(apiHandler::createItem);

        router.get("/health").handler(healthHandler::getHealth);
        router.get("/metrics").handler(metricsHandler::getMetrics);

        return router;
    }

    /**
     * Actual listen port, useful when configured with port 0.
     */
    public int getActualPort() {
        return server != null ? server.actualPort() : config.port();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
