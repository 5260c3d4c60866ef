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

import dev.mars.tasklist.db.TaskListManager;
import dev.mars.tasklist.db.config.TaskListConfiguration;
import dev.mars.tasklist.rest.config.RestServerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the task list server.
 *
 * <p>HTTP settings come from {@code ConfigRetriever} with this precedence (highest first):</p>
 * <ol>
 *   <li>System properties ({@code -Dport=9090})</li>
 *   <li>Environment variables</li>
 *   <li>Config file ({@code conf/rest-server.json}, optional)</li>
 *   <li>Defaults in {@link RestServerConfig}</li>
 * </ol>
 *
 * <p>Database settings come from {@link TaskListConfiguration} ({@code TASKLIST_*} environment
 * variables or {@code tasklist.*} system properties). Startup waits for the database within the
 * connection retry budget, ensures the schema, and only then opens the HTTP port. If any step
 * fails the process exits with status 1.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @see TaskListRestServer
 * @see TaskListManager
 */
public final class StartRestServer {

    private static final Logger logger = LoggerFactory.getLogger(StartRestServer.class);

    private StartRestServer() {
        // Utility class - not instantiable
    }

    public static void main(String[] args) {
        logger.info("Starting task list server...");

        Vertx vertx = Vertx.vertx();

        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject().put("path", "conf/rest-server.json"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        ConfigRetrieverOptions retrieverOptions = new ConfigRetrieverOptions()
            .addStore(fileStore)
            .addStore(envStore)
            .addStore(sysPropsStore);

        ConfigRetriever retriever = ConfigRetriever.create(vertx, retrieverOptions);

        retriever.getConfig()
            .compose(jsonConfig -> {
                RestServerConfig config = RestServerConfig.from(jsonConfig);
                logger.info("Configuration loaded: port={}", config.port());

                TaskListManager manager = new TaskListManager(
                    new TaskListConfiguration(), new SimpleMeterRegistry(), vertx);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx, manager),
                    "tasklist-shutdown"));

                return manager.start()
                    .compose(v -> vertx.deployVerticle(new TaskListRestServer(
                        config,
                        manager.getTaskService(),
                        manager.getHealthService(),
                        manager.getMetrics())));
            })
            .onSuccess(deploymentId -> logger.info("Task list server is ready (deployment {})", deploymentId))
            .onFailure(cause -> {
                logger.error("Failed to start task list server", cause);
                System.exit(1);
            });
    }

    private static void shutdown(Vertx vertx, TaskListManager manager) {
        logger.info("Shutting down task list server...");
        try {
            manager.close()
                .compose(v -> vertx.close())
                .toCompletionStage()
                .toCompletableFuture()
                .get(10, java.util.concurrent.TimeUnit.SECONDS);
            logger.info("Task list server stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Shutdown interrupted");
        } catch (Exception e) {
            logger.warn("Shutdown did not complete cleanly: {}", e.getMessage());
        }
    }
}
