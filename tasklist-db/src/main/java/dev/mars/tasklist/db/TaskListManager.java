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
package dev.mars.tasklist.db;

import dev.mars.tasklist.api.TaskService;
import dev.mars.tasklist.api.health.HealthService;
import dev.mars.tasklist.db.config.TaskListConfiguration;
import dev.mars.tasklist.db.connection.ConnectionFactory;
import dev.mars.tasklist.db.connection.PgConnectionFactory;
import dev.mars.tasklist.db.connection.PgConnectionManager;
import dev.mars.tasklist.db.health.DatabaseHealthReporter;
import dev.mars.tasklist.db.metrics.TaskListMetrics;
import dev.mars.tasklist.db.repository.PgTaskRepository;
import dev.mars.tasklist.db.setup.SchemaInitializer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the data-access components from one {@link TaskListConfiguration} and runs the boot
 * sequence.
 *
 * <p>{@link #start()} must complete before the task and health services are offered to
 * clients: it waits for the database under the connection retry policy and ensures the schema.
 * A failed start is fatal for the process.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TaskListManager {
    private static final Logger logger = LoggerFactory.getLogger(TaskListManager.class);

    private final TaskListConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final TaskListMetrics metrics;
    private final PgConnectionManager connectionManager;
    private final SchemaInitializer schemaInitializer;
    private final PgTaskRepository taskRepository;
    private final DatabaseHealthReporter healthReporter;

    private volatile boolean started = false;

    public TaskListManager(TaskListConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null, null);
    }

    /**
     * Constructor that reuses the application's Vert.x instance.
     */
    public TaskListManager(TaskListConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, meterRegistry, vertx, null);
    }

    /**
     * Full constructor. A null {@code vertx} creates an instance owned and closed by the manager;
     * a null {@code connectionFactory} connects to the configured PostgreSQL endpoint.
     */
    public TaskListManager(TaskListConfiguration configuration, MeterRegistry meterRegistry,
                           Vertx vertx, ConnectionFactory connectionFactory) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(meterRegistry, "meterRegistry");

        logger.info("Initializing task list manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        this.metrics = new TaskListMetrics(configuration.getInstanceId());
        metrics.bindTo(meterRegistry);

        ConnectionFactory factory = connectionFactory != null
            ? connectionFactory
            : new PgConnectionFactory(this.vertx, configuration.getDatabaseConfig());

        this.connectionManager = new PgConnectionManager(
            this.vertx, factory, configuration.getConnectionRetryPolicy(), metrics);
        this.schemaInitializer = new SchemaInitializer(connectionManager);
        this.taskRepository = new PgTaskRepository(connectionManager, metrics, configuration.getMaxNameLength());
        this.healthReporter = new DatabaseHealthReporter(connectionManager, configuration.getHealthRetryPolicy());

        logger.info("Task list manager initialized");
    }

    /**
     * Waits for the database and ensures the schema. Safe to call again after success.
     */
    public Future<Void> start() {
        if (started) {
            logger.warn("Task list manager is already started");
            return Future.succeededFuture();
        }

        logger.info("Starting task list manager...");
        return schemaInitializer.initialize()
            .onSuccess(v -> {
                started = true;
                logger.info("Task list manager started successfully");
            })
            .onFailure(error -> logger.error("Failed to start task list manager", error));
    }

    /**
     * Releases resources owned by the manager. The Vert.x instance is closed only when the
     * manager created it.
     */
    public Future<Void> close() {
        started = false;
        if (vertxOwnedByManager) {
            logger.info("Closing Vert.x instance (manager-owned)");
            return vertx.close();
        }
        logger.debug("Skipping Vert.x close (external ownership)");
        return Future.succeededFuture();
    }

    public boolean isStarted() {
        return started;
    }

    public TaskService getTaskService() {
        return taskRepository;
    }

    public HealthService getHealthService() {
        return healthReporter;
    }

    public TaskListMetrics getMetrics() {
        return metrics;
    }

    public PgConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public TaskListConfiguration getConfiguration() {
        return configuration;
    }

    public Vertx getVertx() {
        return vertx;
    }
}
