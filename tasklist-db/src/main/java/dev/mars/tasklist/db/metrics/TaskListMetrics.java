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
package dev.mars.tasklist.db.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counters for connection acquisition and item writes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TaskListMetrics implements MeterBinder {

    public static final String CONNECTION_ATTEMPTS = "tasklist.connection.attempts";
    public static final String CONNECTION_ATTEMPTS_FAILED = "tasklist.connection.attempts.failed";
    public static final String CONNECTION_ACQUIRED = "tasklist.connection.acquired";
    public static final String CONNECTION_EXHAUSTED = "tasklist.connection.exhausted";
    public static final String ITEMS_CREATED = "tasklist.items.created";
    public static final String ITEMS_IGNORED = "tasklist.items.ignored";

    private final String instanceId;
    private MeterRegistry registry;

    private Counter connectionAttempts;
    private Counter connectionAttemptsFailed;
    private Counter connectionAcquired;
    private Counter connectionExhausted;
    private Counter itemsCreated;
    private Counter itemsIgnored;

    public TaskListMetrics(String instanceId) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    }

    /**
     * Metrics bound to a private in-memory registry.
     */
    public static TaskListMetrics standalone(String instanceId) {
        TaskListMetrics metrics = new TaskListMetrics(instanceId);
        metrics.bindTo(new SimpleMeterRegistry());
        return metrics;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        connectionAttempts = Counter.builder(CONNECTION_ATTEMPTS)
            .description("Database connection attempts, including retries")
            .tag("instance", instanceId)
            .register(registry);

        connectionAttemptsFailed = Counter.builder(CONNECTION_ATTEMPTS_FAILED)
            .description("Database connection attempts that failed")
            .tag("instance", instanceId)
            .register(registry);

        connectionAcquired = Counter.builder(CONNECTION_ACQUIRED)
            .description("Connections successfully opened")
            .tag("instance", instanceId)
            .register(registry);

        connectionExhausted = Counter.builder(CONNECTION_EXHAUSTED)
            .description("Acquisitions that used up the whole retry budget")
            .tag("instance", instanceId)
            .register(registry);

        itemsCreated = Counter.builder(ITEMS_CREATED)
            .description("Task items stored")
            .tag("instance", instanceId)
            .register(registry);

        itemsIgnored = Counter.builder(ITEMS_IGNORED)
            .description("Create requests ignored because of blank or over-long input")
            .tag("instance", instanceId)
            .register(registry);
    }

    public void recordConnectionAttempt() {
        if (connectionAttempts != null) connectionAttempts.increment();
    }

    public void recordConnectionAttemptFailed() {
        if (connectionAttemptsFailed != null) connectionAttemptsFailed.increment();
    }

    public void recordConnectionAcquired() {
        if (connectionAcquired != null) connectionAcquired.increment();
    }

    public void recordConnectionExhausted() {
        if (connectionExhausted != null) connectionExhausted.increment();
    }

    public void recordItemCreated() {
        if (itemsCreated != null) itemsCreated.increment();
    }

    public void recordItemIgnored() {
        if (itemsIgnored != null) itemsIgnored.increment();
    }

    /**
     * Current counter values keyed by meter name, in a stable order.
     */
    public Map<String, Double> snapshot() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(CONNECTION_ATTEMPTS, count(connectionAttempts));
        values.put(CONNECTION_ATTEMPTS_FAILED, count(connectionAttemptsFailed));
        values.put(CONNECTION_ACQUIRED, count(connectionAcquired));
        values.put(CONNECTION_EXHAUSTED, count(connectionExhausted));
        values.put(ITEMS_CREATED, count(itemsCreated));
        values.put(ITEMS_IGNORED, count(itemsIgnored));
        return values;
    }

    private static double count(Counter counter) {
        return counter != null ? counter.count() : 0.0;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
