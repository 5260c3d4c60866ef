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

import dev.mars.tasklist.db.metrics.TaskListMetrics;
import io.vertx.ext.web.RoutingContext;

import java.util.Map;

/**
 * GET /metrics - counter values in Prometheus text exposition format.
 */
public class MetricsHandler {

    private final TaskListMetrics metrics;

    public MetricsHandler(TaskListMetrics metrics) {
        this.metrics = metrics;
    }

    public void getMetrics(RoutingContext ctx) {
        ctx.response()
            .putHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
            .end(render(metrics.snapshot(), metrics.getInstanceId()));
    }

    static String render(Map<String, Double> values, String instanceId) {
        String instanceLabel = escapeLabelValue(instanceId);
        StringBuilder out = new StringBuilder();
        values.forEach((name, value) -> {
            String metricName = name.replace('.', '_') + "_total";
            out.append("# TYPE ").append(metricName).append(" counter\n")
               .append(metricName).append("{instance=\"").append(instanceLabel).append("\"} ")
               .append(value.longValue()).append('\n');
        });
        return out.toString();
    }

    static String escapeLabelValue(String value) {
        return value.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n");
    }
}
