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

import dev.mars.tasklist.api.health.HealthService;
import dev.mars.tasklist.api.health.HealthStatusInfo;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /health - database reachability for liveness checks.
 *
 * <p>Answers 200 when a connection could be opened and 500 otherwise. The body carries the
 * diagnostic detail of the check, never a stack trace.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class HealthHandler {

    private static final Logger logger = LoggerFactory.getLogger(HealthHandler.class);

    private final HealthService healthService;
    private final String serviceName;

    public HealthHandler(HealthService healthService, String serviceName) {
        this.healthService = healthService;
        this.serviceName = serviceName;
    }

    public void getHealth(RoutingContext ctx) {
        healthService.checkHealth()
            .onSuccess(status -> {
                int statusCode = status.isHealthy() ? 200 : 500;
                ctx.response()
                    .setStatusCode(statusCode)
                    .putHeader("Content-Type", "application/json")
                    .end(toJson(status).encode());
            })
            .onFailure(ex -> {
                // checkHealth() reports outages as unhealthy rather than failing
                logger.error("Health check failed unexpectedly", ex);
                ctx.response()
                    .setStatusCode(500)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                        .put("status", "unhealthy")
                        .put("service", serviceName)
                        .put("detail", "Health check failed")
                        .encode());
            });
    }

    private JsonObject toJson(HealthStatusInfo status) {
        JsonObject json = new JsonObject()
            .put("status", status.isHealthy() ? "healthy" : "unhealthy")
            .put("service", serviceName)
            .put("component", status.component())
            .put("timestamp", status.timestamp().toString());

        if (status.message() != null) {
            json.put("detail", status.message());
        }

        if (!status.details().isEmpty()) {
            JsonObject details = new JsonObject();
            status.details().forEach((key, value) -> {
                if (value != null) {
                    details.put(key, value.toString());
                }
            });
            json.put("details", details);
        }

        return json;
    }
}
