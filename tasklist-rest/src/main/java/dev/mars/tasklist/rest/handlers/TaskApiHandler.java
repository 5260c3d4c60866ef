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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tasklist.api.TaskService;
import dev.mars.tasklist.api.error.TaskListError;
import dev.mars.tasklist.rest.error.ErrorResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON routes over the same task operations as the HTML page.
 *
 * Provides endpoints for:
 * - GET /api/items - all items, newest first
 * - POST /api/items - create an item from {@code {"name": ..., "task": ...}}
 *
 * <p>Unlike the form route, blank or over-long input is answered with 400 here.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TaskApiHandler {

    private static final Logger logger = LoggerFactory.getLogger(TaskApiHandler.class);

    private final TaskService taskService;
    private final ObjectMapper objectMapper;

    public TaskApiHandler(TaskService taskService, ObjectMapper objectMapper) {
        this.taskService = taskService;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /api/items
     */
    public void listItems(RoutingContext ctx) {
        taskService.listItems()
            .onSuccess(items -> sendJson(ctx, 200, items))
            .onFailure(error -> {
                logger.error("Failed to list items", error);
                ErrorResponse.failure(ctx, error);
            });
    }

    /**
     * POST /api/items
     */
    public void createItem(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException e) {
            ErrorResponse.badRequest(ctx, TaskListError.invalidRequest("Request body must be a JSON object"));
            return;
        }
        if (body == null) {
            ErrorResponse.badRequest(ctx, TaskListError.invalidRequest("Request body is required"));
            return;
        }

        Object name = body.getValue("name");
        Object task = body.getValue("task");
        if (!(name instanceof String) || !(task instanceof String)) {
            ErrorResponse.badRequest(ctx, TaskListError.invalidRequest("Fields 'name' and 'task' must be strings"));
            return;
        }

        taskService.createItem((String) name, (String) task)
            .onSuccess(created -> {
                if (created.isPresent()) {
                    sendJson(ctx, 201, created.get());
                } else {
                    ErrorResponse.badRequest(ctx, TaskListError.validationFailed(
                        "Fields 'name' and 'task' must not be blank and 'name' must not be too long"));
                }
            })
            .onFailure(error -> {
                logger.error("Failed to create item", error);
                ErrorResponse.failure(ctx, error);
            });
    }

    private void sendJson(RoutingContext ctx, int statusCode, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize response", e);
            ErrorResponse.internalError(ctx, TaskListError.internalError());
            return;
        }
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(json);
    }
}
