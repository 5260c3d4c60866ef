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
package dev.mars.tasklist.rest.error;

import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.api.error.DataAccessException;
import dev.mars.tasklist.api.error.TaskListError;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Utility class for sending error responses.
 *
 * <p>Responses only carry the generic message of a {@link TaskListError}. The exception that
 * caused the failure is logged by the handler and never written to the client.</p>
 */
public final class ErrorResponse {

    private ErrorResponse() {
        // Utility class - no instantiation
    }

    public static void send(RoutingContext ctx, int statusCode, TaskListError error) {
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(toJson(error).encode());
    }

    public static void badRequest(RoutingContext ctx, TaskListError error) {
        send(ctx, 400, error);
    }

    public static void internalError(RoutingContext ctx, TaskListError error) {
        send(ctx, 500, error);
    }

    public static void serviceUnavailable(RoutingContext ctx, TaskListError error) {
        send(ctx, 503, error);
    }

    /**
     * Sends the JSON response matching a failed data operation.
     */
    public static void failure(RoutingContext ctx, Throwable cause) {
        send(ctx, statusFor(cause), errorFor(cause));
    }

    /**
     * Sends a minimal HTML page for failures on the browser-facing routes.
     */
    public static void htmlFailure(RoutingContext ctx, Throwable cause) {
        TaskListError error = errorFor(cause);
        ctx.response()
            .setStatusCode(statusFor(cause))
            .putHeader("Content-Type", "text/html; charset=utf-8")
            .end("<!DOCTYPE html><html><head><title>Error</title></head><body>"
                + "<h1>Something went wrong</h1><p>" + error.message() + "</p>"
                + "<p><a href=\"/\">Back to the list</a></p></body></html>");
    }

    public static int statusFor(Throwable cause) {
        return cause instanceof ConnectionException ? 503 : 500;
    }

    public static TaskListError errorFor(Throwable cause) {
        if (cause instanceof ConnectionException) {
            return TaskListError.databaseUnavailable();
        }
        if (cause instanceof DataAccessException) {
            return TaskListError.dataAccessFailed();
        }
        return TaskListError.internalError();
    }

    public static JsonObject toJson(TaskListError error) {
        return new JsonObject()
            .put("code", error.code())
            .put("error", error.message())
            .put("timestamp", error.timestamp().toEpochMilli());
    }
}
