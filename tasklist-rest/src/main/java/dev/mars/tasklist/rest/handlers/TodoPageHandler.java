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
import dev.mars.tasklist.api.TaskService;
import dev.mars.tasklist.rest.error.ErrorResponse;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Browser-facing routes: the item list page and the add form.
 *
 * Provides endpoints for:
 * - GET / - renders every item, newest first, with the add form
 * - POST /add - stores one item from form fields {@code name} and {@code task}, then redirects to /
 *
 * <p>Blank form input is ignored without an error; the browser is redirected back to the list
 * either way.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class TodoPageHandler {

    private static final Logger logger = LoggerFactory.getLogger(TodoPageHandler.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final TaskService taskService;

    public TodoPageHandler(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * GET /
     */
    public void renderPage(RoutingContext ctx) {
        taskService.listItems()
            .onSuccess(items -> ctx.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "text/html; charset=utf-8")
                .end(renderHtml(items)))
            .onFailure(error -> {
                logger.error("Failed to render item list", error);
                ErrorResponse.htmlFailure(ctx, error);
            });
    }

    /**
     * POST /add
     */
    public void addItem(RoutingContext ctx) {
        String name = ctx.request().getFormAttribute("name");
        String task = ctx.request().getFormAttribute("task");

        taskService.createItem(name, task)
            .onSuccess(created -> ctx.redirect("/"))
            .onFailure(error -> {
                logger.error("Failed to add item", error);
                ErrorResponse.htmlFailure(ctx, error);
            });
    }

    static String renderHtml(List<TaskItem> items) {
        StringBuilder html = new StringBuilder(512 + items.size() * 128);
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
            .append("<title>Todo List</title>\n</head>\n<body>\n")
            .append("<h1>Todo List</h1>\n")
            .append("<form method=\"post\" action=\"/add\">\n")
            .append("  <input type=\"text\" name=\"name\" placeholder=\"Your name\" maxlength=\"255\" required>\n")
            .append("  <input type=\"text\" name=\"task\" placeholder=\"Task\" required>\n")
            .append("  <button type=\"submit\">Add</button>\n")
            .append("</form>\n");

        if (items.isEmpty()) {
            html.append("<p>No tasks yet.</p>\n");
        } else {
            html.append("<ul>\n");
            for (TaskItem item : items) {
                html.append("  <li><strong>").append(escape(item.name())).append("</strong>: ")
                    .append(escape(item.task()))
                    .append(" <small>").append(TIMESTAMP_FORMAT.format(item.createdAt())).append("</small></li>\n");
            }
            html.append("</ul>\n");
        }

        html.append("</body>\n</html>\n");
        return html.toString();
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&#39;"); break;
                default: out.append(c);
            }
        }
        return out.toString();
    }
}
