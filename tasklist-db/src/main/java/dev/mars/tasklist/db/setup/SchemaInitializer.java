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
package dev.mars.tasklist.db.setup;

import dev.mars.tasklist.api.error.ConnectionException;
import dev.mars.tasklist.api.error.SchemaException;
import dev.mars.tasklist.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates the {@code todos} table and its listing index when they are missing.
 *
 * <p>Runs once per process boot, before the HTTP surface is deployed. The script only uses
 * {@code IF NOT EXISTS} statements, so it may be applied any number of times against the same
 * database without failing or touching existing rows. Two processes booting at the same time
 * can still race inside PostgreSQL's catalog; "already exists" outcomes of that race are
 * treated as success. Any other failure is a {@link SchemaException} and is not retried.</p>
 */
public class SchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);

    public static final String DEFAULT_SCRIPT = "/db/schema/V001__create_todos.sql";

    // duplicate_table, duplicate_object, unique_violation on the catalog during concurrent DDL
    private static final Set<String> ALREADY_EXISTS_STATES = Set.of("42P07", "42710", "23505");

    private final PgConnectionManager connectionManager;
    private final String scriptResource;

    public SchemaInitializer(PgConnectionManager connectionManager) {
        this(connectionManager, DEFAULT_SCRIPT);
    }

    public SchemaInitializer(PgConnectionManager connectionManager, String scriptResource) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.scriptResource = Objects.requireNonNull(scriptResource, "scriptResource");
    }

    /**
     * Acquires a connection under the boot retry policy and applies the schema on it.
     *
     * @return completes when the schema exists; fails with {@link ConnectionException} when the
     *         database never became reachable, or {@link SchemaException} when the DDL failed
     */
    public Future<Void> initialize() {
        logger.info("Ensuring task list schema from {}", scriptResource);
        return connectionManager.withConnection(this::ensureSchema)
            .onSuccess(v -> logger.info("Task list schema is ready"))
            .onFailure(error -> logger.error("Failed to initialize task list schema: {}", error.getMessage()));
    }

    /**
     * Applies the schema script on a connection owned by the caller.
     */
    public Future<Void> ensureSchema(SqlConnection conn) {
        List<String> statements;
        try {
            statements = parseSqlStatements(loadScript());
        } catch (SchemaException e) {
            return Future.failedFuture(e);
        }

        Future<Void> chain = Future.succeededFuture();
        for (String statement : statements) {
            chain = chain.compose(v -> execute(conn, statement));
        }
        return chain;
    }

    private Future<Void> execute(SqlConnection conn, String statement) {
        logger.debug("Executing: {}", abbreviate(statement));
        return conn.query(statement).execute()
            .<Void>map(rs -> null)
            .recover(error -> {
                if (isAlreadyExists(error)) {
                    logger.debug("Schema object already exists, skipping: {}", abbreviate(statement));
                    return Future.succeededFuture();
                }
                return Future.failedFuture(new SchemaException(
                    "Schema statement failed: " + abbreviate(statement), error));
            });
    }

    private static boolean isAlreadyExists(Throwable error) {
        if (error instanceof PgException) {
            String sqlState = ((PgException) error).getSqlState();
            return sqlState != null && ALREADY_EXISTS_STATES.contains(sqlState);
        }
        return false;
    }

    private String loadScript() {
        try (InputStream is = getClass().getResourceAsStream(scriptResource)) {
            if (is == null) {
                throw new SchemaException("Schema script not found: " + scriptResource, null);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema script: " + scriptResource, e);
        }
    }

    /**
     * Splits a script on statement-terminating semicolons, dropping {@code --} comments and
     * leaving semicolons inside quoted literals alone.
     */
    static List<String> parseSqlStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;

        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);

            if (!inQuote && c == '-' && i + 1 < content.length() && content.charAt(i + 1) == '-') {
                while (i < content.length() && content.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            if (c == '\'') {
                inQuote = !inQuote;
            }

            if (c == ';' && !inQuote) {
                addStatement(statements, current);
                current = new StringBuilder();
                i++;
                continue;
            }

            current.append(c);
            i++;
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder buffer) {
        String statement = buffer.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static String abbreviate(String statement) {
        String flat = statement.replaceAll("\\s+", " ");
        return flat.length() <= 60 ? flat : flat.substring(0, 60) + "...";
    }
}
