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
package dev.mars.tasklist.db.connection;

import dev.mars.tasklist.db.config.PgConnectionConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link ConnectionFactory} opening a single {@link PgConnection} per call.
 *
 * <p>No pool is used: each request holds exactly one session for its own duration and
 * never shares it with another operation.</p>
 */
public class PgConnectionFactory implements ConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionFactory.class);

    private final Vertx vertx;
    private final PgConnectOptions connectOptions;

    public PgConnectionFactory(Vertx vertx, PgConnectionConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.connectOptions = toConnectOptions(Objects.requireNonNull(config, "config"));
        logger.info("Configured PostgreSQL endpoint {}:{}/{} as user {}",
            config.getHost(), config.getPort(), config.getDatabase(), config.getUsername());
    }

    static PgConnectOptions toConnectOptions(PgConnectionConfig config) {
        PgConnectOptions options = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword())
            .setSslMode(config.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        options.addProperty("application_name", "tasklist");
        String schema = config.getSchema();
        if (schema != null && !schema.isBlank()) {
            options.addProperty("search_path", schema.trim());
        }
        return options;
    }

    @Override
    public Future<SqlConnection> connect() {
        return PgConnection.connect(vertx, connectOptions)
            .map(conn -> (SqlConnection) conn);
    }
}
