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
package dev.mars.tasklist.db.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the PostgreSQL server holding the task list.
 *
 * <p>Endpoint, credentials and database name are required and validated when the
 * configuration is built, so a misconfigured process fails before it starts serving.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class PgConnectionConfig {
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final String schema;
    private final boolean sslEnabled;

    private PgConnectionConfig(Builder builder) {
        List<String> errors = new ArrayList<>();
        if (isBlank(builder.host)) {
            errors.add("Database host is required");
        }
        if (builder.port < 1 || builder.port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }
        if (isBlank(builder.database)) {
            errors.add("Database name is required");
        }
        if (isBlank(builder.username)) {
            errors.add("Database username is required");
        }
        if (isBlank(builder.password)) {
            errors.add("Database password is required");
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid database configuration: " + String.join(", ", errors));
        }

        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.username = builder.username;
        this.password = builder.password;
        this.schema = builder.schema;
        this.sslEnabled = builder.sslEnabled;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getSchema() {
        return schema;
    }

    public boolean isSslEnabled() {
        return sslEnabled;
    }

    @Override
    public String toString() {
        return "PgConnectionConfig{host='" + host + "', port=" + port + ", database='" + database
            + "', username='" + username + "', schema='" + schema + "', sslEnabled=" + sslEnabled + '}';
    }

    /**
     * Builder for PgConnectionConfig.
     */
    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private String schema;
        private boolean sslEnabled = false;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder sslEnabled(boolean sslEnabled) {
            this.sslEnabled = sslEnabled;
            return this;
        }

        public PgConnectionConfig build() {
            return new PgConnectionConfig(this);
        }
    }
}
