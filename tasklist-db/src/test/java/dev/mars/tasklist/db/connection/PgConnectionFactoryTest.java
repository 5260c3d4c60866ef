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
import dev.mars.tasklist.test.categories.TestCategories;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgConnectionFactoryTest {

    private PgConnectionConfig.Builder builder() {
        return new PgConnectionConfig.Builder()
            .host("db")
            .port(5432)
            .database("todos")
            .username("todo_user")
            .password("todo_password");
    }

    @Test
    void mapsConfigToConnectOptions() {
        PgConnectOptions options = PgConnectionFactory.toConnectOptions(builder().schema("app").build());

        assertEquals("db", options.getHost());
        assertEquals(5432, options.getPort());
        assertEquals("todos", options.getDatabase());
        assertEquals("todo_user", options.getUser());
        assertEquals("todo_password", options.getPassword());
        assertEquals(SslMode.DISABLE, options.getSslMode());
        assertEquals("tasklist", options.getProperties().get("application_name"));
        assertEquals("app", options.getProperties().get("search_path"));
    }

    @Test
    void sslFlagRequiresTls() {
        PgConnectOptions options = PgConnectionFactory.toConnectOptions(builder().sslEnabled(true).build());

        assertEquals(SslMode.REQUIRE, options.getSslMode());
    }

    @Test
    void blankSchemaLeavesSearchPathAlone() {
        PgConnectOptions options = PgConnectionFactory.toConnectOptions(builder().schema(" ").build());

        assertFalse(options.getProperties().containsKey("search_path"));
    }
}
