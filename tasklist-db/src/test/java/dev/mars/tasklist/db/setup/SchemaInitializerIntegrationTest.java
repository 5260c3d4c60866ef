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

import dev.mars.tasklist.api.error.SchemaException;
import dev.mars.tasklist.db.TaskListIntegrationTestBase;
import dev.mars.tasklist.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * INTEGRATION tests for repeated and concurrent schema setup against PostgreSQL.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class SchemaInitializerIntegrationTest extends TaskListIntegrationTestBase {

    @Test
    void repeatedInitializationKeepsExistingRows() throws Exception {
        await(manager.getTaskService().createItem("Alice", "Buy milk"));

        SchemaInitializer initializer = new SchemaInitializer(manager.getConnectionManager());
        for (int i = 0; i < 3; i++) {
            await(initializer.initialize());
        }

        assertEquals(1, await(manager.getTaskService().listItems()).size());
    }

    @Test
    void concurrentInitializationsAllSucceed() throws Exception {
        SchemaInitializer initializer = new SchemaInitializer(manager.getConnectionManager());

        await(Future.all(List.of(initializer.initialize(), initializer.initialize(), initializer.initialize())));

        assertEquals(0, await(manager.getTaskService().listItems()).size());
    }

    @Test
    void listingIndexExists() throws Exception {
        RowSet<Row> rows = await(manager.getConnectionManager().withConnection(conn ->
            conn.query("SELECT indexname FROM pg_indexes WHERE tablename = 'todos'").execute()));

        boolean found = false;
        for (Row row : rows) {
            if ("idx_todos_created_at_id".equals(row.getString("indexname"))) {
                found = true;
            }
        }
        assertTrue(found, "listing index should be created by the schema script");
    }

    @Test
    void invalidStatementFailsWithSchemaException() {
        SchemaInitializer initializer = new SchemaInitializer(manager.getConnectionManager(), "/db/schema/broken.sql");

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(initializer.initialize()));
        assertInstanceOf(SchemaException.class, e.getCause());
    }
}
