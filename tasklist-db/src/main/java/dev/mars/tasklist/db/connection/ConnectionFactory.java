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

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

/**
 * Opens one new, un-pooled database session per call. The caller owns the returned
 * connection and must close it.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Future<SqlConnection> connect();
}
