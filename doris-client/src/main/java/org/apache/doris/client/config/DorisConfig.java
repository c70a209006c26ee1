/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.doris.client.config;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The complete tool configuration: SQL connection parameters, the frontend HTTP endpoint used by
 * the cluster manager and the optional list of known backends.
 */
public final class DorisConfig {

    private final ConnectionConfig connection;
    private final FrontendConfig frontend;
    private final List<BackendConfig> backends;

    public DorisConfig(
            ConnectionConfig connection, FrontendConfig frontend, List<BackendConfig> backends) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.frontend = Objects.requireNonNull(frontend, "frontend");
        this.backends = Collections.unmodifiableList(backends);
    }

    /**
     * Creates a config whose frontend HTTP endpoint lives on the SQL host at the default HTTP
     * port.
     */
    public static DorisConfig of(ConnectionConfig connection) {
        return new DorisConfig(
                connection,
                new FrontendConfig(connection.getHost(), FrontendConfig.DEFAULT_HTTP_PORT),
                Collections.emptyList());
    }

    public ConnectionConfig getConnection() {
        return connection;
    }

    public FrontendConfig getFrontend() {
        return frontend;
    }

    public List<BackendConfig> getBackends() {
        return backends;
    }

    @Override
    public String toString() {
        return "DorisConfig{"
                + "connection="
                + connection
                + ", frontend="
                + frontend
                + ", backends="
                + backends
                + '}';
    }
}
