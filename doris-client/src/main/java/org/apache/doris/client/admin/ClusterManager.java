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

package org.apache.doris.client.admin;

import org.apache.doris.client.DorisClient;
import org.apache.doris.client.config.ConnectionConfig;
import org.apache.doris.client.config.DorisConfig;
import org.apache.doris.client.config.FrontendConfig;
import org.apache.doris.client.exception.DorisException;
import org.apache.doris.client.http.FrontendHttpClient;
import org.apache.doris.client.metadata.ClusterStatus;
import org.apache.doris.client.metadata.QueryResult;
import org.apache.doris.client.utils.SqlUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cluster administration on top of the frontend HTTP API and the SQL admin statements.
 *
 * <p>The manager owns its own {@link DorisClient} for SQL operations and an authenticated {@link
 * FrontendHttpClient} for the control-plane endpoints. Failures are logged and rethrown
 * unchanged.
 */
public class ClusterManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterManager.class);

    static final String CLUSTER_STATUS_PATH = "/api/cluster_status";
    static final String SYSTEM_METRICS_PATH = "/api/system/metrics";
    static final String RESTART_PATH = "/api/admin/restart";

    private final DorisConfig config;
    private final DorisClient client;
    private final FrontendHttpClient http;

    public ClusterManager(DorisConfig config) {
        this(config, new DorisClient(config.getConnection()), newHttpClient(config));
    }

    public ClusterManager(DorisConfig config, DorisClient client, FrontendHttpClient http) {
        this.config = config;
        this.client = client;
        this.http = http;
    }

    private static FrontendHttpClient newHttpClient(DorisConfig config) {
        ConnectionConfig connection = config.getConnection();
        return FrontendHttpClient.create(
                config.getFrontend(),
                connection.getUser(),
                connection.getPassword(),
                connection.getTimeoutMillis());
    }

    public DorisConfig getConfig() {
        return config;
    }

    // ------------------------------------------------------------------------------------------
    // Frontend HTTP API
    // ------------------------------------------------------------------------------------------

    public ClusterStatus getClusterStatus() {
        try {
            return ClusterStatus.fromJson(http.get(CLUSTER_STATUS_PATH));
        } catch (DorisException e) {
            LOG.error("Failed to get cluster status: {}", e.getMessage());
            throw e;
        }
    }

    /** Returns the frontend entries of the cluster status, or an empty list. */
    public List<JsonNode> getFeNodes() {
        return getClusterStatus().getFrontends();
    }

    /** Returns the backend entries of the cluster status, or an empty list. */
    public List<JsonNode> getBeNodes() {
        return getClusterStatus().getBackends();
    }

    public JsonNode getQueryProgress(String queryId) {
        try {
            String id = SqlUtils.checkQueryId(queryId);
            return http.get("/api/query/" + FrontendHttpClient.encodePathSegment(id) + "/profile");
        } catch (DorisException e) {
            LOG.error("Failed to get progress of query {}: {}", queryId, e.getMessage());
            throw e;
        }
    }

    public JsonNode getResourceUsage() {
        try {
            return http.get(SYSTEM_METRICS_PATH);
        } catch (DorisException e) {
            LOG.error("Failed to get resource usage: {}", e.getMessage());
            throw e;
        }
    }

    /** Asks the frontend at {@code host:port} to restart itself. */
    public JsonNode restartFeNode(String host, int port) {
        try {
            SqlUtils.checkHostPort(host, port);
            return http.forFrontend(new FrontendConfig(host, port))
                    .post(RESTART_PATH, JsonNodeFactory.instance.objectNode());
        } catch (DorisException e) {
            LOG.error("Failed to restart frontend {}:{}: {}", host, port, e.getMessage());
            throw e;
        }
    }

    // ------------------------------------------------------------------------------------------
    // SQL admin statements
    // ------------------------------------------------------------------------------------------

    public List<Map<String, Object>> getTablePartitions(String database, String table) {
        try {
            return client.query("SHOW PARTITIONS FROM " + SqlUtils.qualifiedName(database, table))
                    .getRows();
        } catch (DorisException e) {
            LOG.error(
                    "Failed to get partitions of {}.{}: {}", database, table, e.getMessage());
            throw e;
        }
    }

    /** Returns the first row of {@code SHOW STATS}, or empty if the table has no statistics. */
    public Optional<Map<String, Object>> getTableStats(String database, String table) {
        try {
            QueryResult result =
                    client.query("SHOW STATS " + SqlUtils.qualifiedName(database, table));
            return result.isEmpty()
                    ? Optional.empty()
                    : Optional.of(result.getRows().get(0));
        } catch (DorisException e) {
            LOG.error(
                    "Failed to get statistics of {}.{}: {}", database, table, e.getMessage());
            throw e;
        }
    }

    public List<Map<String, Object>> getRunningQueries() {
        try {
            return client.query("SHOW PROCESSLIST").getRows();
        } catch (DorisException e) {
            LOG.error("Failed to get running queries: {}", e.getMessage());
            throw e;
        }
    }

    /** Kills a running query. The id is checked before any statement is sent. */
    public void killQuery(String queryId) {
        try {
            client.query("KILL ?", SqlUtils.checkQueryId(queryId));
            LOG.info("Killed query {}", queryId);
        } catch (DorisException e) {
            LOG.error("Failed to kill query {}: {}", queryId, e.getMessage());
            throw e;
        }
    }

    /** Returns the server version, or null if the server returned no row. */
    public String getVersion() {
        try {
            QueryResult result = client.query("SELECT DORIS_VERSION() AS version");
            if (result.isEmpty()) {
                return null;
            }
            Object version = result.getRows().get(0).get("version");
            return version == null ? null : version.toString();
        } catch (DorisException e) {
            LOG.error("Failed to get version: {}", e.getMessage());
            throw e;
        }
    }

    public void addBeNode(String host, int port) {
        try {
            client.query("ALTER SYSTEM ADD BACKEND ?", SqlUtils.checkHostPort(host, port));
            LOG.info("Added backend {}:{}", host, port);
        } catch (DorisException e) {
            LOG.error("Failed to add backend {}:{}: {}", host, port, e.getMessage());
            throw e;
        }
    }

    public void removeBeNode(String host, int port) {
        try {
            client.query("ALTER SYSTEM DROP BACKEND ?", SqlUtils.checkHostPort(host, port));
            LOG.info("Removed backend {}:{}", host, port);
        } catch (DorisException e) {
            LOG.error("Failed to remove backend {}:{}: {}", host, port, e.getMessage());
            throw e;
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
