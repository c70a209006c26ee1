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

package org.apache.doris.client;

import org.apache.doris.client.config.ConnectionConfig;
import org.apache.doris.client.config.FrontendConfig;
import org.apache.doris.client.exception.DorisConnectionException;
import org.apache.doris.client.exception.DorisException;
import org.apache.doris.client.exception.DorisQueryException;
import org.apache.doris.client.exception.DorisValidationException;
import org.apache.doris.client.http.FrontendHttpClient;
import org.apache.doris.client.load.ExportOptions;
import org.apache.doris.client.load.ExportResult;
import org.apache.doris.client.load.FileFormat;
import org.apache.doris.client.load.ImportOptions;
import org.apache.doris.client.load.ImportResult;
import org.apache.doris.client.load.LoadSubmission;
import org.apache.doris.client.metadata.ClusterStatus;
import org.apache.doris.client.metadata.QueryResult;
import org.apache.doris.client.utils.FormatUtils;
import org.apache.doris.client.utils.SqlUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for a single Doris frontend speaking the MySQL protocol.
 *
 * <p>The client owns at most one JDBC connection. Every operation that needs a connection opens
 * one lazily if none is open; calling {@link #connect()} again replaces the current connection.
 * Nothing is pooled and nothing is retried: driver failures are logged and rethrown as {@link
 * DorisConnectionException} or {@link DorisQueryException} carrying the driver message.
 *
 * <p>Instances are not thread-safe.
 */
public class DorisClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DorisClient.class);

    private static final String CLUSTER_STATUS_PATH = "/api/cluster_status";

    private final ConnectionConfig config;
    private final JdbcConnectionFactory connectionFactory;
    private final Clock clock;

    @Nullable private Connection connection;

    public DorisClient(ConnectionConfig config) {
        this(config, JdbcConnectionFactory.mysql(), Clock.systemUTC());
    }

    public DorisClient(
            ConnectionConfig config, JdbcConnectionFactory connectionFactory, Clock clock) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.clock = clock;
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    public boolean isConnected() {
        return connection != null;
    }

    /** Opens a new connection, closing the current one first if there is one. */
    public void connect() {
        if (connection != null) {
            disconnect();
        }
        try {
            connection = connectionFactory.open(config);
            LOG.debug("Connected to {}:{}", config.getHost(), config.getPort());
        } catch (SQLException e) {
            connection = null;
            LOG.error(
                    "Failed to connect to Doris at {}:{}: {}",
                    config.getHost(),
                    config.getPort(),
                    e.getMessage());
            throw new DorisConnectionException(e.getMessage(), e);
        }
    }

    /** Closes the current connection. Does nothing if the client is not connected. */
    public void disconnect() {
        Connection current = connection;
        if (current == null) {
            return;
        }
        connection = null;
        try {
            current.close();
        } catch (SQLException e) {
            LOG.error("Failed to close connection: {}", e.getMessage());
            throw new DorisConnectionException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private Connection ensureConnected() {
        if (connection == null) {
            connect();
        }
        return connection;
    }

    public QueryResult query(String sql, Object... params) {
        Connection conn = ensureConnected();
        try (PreparedStatement statement = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            if (statement.execute()) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    return QueryResult.fromResultSet(resultSet);
                }
            }
            return QueryResult.ofUpdateCount(statement.getUpdateCount());
        } catch (SQLException e) {
            LOG.error("Failed to execute query: {}", e.getMessage());
            throw new DorisQueryException(e.getMessage(), e.getSQLState(), e);
        }
    }

    public QueryResult query(String sql, List<?> params) {
        return query(sql, params.toArray());
    }

    public List<String> getDatabases() {
        QueryResult result = query("SHOW DATABASES");
        List<String> databases = new ArrayList<>(result.size());
        for (Map<String, Object> row : result.getRows()) {
            databases.add(firstPresent(row, "Database", "name"));
        }
        return databases;
    }

    public List<String> getTables(String database) {
        QueryResult result = query("SHOW TABLES FROM " + SqlUtils.quoteIdentifier(database));
        List<String> tables = new ArrayList<>(result.size());
        for (Map<String, Object> row : result.getRows()) {
            tables.add(firstPresent(row, "Tables_in_" + database, "Tables_in_database", "name"));
        }
        return tables;
    }

    /** Returns the rows of {@code DESC database.table}, one per column. */
    public List<Map<String, Object>> getTableSchema(String database, String table) {
        return query("DESC " + SqlUtils.qualifiedName(database, table)).getRows();
    }

    /**
     * Inserts all rows with a single multi-row INSERT. Column order follows the table schema;
     * columns missing from a row are inserted as NULL.
     *
     * @throws DorisValidationException if {@code rows} is null or empty, before any SQL is issued
     */
    public ImportResult bulkImport(String database, String table, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new DorisValidationException("No rows provided for import");
        }

        List<String> columns = new ArrayList<>();
        for (Map<String, Object> column : getTableSchema(database, table)) {
            columns.add(firstPresent(column, "Field", "name"));
        }

        StringBuilder sql =
                new StringBuilder("INSERT INTO ")
                        .append(SqlUtils.qualifiedName(database, table))
                        .append(" (")
                        .append(SqlUtils.quoteIdentifiers(columns))
                        .append(") VALUES ");
        String rowPlaceholders = SqlUtils.placeholders(columns.size());
        List<Object> values = new ArrayList<>(rows.size() * columns.size());
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(rowPlaceholders);
            Map<String, Object> row = rows.get(i);
            for (String column : columns) {
                values.add(row.get(column));
            }
        }

        long affected = query(sql.toString(), values).getUpdateCount();
        return new ImportResult(true, affected, "Imported " + affected + " row(s)");
    }

    /**
     * Submits an asynchronous bulk-load job reading {@code filePath} into {@code table}. The job
     * label is derived from the current time. The method returns once the engine acknowledged the
     * submission and does not wait for the job to finish. Without {@code options} the {@link
     * ImportOptions#defaults() defaults} apply.
     */
    public LoadSubmission importFromFile(
            String database, String table, String filePath, @Nullable ImportOptions options) {
        if (filePath == null || filePath.trim().isEmpty()) {
            throw new DorisValidationException("File path must not be empty");
        }
        if (options == null) {
            options = ImportOptions.defaults();
        }
        String label = "load_" + clock.millis();
        FileFormat format =
                options.getFormat() != null
                        ? options.getFormat()
                        : FileFormat.inferFromPath(filePath);

        List<Object> params = new ArrayList<>();
        StringBuilder sql =
                new StringBuilder("LOAD LABEL ")
                        .append(SqlUtils.qualifiedName(database, label))
                        .append(" (DATA INFILE(?) INTO TABLE ")
                        .append(SqlUtils.quoteIdentifier(table));
        params.add(filePath);
        if (options.getColumnSeparator() != null) {
            sql.append(" COLUMNS TERMINATED BY ?");
            params.add(options.getColumnSeparator());
        }
        sql.append(" FORMAT AS \"").append(format.name()).append('"');
        if (!options.getColumns().isEmpty()) {
            sql.append(" (").append(SqlUtils.quoteIdentifiers(options.getColumns())).append(')');
        }
        if (options.getWhere() != null && !options.getWhere().trim().isEmpty()) {
            sql.append(" WHERE ").append(options.getWhere());
        }
        sql.append(')');

        QueryResult result = query(sql.toString(), params);
        LOG.info("Submitted load job {} for {}.{}", label, database, table);
        return new LoadSubmission(label, result.getRows(), "Import job submitted");
    }

    /**
     * Runs {@code sql} and writes the rows to {@code outputFile} as separator-joined lines,
     * overwriting existing content. Values are written as-is without quoting; nulls are written as
     * empty strings. The optional header is taken from the first row's column names.
     */
    public ExportResult exportToFile(String sql, Path outputFile, ExportOptions options)
            throws IOException {
        List<Map<String, Object>> rows = query(sql).getRows();
        String separator = options.getSeparator();

        StringBuilder content = new StringBuilder();
        if (options.isIncludeHeader() && !rows.isEmpty()) {
            content.append(String.join(separator, rows.get(0).keySet())).append('\n');
        }
        for (Map<String, Object> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (Object value : row.values()) {
                cells.add(FormatUtils.stringify(value));
            }
            content.append(String.join(separator, cells)).append('\n');
        }

        try {
            Files.write(outputFile, content.toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.error("Failed to export to {}: {}", outputFile, e.getMessage());
            throw e;
        }
        return new ExportResult(
                rows.size(),
                outputFile,
                "Exported " + rows.size() + " row(s) to " + outputFile);
    }

    /** Fetches the cluster status from a frontend without authentication. */
    public ClusterStatus getClusterStatus(String feHost, int fePort) {
        FrontendHttpClient http =
                FrontendHttpClient.unauthenticated(
                        new FrontendConfig(feHost, fePort), config.getTimeoutMillis());
        try {
            return ClusterStatus.fromJson(http.get(CLUSTER_STATUS_PATH));
        } catch (DorisException e) {
            LOG.error("Failed to get cluster status: {}", e.getMessage());
            throw e;
        }
    }

    private static String firstPresent(Map<String, Object> row, String... keys) {
        for (String key : keys) {
            Object value = row.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return row.isEmpty() ? null : FormatUtils.stringify(row.values().iterator().next());
    }
}
