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

package org.apache.doris.cli.tool;

import org.apache.doris.client.DorisClient;
import org.apache.doris.client.config.ConfigLoader;
import org.apache.doris.client.config.ConnectionConfig;
import org.apache.doris.client.exception.DorisException;
import org.apache.doris.client.exception.DorisValidationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a single SQL statement for an external caller and reports the outcome as a {@link
 * ToolResult}. Every call resolves the configuration, opens its own connection and closes it
 * again. Failures are returned as unsuccessful results and never thrown.
 */
public class DorisQueryTool {

    private static final Logger LOG = LoggerFactory.getLogger(DorisQueryTool.class);

    private final ObjectMapper mapper;
    private final Supplier<ConnectionConfig> configSupplier;
    private final Function<ConnectionConfig, DorisClient> clientFactory;

    /**
     * Reads {@code ./config.json}, or resolves the connection from the environment and the {@code
     * mcp.json} side file when it does not exist.
     */
    public DorisQueryTool() {
        this(fromConfigFile(Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE)));
    }

    public DorisQueryTool(Supplier<ConnectionConfig> configSupplier) {
        this(configSupplier, DorisClient::new);
    }

    public DorisQueryTool(
            Supplier<ConnectionConfig> configSupplier,
            Function<ConnectionConfig, DorisClient> clientFactory) {
        this.configSupplier = configSupplier;
        this.clientFactory = clientFactory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Connection settings read from {@code configPath} on every call. */
    public static Supplier<ConnectionConfig> fromConfigFile(Path configPath) {
        return () -> ConfigLoader.loadOrResolve(configPath).getConnection();
    }

    public ToolResult execute(ToolRequest request) {
        DorisClient client = null;
        try {
            if (request.getSql() == null || request.getSql().trim().isEmpty()) {
                throw new DorisValidationException("SQL must not be empty");
            }
            ConnectionConfig config = configSupplier.get();
            if (request.getDatabase() != null && !request.getDatabase().isEmpty()) {
                config = config.withDatabase(request.getDatabase());
            }

            client = clientFactory.apply(config);
            client.connect();
            return ToolResult.success(client.query(request.getSql()).getRows());
        } catch (RuntimeException e) {
            LOG.error("Tool query failed: {}", e.getMessage());
            return ToolResult.failure(e.getMessage());
        } finally {
            if (client != null) {
                disconnect(client);
            }
        }
    }

    /** Reads a JSON {@link ToolRequest}, runs it and returns the {@link ToolResult} as JSON. */
    public String execute(String requestJson) {
        ToolResult result;
        try {
            result = execute(mapper.readValue(requestJson, ToolRequest.class));
        } catch (JsonProcessingException e) {
            LOG.error("Invalid tool request: {}", e.getOriginalMessage());
            result = ToolResult.failure("Invalid request: " + e.getOriginalMessage());
        }
        return toJson(result);
    }

    String toJson(ToolResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize tool result: {}", e.getOriginalMessage());
            return "{\"success\":false,\"error\":\"Failed to serialize result\","
                    + "\"message\":\"Query failed: Failed to serialize result\"}";
        }
    }

    private static void disconnect(DorisClient client) {
        try {
            client.disconnect();
        } catch (DorisException e) {
            LOG.warn("Failed to disconnect after tool query: {}", e.getMessage());
        }
    }
}
