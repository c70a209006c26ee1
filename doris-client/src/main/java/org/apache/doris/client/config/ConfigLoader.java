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

import org.apache.doris.client.exception.DorisConfigException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the tool configuration from a {@code config.json} document.
 *
 * <p>Expected layout:
 *
 * <pre>{@code
 * {
 *   "doris": {"host": "fe-1", "port": 9030, "user": "root", "password": "", "database": "db",
 *             "timeout": 30000},
 *   "fe":    {"host": "fe-1", "httpPort": 8030},
 *   "be":    [{"host": "be-1", "heartbeatPort": 9050}]
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    /** Loads {@code config.json} from the current working directory. */
    public static DorisConfig loadDefault() {
        return load(Paths.get(DEFAULT_CONFIG_FILE));
    }

    /** Loads and parses the given configuration file. */
    public static DorisConfig load(Path configPath) {
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readAllBytes(configPath));
        } catch (IOException e) {
            LOG.error("Failed to load configuration file {}: {}", configPath, e.getMessage());
            throw new DorisConfigException(
                    "Failed to load configuration file " + configPath + ": " + e.getMessage(), e);
        }
        return parse(root, configPath.toString());
    }

    /**
     * Loads {@code configPath} when it exists, otherwise resolves the connection from the process
     * environment and the optional side-file.
     */
    public static DorisConfig loadOrResolve(Path configPath) {
        if (Files.exists(configPath)) {
            return load(configPath);
        }
        LOG.debug("{} not found, resolving connection from environment", configPath);
        return DorisConfig.of(new EnvironmentConfigResolver().resolve());
    }

    static DorisConfig parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new DorisConfigException("Configuration " + source + " is not a JSON object");
        }
        JsonNode doris = root.get("doris");
        if (doris == null || !doris.isObject()) {
            throw new DorisConfigException("Configuration " + source + " has no 'doris' section");
        }

        ConnectionConfig connection = parseConnection(doris, source);

        FrontendConfig frontend;
        JsonNode fe = root.get("fe");
        if (fe != null && fe.isObject()) {
            frontend =
                    new FrontendConfig(
                            text(fe, "host", connection.getHost()),
                            intValue(fe, "httpPort", FrontendConfig.DEFAULT_HTTP_PORT, source));
        } else {
            frontend = new FrontendConfig(connection.getHost(), FrontendConfig.DEFAULT_HTTP_PORT);
        }

        List<BackendConfig> backends = new ArrayList<>();
        JsonNode be = root.get("be");
        if (be != null && be.isArray()) {
            for (JsonNode node : be) {
                String host = text(node, "host", null);
                if (host == null) {
                    throw new DorisConfigException(
                            "Configuration " + source + " has a backend without 'host'");
                }
                backends.add(new BackendConfig(host, intValue(node, "heartbeatPort", 0, source)));
            }
        }

        return new DorisConfig(connection, frontend, backends);
    }

    private static ConnectionConfig parseConnection(JsonNode doris, String source) {
        try {
            return ConnectionConfig.builder()
                    .host(text(doris, "host", ConnectionConfig.DEFAULT_HOST))
                    .port(intValue(doris, "port", ConnectionConfig.DEFAULT_PORT, source))
                    .user(text(doris, "user", ConnectionConfig.DEFAULT_USER))
                    .password(text(doris, "password", ConnectionConfig.DEFAULT_PASSWORD))
                    .database(text(doris, "database", null))
                    .timeoutMillis(
                            intValue(
                                    doris,
                                    "timeout",
                                    ConnectionConfig.DEFAULT_TIMEOUT_MILLIS,
                                    source))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new DorisConfigException(
                    "Invalid connection settings in " + source + ": " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asText();
    }

    private static int intValue(JsonNode node, String field, int defaultValue, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new DorisConfigException(
                    "Invalid value for '" + field + "' in " + source + ": " + value.asText(), e);
        }
    }
}
