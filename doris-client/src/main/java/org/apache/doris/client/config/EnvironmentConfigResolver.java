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
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Resolves {@link ConnectionConfig} from environment variables.
 *
 * <p>Precedence, high to low: the process environment ({@code DORIS_HOST}, {@code DORIS_PORT},
 * {@code DORIS_USER}, {@code DORIS_PASSWORD}), the {@code doris.env} section of the optional
 * side-file {@code mcp.json}, then the defaults of {@link ConnectionConfig}. Side-file values of
 * the form {@code ${NAME}} are replaced by the environment variable {@code NAME}, or the empty
 * string when it is unset.
 */
public class EnvironmentConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentConfigResolver.class);

    public static final String SIDE_FILE_NAME = "mcp.json";

    public static final String ENV_HOST = "DORIS_HOST";
    public static final String ENV_PORT = "DORIS_PORT";
    public static final String ENV_USER = "DORIS_USER";
    public static final String ENV_PASSWORD = "DORIS_PASSWORD";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, String> environment;
    private final Path sideFile;

    public EnvironmentConfigResolver() {
        this(System.getenv(), Paths.get(SIDE_FILE_NAME));
    }

    public EnvironmentConfigResolver(Map<String, String> environment, Path sideFile) {
        this.environment = environment;
        this.sideFile = sideFile;
    }

    public ConnectionConfig resolve() {
        Map<String, String> sideFileEnv = loadSideFileEnv();

        ConnectionConfig.Builder builder = ConnectionConfig.builder();
        String host = lookup(ENV_HOST, sideFileEnv);
        if (host != null) {
            builder.host(host);
        }
        String port = lookup(ENV_PORT, sideFileEnv);
        if (port != null) {
            try {
                builder.port(Integer.parseInt(port.trim()));
            } catch (IllegalArgumentException e) {
                throw new DorisConfigException("Invalid " + ENV_PORT + ": " + port, e);
            }
        }
        String user = lookup(ENV_USER, sideFileEnv);
        if (user != null) {
            builder.user(user);
        }
        String password = lookup(ENV_PASSWORD, sideFileEnv);
        if (password != null) {
            builder.password(password);
        }
        return builder.build();
    }

    /**
     * Reads the {@code doris.env} section of the side-file with placeholders resolved. A missing
     * file yields an empty map; an unreadable one is logged and ignored.
     */
    Map<String, String> loadSideFileEnv() {
        if (!Files.exists(sideFile)) {
            return Collections.emptyMap();
        }
        try {
            JsonNode env = MAPPER.readTree(Files.readAllBytes(sideFile)).path("doris").path("env");
            if (!env.isObject()) {
                return Collections.emptyMap();
            }
            Map<String, String> resolved = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = env.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                resolved.put(field.getKey(), resolvePlaceholder(field.getValue().asText()));
            }
            return resolved;
        } catch (IOException e) {
            LOG.warn("Unable to load {}: {}", sideFile, e.getMessage());
            return Collections.emptyMap();
        }
    }

    String resolvePlaceholder(String value) {
        if (value.startsWith("${") && value.endsWith("}")) {
            String name = value.substring(2, value.length() - 1);
            String resolved = environment.get(name);
            return resolved == null ? "" : resolved;
        }
        return value;
    }

    private String lookup(String key, Map<String, String> sideFileEnv) {
        String value = environment.get(key);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        value = sideFileEnv.get(key);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return null;
    }
}
