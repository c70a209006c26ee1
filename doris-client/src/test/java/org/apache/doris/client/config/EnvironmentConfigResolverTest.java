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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentConfigResolverTest {

    @TempDir Path tempDir;

    @Test
    void testDefaultsWithoutEnvironment() {
        EnvironmentConfigResolver resolver =
                new EnvironmentConfigResolver(
                        Collections.emptyMap(), tempDir.resolve("mcp.json"));

        assertThat(resolver.resolve()).isEqualTo(ConnectionConfig.defaults());
    }

    @Test
    void testEnvironmentVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("DORIS_HOST", "fe-1");
        env.put("DORIS_PORT", "19030");
        env.put("DORIS_USER", "admin");
        env.put("DORIS_PASSWORD", "pw");

        ConnectionConfig config =
                new EnvironmentConfigResolver(env, tempDir.resolve("mcp.json")).resolve();

        assertThat(config.getHost()).isEqualTo("fe-1");
        assertThat(config.getPort()).isEqualTo(19030);
        assertThat(config.getUser()).isEqualTo("admin");
        assertThat(config.getPassword()).isEqualTo("pw");
    }

    @Test
    void testEnvironmentWinsOverSideFile() throws IOException {
        Path sideFile =
                write(
                        "{\"doris\": {\"env\": {\"DORIS_HOST\": \"side-host\","
                                + " \"DORIS_USER\": \"side-user\"}}}");
        Map<String, String> env = Collections.singletonMap("DORIS_HOST", "env-host");

        ConnectionConfig config = new EnvironmentConfigResolver(env, sideFile).resolve();

        assertThat(config.getHost()).isEqualTo("env-host");
        assertThat(config.getUser()).isEqualTo("side-user");
        assertThat(config.getPort()).isEqualTo(ConnectionConfig.DEFAULT_PORT);
    }

    @Test
    void testSideFilePlaceholdersResolveFromEnvironment() throws IOException {
        Path sideFile =
                write(
                        "{\"doris\": {\"env\": {\"DORIS_PASSWORD\": \"${SECRET}\","
                                + " \"DORIS_HOST\": \"${UNSET_VARIABLE}\"}}}");
        Map<String, String> env = Collections.singletonMap("SECRET", "s3cr3t");

        EnvironmentConfigResolver resolver = new EnvironmentConfigResolver(env, sideFile);

        assertThat(resolver.loadSideFileEnv())
                .containsEntry("DORIS_PASSWORD", "s3cr3t")
                .containsEntry("DORIS_HOST", "");
        ConnectionConfig config = resolver.resolve();
        assertThat(config.getPassword()).isEqualTo("s3cr3t");
        assertThat(config.getHost()).isEqualTo(ConnectionConfig.DEFAULT_HOST);
    }

    @Test
    void testMalformedSideFileIsIgnored() throws IOException {
        Path sideFile = write("not json");

        EnvironmentConfigResolver resolver =
                new EnvironmentConfigResolver(Collections.emptyMap(), sideFile);

        assertThat(resolver.loadSideFileEnv()).isEmpty();
        assertThat(resolver.resolve()).isEqualTo(ConnectionConfig.defaults());
    }

    @Test
    void testInvalidPortFails() {
        EnvironmentConfigResolver resolver =
                new EnvironmentConfigResolver(
                        Collections.singletonMap("DORIS_PORT", "not-a-port"),
                        tempDir.resolve("mcp.json"));

        assertThatThrownBy(resolver::resolve)
                .isInstanceOf(DorisConfigException.class)
                .hasMessageContaining("DORIS_PORT");
    }

    @Test
    void testResolvePlaceholder() {
        EnvironmentConfigResolver resolver =
                new EnvironmentConfigResolver(
                        Collections.singletonMap("NAME", "value"), tempDir.resolve("mcp.json"));

        assertThat(resolver.resolvePlaceholder("${NAME}")).isEqualTo("value");
        assertThat(resolver.resolvePlaceholder("${OTHER}")).isEmpty();
        assertThat(resolver.resolvePlaceholder("plain")).isEqualTo("plain");
    }

    private Path write(String content) throws IOException {
        Path path = tempDir.resolve("mcp.json");
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }
}
