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

package org.apache.doris.cli.command;

import org.apache.doris.client.metadata.ColumnMetadata;
import org.apache.doris.client.metadata.QueryResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Types;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** Tests for the shell and tool commands. */
class ShellAndToolCommandTest extends CommandTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testShellConnectsRunsStatementsAndCloses() throws Exception {
        Terminal terminal = terminal("SHOW DATABASES\n\nexit\n");
        terminalFactory = () -> terminal;
        when(client.query("SHOW DATABASES"))
                .thenReturn(
                        new QueryResult(
                                Collections.singletonList(
                                        Collections.<String, Object>singletonMap(
                                                "Database", "demo")),
                                Collections.singletonList(
                                        new ColumnMetadata("Database", "VARCHAR", Types.VARCHAR))));

        int exitCode = run("shell");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("✔ Connected to root@fe-1:9030/demo")
                .contains("Doris SQL Shell")
                .contains("| demo")
                .contains("1 row(s)")
                .contains("Goodbye!");
        assertThat(err.toString()).isEmpty();

        InOrder order = inOrder(client, manager);
        order.verify(client).connect();
        order.verify(client).query("SHOW DATABASES");
        order.verify(client).disconnect();
        order.verify(manager).close();
        verify(terminal).close();
    }

    @Test
    void testShellEndsOnEndOfInput() throws Exception {
        Terminal terminal = terminal("");
        terminalFactory = () -> terminal;

        run("shell");

        assertThat(out.toString()).contains("Goodbye!");
        verify(client).disconnect();
        verify(terminal).close();
    }

    @Test
    void testShellWithoutTerminalClosesSession() {
        int exitCode = run("shell");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("✖ Shell terminated");
        assertThat(err.toString()).contains("Error: No terminal available");
        verify(client).disconnect();
        verify(manager).close();
    }

    @Test
    void testToolReportsUnreachableServerAsJson() throws Exception {
        Files.write(
                configFile,
                "{\"doris\": {\"host\": \"127.0.0.1\", \"port\": 1, \"timeout\": 2000}}"
                        .getBytes(StandardCharsets.UTF_8));

        int exitCode = run("tool", "{\"sql\": \"SELECT 1\"}");

        assertThat(exitCode).isEqualTo(0);
        JsonNode response = MAPPER.readTree(out.toString().trim());
        assertThat(response.path("success").asBoolean()).isFalse();
        assertThat(response.path("message").asText()).startsWith("Query failed: ");
        assertThat(openedConfigs).isEmpty();
    }

    @Test
    void testToolWithMissingConfigFile() throws Exception {
        Path missing = tempDir.resolve("missing.json");

        runWithoutConfig("--config", missing.toString(), "tool", "{\"sql\": \"SELECT 1\"}");

        JsonNode response = MAPPER.readTree(out.toString().trim());
        assertThat(response.path("success").asBoolean()).isFalse();
        assertThat(response.path("error").asText())
                .startsWith("Failed to load configuration file");
        verify(client, never()).connect();
    }

    @Test
    void testToolRejectsInvalidJson() throws Exception {
        run("tool", "{not json");

        JsonNode response = MAPPER.readTree(out.toString().trim());
        assertThat(response.path("success").asBoolean()).isFalse();
        assertThat(response.path("error").asText()).startsWith("Invalid request");
    }

    private static Terminal terminal(String input) throws Exception {
        return spy(
                new DumbTerminal(
                        new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                        new ByteArrayOutputStream()));
    }
}
