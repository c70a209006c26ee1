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

import org.apache.doris.cli.DorisCliMain;
import org.apache.doris.cli.repl.TerminalFactory;
import org.apache.doris.cli.session.DorisSession;
import org.apache.doris.client.DorisClient;
import org.apache.doris.client.admin.ClusterManager;
import org.apache.doris.client.config.DorisConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.mockito.Mockito.mock;

/** Runs commands against a mocked client and cluster manager, capturing console output. */
abstract class CommandTestBase {

    @TempDir Path tempDir;

    DorisClient client;
    ClusterManager manager;
    StringWriter out;
    StringWriter err;
    Path configFile;
    List<DorisConfig> openedConfigs;
    TerminalFactory terminalFactory;

    @BeforeEach
    void setUpSession() throws IOException {
        client = mock(DorisClient.class);
        manager = mock(ClusterManager.class);
        out = new StringWriter();
        err = new StringWriter();
        openedConfigs = new ArrayList<>();
        terminalFactory =
                () -> {
                    throw new IOException("No terminal available");
                };
        configFile = tempDir.resolve("config.json");
        Files.write(
                configFile,
                "{\"doris\": {\"host\": \"fe-1\", \"port\": 9030, \"database\": \"demo\"}}"
                        .getBytes(StandardCharsets.UTF_8));
    }

    int run(String... args) {
        List<String> all =
                new ArrayList<>(Arrays.asList("--no-color", "--config", configFile.toString()));
        all.addAll(Arrays.asList(args));
        return runWithoutConfig(all.toArray(new String[0]));
    }

    /** Runs the command line exactly as given, recording every opened session's config. */
    int runWithoutConfig(String... args) {
        DorisCliMain main =
                new DorisCliMain(
                        config -> {
                            openedConfigs.add(config);
                            return new DorisSession(config, client, manager);
                        },
                        terminalFactory,
                        new PrintWriter(out, true),
                        new PrintWriter(err, true));
        return new CommandLine(main).execute(args);
    }
}
