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

package org.apache.doris.cli;

import org.apache.doris.cli.command.DatabasesCommand;
import org.apache.doris.cli.command.ExportCommand;
import org.apache.doris.cli.command.ImportCommand;
import org.apache.doris.cli.command.ProcesslistCommand;
import org.apache.doris.cli.command.QueryCommand;
import org.apache.doris.cli.command.SchemaCommand;
import org.apache.doris.cli.command.ShellCommand;
import org.apache.doris.cli.command.StatusCommand;
import org.apache.doris.cli.command.TablesCommand;
import org.apache.doris.cli.command.ToolCommand;
import org.apache.doris.cli.format.StatusLine;
import org.apache.doris.cli.repl.TerminalFactory;
import org.apache.doris.cli.session.DorisSession;
import org.apache.doris.cli.session.SessionFactory;
import org.apache.doris.client.config.ConfigLoader;
import org.apache.doris.client.config.DorisConfig;

import org.jline.terminal.Terminal;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/** Main entry point for the Doris CLI tool. */
@Command(
        name = "doris-cli",
        description = "Doris Command Line Interface",
        mixinStandardHelpOptions = true,
        version = "Doris CLI 1.0.0",
        subcommands = {
            QueryCommand.class,
            StatusCommand.class,
            DatabasesCommand.class,
            TablesCommand.class,
            SchemaCommand.class,
            ProcesslistCommand.class,
            ImportCommand.class,
            ExportCommand.class,
            ShellCommand.class,
            ToolCommand.class,
            HelpCommand.class
        })
public class DorisCliMain {

    @Option(
            names = {"--config"},
            description =
                    "Configuration file (default: ./config.json, "
                            + "or the environment when ./config.json does not exist)")
    private File configFile;

    @Option(
            names = {"--no-color"},
            description = "Print status lines without ANSI colors")
    private boolean noColor;

    private final SessionFactory sessionFactory;
    private final TerminalFactory terminalFactory;
    private final PrintWriter out;
    private final PrintWriter err;

    public DorisCliMain() {
        this(
                DorisSession::open,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    public DorisCliMain(SessionFactory sessionFactory, PrintWriter out, PrintWriter err) {
        this(sessionFactory, TerminalFactory.system(), out, err);
    }

    public DorisCliMain(
            SessionFactory sessionFactory,
            TerminalFactory terminalFactory,
            PrintWriter out,
            PrintWriter err) {
        this.sessionFactory = sessionFactory;
        this.terminalFactory = terminalFactory;
        this.out = out;
        this.err = err;
    }

    /**
     * Reads the file given with {@code --config}, which must exist. Without the option {@code
     * ./config.json} is read when present, otherwise the connection comes from the environment.
     */
    public DorisConfig resolveConfig() {
        if (configFile != null) {
            return ConfigLoader.load(configFile.toPath());
        }
        return ConfigLoader.loadOrResolve(Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE));
    }

    public DorisSession openSession() {
        return sessionFactory.open(resolveConfig());
    }

    public Terminal openTerminal() throws IOException {
        return terminalFactory.open();
    }

    public StatusLine newStatusLine() {
        return new StatusLine(out, !noColor);
    }

    public PrintWriter getOut() {
        return out;
    }

    public PrintWriter getErr() {
        return err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DorisCliMain()).execute(args);
        System.exit(exitCode);
    }
}
