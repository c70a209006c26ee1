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

import org.apache.doris.cli.format.StatusLine;
import org.apache.doris.cli.repl.ReplShell;
import org.apache.doris.cli.session.DorisSession;
import org.apache.doris.cli.sql.QueryExecutor;
import org.apache.doris.client.config.ConnectionConfig;

import org.jline.terminal.Terminal;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/** Command for starting the interactive SQL shell. */
@Command(name = "shell", description = "Start the interactive SQL shell")
public class ShellCommand extends AbstractDorisCommand {

    @Override
    protected String progressMessage() {
        return "Connecting";
    }

    @Override
    protected String failureMessage() {
        return "Shell terminated";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out)
            throws Exception {
        ConnectionConfig config = session.getConfig().getConnection();
        session.getClient().connect();
        status.succeed(
                "Connected to "
                        + config.getUser()
                        + "@"
                        + config.getHost()
                        + ":"
                        + config.getPort()
                        + (config.getDatabase() != null ? "/" + config.getDatabase() : ""));

        try (Terminal terminal = main.openTerminal()) {
            new ReplShell(
                            new QueryExecutor(session.getClient(), out),
                            ReplShell.lineReader(terminal),
                            out)
                    .run();
        }
    }
}
