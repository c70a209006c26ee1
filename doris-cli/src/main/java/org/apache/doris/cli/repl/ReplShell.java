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

package org.apache.doris.cli.repl;

import org.apache.doris.cli.sql.QueryExecutor;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/** Interactive shell that executes every entered line as SQL. */
public class ReplShell {

    private static final Logger LOG = LoggerFactory.getLogger(ReplShell.class);

    public static final String PROMPT = "doris> ";

    private final QueryExecutor executor;
    private final LineReader reader;
    private final PrintWriter out;

    public ReplShell(QueryExecutor executor, LineReader reader, PrintWriter out) {
        this.executor = executor;
        this.reader = reader;
        this.out = out;
    }

    /** Creates a line reader on {@code terminal}. */
    public static LineReader lineReader(Terminal terminal) {
        return LineReaderBuilder.builder().terminal(terminal).appName("doris-cli").build();
    }

    public void run() {
        out.println("Doris SQL Shell");
        out.println("Type 'exit' or 'quit' to exit, '\\h' for help");
        out.println();
        out.flush();

        while (true) {
            try {
                String line = reader.readLine(PROMPT);

                if (line == null
                        || line.trim().equalsIgnoreCase("exit")
                        || line.trim().equalsIgnoreCase("quit")) {
                    out.println("Goodbye!");
                    out.flush();
                    break;
                }

                String sql = line.trim();
                if (sql.isEmpty()) {
                    continue;
                }

                if (sql.equals("\\h") || sql.equalsIgnoreCase("help")) {
                    printHelp();
                    continue;
                }

                try {
                    executor.executeAndPrint(sql);
                } catch (RuntimeException e) {
                    LOG.debug("Statement failed: {}", sql, e);
                    out.println("Error executing SQL: " + e.getMessage());
                    out.flush();
                }
            } catch (UserInterruptException e) {
                out.println();
                out.println("Interrupted. Type 'exit' to quit.");
                out.flush();
            } catch (EndOfFileException e) {
                out.println("Goodbye!");
                out.flush();
                break;
            }
        }
    }

    private void printHelp() {
        out.println("Doris SQL Shell Commands:");
        out.println("  \\h, help              - Show this help message");
        out.println("  exit, quit            - Exit the shell");
        out.println();
        out.println("Any other input is executed as a single SQL statement, for example:");
        out.println("  SHOW DATABASES");
        out.println("  SELECT * FROM db.table LIMIT 10");
        out.flush();
    }
}
