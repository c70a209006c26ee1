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
import org.apache.doris.cli.session.DorisSession;
import org.apache.doris.client.load.ExportOptions;
import org.apache.doris.client.load.ExportResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;

/** Command for writing the rows of a query to a file. */
@Command(name = "export", description = "Export query results to a file")
public class ExportCommand extends AbstractDorisCommand {

    @Parameters(index = "0", description = "SQL query")
    private String sql;

    @Parameters(index = "1", description = "Output file")
    private File outputFile;

    @Option(
            names = {"-s", "--separator"},
            description = "Column separator (default: ${DEFAULT-VALUE})",
            defaultValue = ExportOptions.DEFAULT_SEPARATOR)
    private String separator;

    @Option(
            names = {"--no-header"},
            description = "Do not write the header line")
    private boolean noHeader;

    @Override
    protected String progressMessage() {
        return "Exporting data";
    }

    @Override
    protected String failureMessage() {
        return "Export failed";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out)
            throws Exception {
        ExportResult result =
                session.getClient()
                        .exportToFile(
                                sql, outputFile.toPath(), new ExportOptions(separator, !noHeader));
        status.succeed(result.getMessage());
    }
}
