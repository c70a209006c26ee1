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
import org.apache.doris.client.load.FileFormat;
import org.apache.doris.client.load.ImportOptions;
import org.apache.doris.client.load.LoadSubmission;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.List;

/** Command for submitting a file load job. */
@Command(name = "import", description = "Load a file into a table")
public class ImportCommand extends AbstractDorisCommand {

    @Parameters(index = "0", description = "File to load")
    private String file;

    @Parameters(index = "1", description = "Database name")
    private String database;

    @Parameters(index = "2", description = "Table name")
    private String table;

    @Option(
            names = {"-f", "--format"},
            description = "File format: CSV, JSON, ORC, PARQUET (default: from the file name)")
    private String format;

    @Option(
            names = {"-s", "--separator"},
            description = "Column separator")
    private String separator;

    @Option(
            names = {"-c", "--columns"},
            split = ",",
            description = "Comma separated column names")
    private List<String> columns;

    @Override
    protected String progressMessage() {
        return "Importing data into " + database + "." + table;
    }

    @Override
    protected String failureMessage() {
        return "Import failed";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out) {
        ImportOptions.Builder options = ImportOptions.builder().columnSeparator(separator);
        if (format != null) {
            options.format(FileFormat.fromString(format));
        }
        if (columns != null) {
            options.columns(columns);
        }

        LoadSubmission submission =
                session.getClient().importFromFile(database, table, file, options.build());
        status.succeed(submission.getMessage() + ": " + submission.getLabel());
    }
}
