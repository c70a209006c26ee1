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
import org.apache.doris.cli.sql.QueryExecutor;
import org.apache.doris.client.metadata.QueryResult;
import org.apache.doris.client.utils.CsvUtils;
import org.apache.doris.client.utils.IoUtils;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;

/** Command for executing a single SQL statement. */
@Command(name = "query", description = "Execute a SQL query")
public class QueryCommand extends AbstractDorisCommand {

    @Parameters(index = "0", description = "SQL statement to execute")
    private String sql;

    @Option(
            names = {"-o", "--output"},
            description = "Also save the rows to this file as CSV")
    private File outputFile;

    @Override
    protected String progressMessage() {
        return "Executing query";
    }

    @Override
    protected String failureMessage() {
        return "Query failed";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out)
            throws Exception {
        QueryExecutor executor = new QueryExecutor(session.getClient(), out);
        QueryResult result = executor.execute(sql);
        status.succeed("Query completed");
        executor.print(result);

        if (outputFile != null && !result.isEmpty()) {
            IoUtils.writeOutputFile(outputFile.toPath(), CsvUtils.exportToCsv(result.getRows()));
            out.println("Results saved to " + outputFile);
            out.flush();
        }
    }
}
