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
import org.apache.doris.cli.format.TableFormatter;
import org.apache.doris.cli.session.DorisSession;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Command for showing the columns of a table. */
@Command(name = "schema", description = "Show the schema of a table")
public class SchemaCommand extends AbstractDorisCommand {

    static final List<String> SCHEMA_COLUMNS =
            Arrays.asList("Field", "Type", "Null", "Key", "Default", "Extra");

    @Parameters(index = "0", description = "Database name")
    private String database;

    @Parameters(index = "1", description = "Table name")
    private String table;

    @Override
    protected String progressMessage() {
        return "Fetching schema of " + database + "." + table;
    }

    @Override
    protected String failureMessage() {
        return "Failed to fetch schema of " + database + "." + table;
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out) {
        List<Map<String, Object>> schema = session.getClient().getTableSchema(database, table);
        status.succeed("Schema of " + database + "." + table + " fetched");
        new TableFormatter(SCHEMA_COLUMNS, out).printMaps(schema);
    }
}
