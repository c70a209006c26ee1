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

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Command for listing databases. */
@Command(name = "databases", description = "List all databases")
public class DatabasesCommand extends AbstractDorisCommand {

    @Override
    protected String progressMessage() {
        return "Fetching databases";
    }

    @Override
    protected String failureMessage() {
        return "Failed to fetch databases";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out) {
        List<String> databases = session.getClient().getDatabases();
        status.succeed("Databases fetched");

        List<List<String>> rows = new ArrayList<>(databases.size());
        for (String database : databases) {
            rows.add(Collections.singletonList(database));
        }
        new TableFormatter(Collections.singletonList("Database"), out).printLists(rows);
    }
}
