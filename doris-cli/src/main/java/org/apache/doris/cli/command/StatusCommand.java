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
import org.apache.doris.client.metadata.ClusterStatus;

import com.fasterxml.jackson.databind.JsonNode;

import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Command for showing the frontend and backend nodes of the cluster. */
@Command(name = "status", description = "Show cluster status")
public class StatusCommand extends AbstractDorisCommand {

    static final List<String> FRONTEND_COLUMNS =
            Arrays.asList("Name", "Host", "Role", "Status", "Version");
    static final List<String> BACKEND_COLUMNS =
            Arrays.asList(
                    "ID", "Host", "Status", "Data Dirs", "Total Capacity", "Available Capacity");

    @Override
    protected String progressMessage() {
        return "Fetching cluster status";
    }

    @Override
    protected String failureMessage() {
        return "Failed to fetch cluster status";
    }

    @Override
    protected void execute(DorisSession session, StatusLine status, PrintWriter out) {
        ClusterStatus clusterStatus = session.getManager().getClusterStatus();
        status.succeed("Cluster status fetched");

        if (!clusterStatus.getFrontends().isEmpty()) {
            out.println();
            status.title("Frontends:");
            List<List<String>> rows = new ArrayList<>();
            for (JsonNode fe : clusterStatus.getFrontends()) {
                rows.add(
                        Arrays.asList(
                                text(fe, "name"),
                                text(fe, "host") + ":" + text(fe, "edit_log_port"),
                                text(fe, "role"),
                                aliveText(fe),
                                orDash(text(fe, "version"))));
            }
            new TableFormatter(FRONTEND_COLUMNS, out).printLists(rows);
        }

        if (!clusterStatus.getBackends().isEmpty()) {
            out.println();
            status.title("Backends:");
            List<List<String>> rows = new ArrayList<>();
            for (JsonNode be : clusterStatus.getBackends()) {
                rows.add(
                        Arrays.asList(
                                text(be, "be_id"),
                                text(be, "host") + ":" + text(be, "heartbeat_port"),
                                aliveText(be),
                                orDash(text(be, "data_dir_count")),
                                orDash(text(be, "total_capacity")),
                                orDash(text(be, "available_capacity"))));
            }
            new TableFormatter(BACKEND_COLUMNS, out).printLists(rows);
        }
        out.flush();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static String aliveText(JsonNode node) {
        return node.path("alive").asBoolean(false) ? "Online" : "Offline";
    }

    private static String orDash(String value) {
        return value.isEmpty() ? "-" : value;
    }
}
