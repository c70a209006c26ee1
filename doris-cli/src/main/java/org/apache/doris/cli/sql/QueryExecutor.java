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

package org.apache.doris.cli.sql;

import org.apache.doris.cli.format.TableFormatter;
import org.apache.doris.client.DorisClient;
import org.apache.doris.client.metadata.QueryResult;

import java.io.PrintWriter;

/** Executes SQL text through a {@link DorisClient} and prints the outcome. */
public class QueryExecutor {

    private final DorisClient client;
    private final PrintWriter out;

    public QueryExecutor(DorisClient client, PrintWriter out) {
        this.client = client;
        this.out = out;
    }

    public QueryResult execute(String sql) {
        return client.query(sql);
    }

    /**
     * Prints a result set as a table, a statement without result set as its affected row count,
     * and an empty result set as a notice.
     */
    public void print(QueryResult result) {
        if (result.getFields().isEmpty() && result.getUpdateCount() >= 0) {
            out.println("Query OK, " + result.getUpdateCount() + " row(s) affected");
        } else if (result.isEmpty()) {
            out.println("Empty set");
        } else {
            new TableFormatter(result.getColumnNames(), out).printMaps(result.getRows());
        }
        out.flush();
    }

    public QueryResult executeAndPrint(String sql) {
        QueryResult result = execute(sql);
        print(result);
        return result;
    }
}
