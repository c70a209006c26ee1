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

import org.apache.doris.cli.DorisCliMain;
import org.apache.doris.cli.tool.DorisQueryTool;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/** Command that runs a JSON query request and prints the JSON result. */
@Command(
        name = "tool",
        description =
                "Run a query request given as JSON, e.g. "
                        + "'{\"sql\": \"SHOW DATABASES\", \"database\": \"demo\"}'")
public class ToolCommand implements Callable<Integer> {

    @ParentCommand private DorisCliMain main;

    @Parameters(index = "0", description = "Request JSON with fields sql and database")
    private String request;

    @Override
    public Integer call() {
        DorisQueryTool tool = new DorisQueryTool(() -> main.resolveConfig().getConnection());
        PrintWriter out = main.getOut();
        out.println(tool.execute(request));
        out.flush();
        return 0;
    }
}
