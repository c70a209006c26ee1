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

package org.apache.doris.cli.format;

import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class StatusLineTest {

    @Test
    void testPlainStatusLines() {
        StringWriter sw = new StringWriter();
        StatusLine status = new StatusLine(new PrintWriter(sw), false);

        status.start("Executing query");
        status.succeed("Query completed");
        status.fail("Query failed");

        assertThat(sw.toString().split("\\R"))
                .containsExactly("- Executing query...", "✔ Query completed", "✖ Query failed");
    }

    @Test
    void testColoredStatusLineKeepsMessage() {
        StringWriter sw = new StringWriter();
        StatusLine status = new StatusLine(new PrintWriter(sw), true);

        status.succeed("Query completed");

        assertThat(sw.toString()).contains("\u001B[").contains("✔").contains(" Query completed");
    }
}
