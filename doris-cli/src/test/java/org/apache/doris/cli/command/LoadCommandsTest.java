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

import org.apache.doris.client.exception.DorisValidationException;
import org.apache.doris.client.load.ExportOptions;
import org.apache.doris.client.load.ExportResult;
import org.apache.doris.client.load.FileFormat;
import org.apache.doris.client.load.ImportOptions;
import org.apache.doris.client.load.LoadSubmission;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** Tests for the import and export commands. */
class LoadCommandsTest extends CommandTestBase {

    @Test
    void testImportPassesOptions() {
        when(client.importFromFile(eq("demo"), eq("users"), eq("/data/users.txt"), any()))
                .thenReturn(
                        new LoadSubmission(
                                "load_1", Collections.emptyList(), "Import job submitted"));

        int exitCode =
                run(
                        "import",
                        "/data/users.txt",
                        "demo",
                        "users",
                        "-f",
                        "json",
                        "-s",
                        "|",
                        "-c",
                        "id,name");

        ArgumentCaptor<ImportOptions> options = ArgumentCaptor.forClass(ImportOptions.class);
        verify(client)
                .importFromFile(
                        eq("demo"), eq("users"), eq("/data/users.txt"), options.capture());
        assertThat(exitCode).isEqualTo(0);
        assertThat(options.getValue().getFormat()).isEqualTo(FileFormat.JSON);
        assertThat(options.getValue().getColumnSeparator()).isEqualTo("|");
        assertThat(options.getValue().getColumns()).containsExactly("id", "name");
        assertThat(out.toString()).contains("✔ Import job submitted: load_1");
    }

    @Test
    void testImportRejectsUnknownFormat() {
        int exitCode = run("import", "/data/users.txt", "demo", "users", "-f", "xlsx");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("✖ Import failed");
        assertThat(err.toString()).contains("xlsx");
        verify(client, never()).importFromFile(any(), any(), any(), any());
    }

    @Test
    void testExportDefaultsToHeaderAndComma() throws Exception {
        Path output = tempDir.resolve("out.csv");
        when(client.exportToFile(eq("SELECT * FROM t"), eq(output), any()))
                .thenReturn(new ExportResult(3, output, "Exported 3 row(s) to " + output));

        run("export", "SELECT * FROM t", output.toString());

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(client).exportToFile(eq("SELECT * FROM t"), eq(output), options.capture());
        assertThat(options.getValue().getSeparator()).isEqualTo(",");
        assertThat(options.getValue().isIncludeHeader()).isTrue();
        assertThat(out.toString()).contains("✔ Exported 3 row(s)");
    }

    @Test
    void testExportWithoutHeader() throws Exception {
        Path output = Paths.get("out.tsv");
        when(client.exportToFile(any(), any(), any()))
                .thenReturn(new ExportResult(0, output, "Exported 0 row(s) to " + output));

        run("export", "SELECT 1", output.toString(), "-s", "\t", "--no-header");

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(client).exportToFile(eq("SELECT 1"), eq(output), options.capture());
        assertThat(options.getValue().getSeparator()).isEqualTo("\t");
        assertThat(options.getValue().isIncludeHeader()).isFalse();
    }

    @Test
    void testExportFailure() throws Exception {
        when(client.exportToFile(any(), any(), any()))
                .thenThrow(new DorisValidationException("bad query"));

        int exitCode = run("export", "SELECT 1", "out.csv");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("✖ Export failed");
        assertThat(err.toString()).contains("Error: bad query");
    }
}
