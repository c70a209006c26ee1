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

package org.apache.doris.client.load;

import org.apache.doris.client.exception.DorisValidationException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileFormatTest {

    @Test
    void testFromStringIgnoresCase() {
        assertThat(FileFormat.fromString("csv")).isEqualTo(FileFormat.CSV);
        assertThat(FileFormat.fromString("Json")).isEqualTo(FileFormat.JSON);
        assertThat(FileFormat.fromString(" ORC ")).isEqualTo(FileFormat.ORC);
        assertThat(FileFormat.fromString("parquet")).isEqualTo(FileFormat.PARQUET);
    }

    @Test
    void testFromStringRejectsUnknown() {
        assertThatThrownBy(() -> FileFormat.fromString("xlsx"))
                .isInstanceOf(DorisValidationException.class)
                .hasMessageContaining("xlsx");
    }

    @Test
    void testInferFromPath() {
        assertThat(FileFormat.inferFromPath("/data/users.csv")).isEqualTo(FileFormat.CSV);
        assertThat(FileFormat.inferFromPath("/data/USERS.CSV")).isEqualTo(FileFormat.CSV);
        assertThat(FileFormat.inferFromPath("/data/users.json")).isEqualTo(FileFormat.ORC);
        assertThat(FileFormat.inferFromPath("/data/users")).isEqualTo(FileFormat.ORC);
    }

    @Test
    void testImportOptionsDefaults() {
        ImportOptions options = ImportOptions.defaults();

        assertThat(options.getFormat()).isNull();
        assertThat(options.getColumns()).isEmpty();
        assertThat(options.getColumnSeparator()).isNull();
        assertThat(options.getWhere()).isNull();
        assertThat(ExportOptions.defaults().getSeparator()).isEqualTo(",");
        assertThat(ExportOptions.defaults().isIncludeHeader()).isFalse();
    }
}
