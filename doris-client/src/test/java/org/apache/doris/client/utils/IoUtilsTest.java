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

package org.apache.doris.client.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IoUtilsTest {

    @Test
    void testWriteCreatesParentDirectories(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("nested/dir/out.csv");

        IoUtils.writeOutputFile(file, "a,b\n1,2\n");

        assertThat(IoUtils.readInputFile(file)).isEqualTo("a,b\n1,2\n");
    }

    @Test
    void testWriteOverwrites(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("out.txt");

        IoUtils.writeOutputFile(file, "first version");
        IoUtils.writeOutputFile(file, "second");

        assertThat(IoUtils.readInputFile(file)).isEqualTo("second");
    }

    @Test
    void testReadMissingFileFails(@TempDir Path tempDir) {
        assertThatThrownBy(() -> IoUtils.readInputFile(tempDir.resolve("missing.txt")))
                .isInstanceOf(IOException.class);
    }
}
