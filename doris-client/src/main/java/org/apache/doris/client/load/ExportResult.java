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

import java.nio.file.Path;

/** Outcome of exporting a query result to a file. */
public final class ExportResult {

    private final int rowCount;
    private final Path file;
    private final String message;

    public ExportResult(int rowCount, Path file, String message) {
        this.rowCount = rowCount;
        this.file = file;
        this.message = message;
    }

    public int getRowCount() {
        return rowCount;
    }

    public Path getFile() {
        return file;
    }

    public String getMessage() {
        return message;
    }
}
