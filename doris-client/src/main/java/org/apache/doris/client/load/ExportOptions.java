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

import java.util.Objects;

/** Options for writing query results to a delimited text file. */
public final class ExportOptions {

    public static final String DEFAULT_SEPARATOR = ",";

    private final String separator;
    private final boolean includeHeader;

    public ExportOptions(String separator, boolean includeHeader) {
        this.separator = Objects.requireNonNull(separator, "separator");
        this.includeHeader = includeHeader;
    }

    /** Comma separated, without a header row. */
    public static ExportOptions defaults() {
        return new ExportOptions(DEFAULT_SEPARATOR, false);
    }

    public String getSeparator() {
        return separator;
    }

    public boolean isIncludeHeader() {
        return includeHeader;
    }
}
