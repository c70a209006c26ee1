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

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options of a file-based bulk load. Every option is optional; the format is inferred from the
 * file extension when not set.
 */
public final class ImportOptions {

    @Nullable private final FileFormat format;
    private final List<String> columns;
    @Nullable private final String columnSeparator;
    @Nullable private final String where;

    private ImportOptions(Builder builder) {
        this.format = builder.format;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.columnSeparator = builder.columnSeparator;
        this.where = builder.where;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    @Nullable
    public FileFormat getFormat() {
        return format;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Nullable
    public String getColumnSeparator() {
        return columnSeparator;
    }

    /** Returns the row filter predicate, used verbatim as the load's WHERE clause. */
    @Nullable
    public String getWhere() {
        return where;
    }

    /** Builder for {@link ImportOptions}. */
    public static final class Builder {
        @Nullable private FileFormat format;
        private final List<String> columns = new ArrayList<>();
        @Nullable private String columnSeparator;
        @Nullable private String where;

        private Builder() {}

        public Builder format(@Nullable FileFormat format) {
            this.format = format;
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns.clear();
            this.columns.addAll(columns);
            return this;
        }

        public Builder columnSeparator(@Nullable String columnSeparator) {
            this.columnSeparator = columnSeparator;
            return this;
        }

        public Builder where(@Nullable String where) {
            this.where = where;
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }
}
