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

package org.apache.doris.cli.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

/** Input of {@link DorisQueryTool}: the statement and an optional database to run it in. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolRequest {

    private final String sql;
    @Nullable private final String database;

    @JsonCreator
    public ToolRequest(
            @JsonProperty("sql") String sql, @JsonProperty("database") @Nullable String database) {
        this.sql = sql;
        this.database = database;
    }

    @JsonProperty("sql")
    public String getSql() {
        return sql;
    }

    @Nullable
    @JsonProperty("database")
    public String getDatabase() {
        return database;
    }
}
