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

import java.util.List;
import java.util.Map;

/** Output of {@link DorisQueryTool}. Exactly one of {@code data} and {@code error} is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolResult {

    private final boolean success;
    @Nullable private final List<Map<String, Object>> data;
    @Nullable private final String error;
    private final String message;

    @JsonCreator
    public ToolResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("data") @Nullable List<Map<String, Object>> data,
            @JsonProperty("error") @Nullable String error,
            @JsonProperty("message") String message) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.message = message;
    }

    public static ToolResult success(List<Map<String, Object>> rows) {
        return new ToolResult(
                true, rows, null, "Query succeeded, returned " + rows.size() + " row(s)");
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, "Query failed: " + error);
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @Nullable
    @JsonProperty("data")
    public List<Map<String, Object>> getData() {
        return data;
    }

    @Nullable
    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }
}
