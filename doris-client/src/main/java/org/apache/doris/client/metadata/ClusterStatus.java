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

package org.apache.doris.client.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Frontend and backend node records as returned by {@code /api/cluster_status}.
 *
 * <p>Node records are passed through untouched; their shape is whatever the HTTP API returns.
 */
public final class ClusterStatus {

    private final List<JsonNode> frontends;
    private final List<JsonNode> backends;
    private final JsonNode raw;

    private ClusterStatus(List<JsonNode> frontends, List<JsonNode> backends, JsonNode raw) {
        this.frontends = Collections.unmodifiableList(frontends);
        this.backends = Collections.unmodifiableList(backends);
        this.raw = raw;
    }

    public static ClusterStatus fromJson(JsonNode body) {
        return new ClusterStatus(
                elements(body.path("frontends")), elements(body.path("backends")), body);
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> nodes = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode node : array) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /** Returns the frontend node records, empty if the response had none. */
    public List<JsonNode> getFrontends() {
        return frontends;
    }

    /** Returns the backend node records, empty if the response had none. */
    public List<JsonNode> getBackends() {
        return backends;
    }

    /** Returns the complete response body. */
    public JsonNode getRaw() {
        return raw;
    }
}
