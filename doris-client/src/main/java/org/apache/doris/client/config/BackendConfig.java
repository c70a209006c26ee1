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

package org.apache.doris.client.config;

import java.util.Objects;

/** A backend node listed in {@code config.json}, addressed by its heartbeat port. */
public final class BackendConfig {

    private final String host;
    private final int heartbeatPort;

    public BackendConfig(String host, int heartbeatPort) {
        this.host = Objects.requireNonNull(host, "host");
        this.heartbeatPort = heartbeatPort;
    }

    public String getHost() {
        return host;
    }

    public int getHeartbeatPort() {
        return heartbeatPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BackendConfig that = (BackendConfig) o;
        return heartbeatPort == that.heartbeatPort && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, heartbeatPort);
    }

    @Override
    public String toString() {
        return host + ":" + heartbeatPort;
    }
}
