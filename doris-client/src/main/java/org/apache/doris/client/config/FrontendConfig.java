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

/** Address of the HTTP control-plane endpoint exposed by a frontend node. */
public final class FrontendConfig {

    public static final int DEFAULT_HTTP_PORT = 8030;

    private final String host;
    private final int httpPort;

    public FrontendConfig(String host, int httpPort) {
        this.host = Objects.requireNonNull(host, "host");
        this.httpPort = httpPort;
    }

    public String getHost() {
        return host;
    }

    public int getHttpPort() {
        return httpPort;
    }

    /** Returns the base url, e.g. {@code http://fe-1:8030}. */
    public String toBaseUrl() {
        return "http://" + host + ":" + httpPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FrontendConfig that = (FrontendConfig) o;
        return httpPort == that.httpPort && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, httpPort);
    }

    @Override
    public String toString() {
        return host + ":" + httpPort;
    }
}
