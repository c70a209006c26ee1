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

package org.apache.doris.cli.session;

import org.apache.doris.client.DorisClient;
import org.apache.doris.client.admin.ClusterManager;
import org.apache.doris.client.config.DorisConfig;

/**
 * The database client and cluster manager used by a single command invocation. Closing the
 * session disconnects both.
 */
public class DorisSession implements AutoCloseable {

    private final DorisConfig config;
    private final DorisClient client;
    private final ClusterManager manager;

    public DorisSession(DorisConfig config, DorisClient client, ClusterManager manager) {
        this.config = config;
        this.client = client;
        this.manager = manager;
    }

    public static DorisSession open(DorisConfig config) {
        return new DorisSession(
                config, new DorisClient(config.getConnection()), new ClusterManager(config));
    }

    public DorisConfig getConfig() {
        return config;
    }

    public DorisClient getClient() {
        return client;
    }

    public ClusterManager getManager() {
        return manager;
    }

    @Override
    public void close() {
        try {
            client.disconnect();
        } finally {
            manager.close();
        }
    }
}
