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

package org.apache.doris.client;

import org.apache.doris.client.config.ConnectionConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Opens the JDBC connection used by a {@link DorisClient}. */
@FunctionalInterface
public interface JdbcConnectionFactory {

    Connection open(ConnectionConfig config) throws SQLException;

    /**
     * Opens a MySQL protocol connection with a UTF-8 character set, TLS disabled and the
     * configured connect timeout.
     */
    static JdbcConnectionFactory mysql() {
        return config -> {
            Properties properties = new Properties();
            properties.setProperty("user", config.getUser());
            properties.setProperty("password", config.getPassword());
            properties.setProperty("connectTimeout", String.valueOf(config.getTimeoutMillis()));
            properties.setProperty("characterEncoding", "UTF-8");
            properties.setProperty("sslMode", "DISABLED");
            return DriverManager.getConnection(config.toJdbcUrl(), properties);
        };
    }
}
