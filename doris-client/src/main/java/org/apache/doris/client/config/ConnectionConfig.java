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

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Immutable SQL connection parameters for a Doris frontend.
 *
 * <p>Instances are created once per command invocation through {@link #builder()} and handed to
 * every component that needs them. Use {@link #withDatabase(String)} to derive a copy that targets
 * a different default database.
 */
public final class ConnectionConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 9030;
    public static final String DEFAULT_USER = "root";
    public static final String DEFAULT_PASSWORD = "";
    public static final int DEFAULT_TIMEOUT_MILLIS = 30000;

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    @Nullable private final String database;
    private final int timeoutMillis;

    private ConnectionConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.password = builder.password;
        this.database = builder.database;
        this.timeoutMillis = builder.timeoutMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a config with all defaults applied. */
    public static ConnectionConfig defaults() {
        return builder().build();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    @Nullable
    public String getDatabase() {
        return database;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    /** Returns a copy of this config whose default database is {@code database}. */
    public ConnectionConfig withDatabase(@Nullable String database) {
        return toBuilder().database(database).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .user(user)
                .password(password)
                .database(database)
                .timeoutMillis(timeoutMillis);
    }

    /** Returns the JDBC url of the MySQL protocol endpoint, without connection properties. */
    public String toJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:mysql://");
        url.append(host).append(':').append(port).append('/');
        if (database != null && !database.isEmpty()) {
            url.append(database);
        }
        return url.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConnectionConfig that = (ConnectionConfig) o;
        return port == that.port
                && timeoutMillis == that.timeoutMillis
                && host.equals(that.host)
                && user.equals(that.user)
                && password.equals(that.password)
                && Objects.equals(database, that.database);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, user, password, database, timeoutMillis);
    }

    @Override
    public String toString() {
        return "ConnectionConfig{"
                + "host='"
                + host
                + '\''
                + ", port="
                + port
                + ", user='"
                + user
                + '\''
                + ", password='"
                + (password.isEmpty() ? "" : "******")
                + '\''
                + ", database='"
                + database
                + '\''
                + ", timeoutMillis="
                + timeoutMillis
                + '}';
    }

    /** Builder for {@link ConnectionConfig}. */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String user = DEFAULT_USER;
        private String password = DEFAULT_PASSWORD;
        @Nullable private String database;
        private int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid port: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = Objects.requireNonNull(user, "user");
            return this;
        }

        public Builder password(@Nullable String password) {
            this.password = password == null ? DEFAULT_PASSWORD : password;
            return this;
        }

        public Builder database(@Nullable String database) {
            this.database = database;
            return this;
        }

        public Builder timeoutMillis(int timeoutMillis) {
            if (timeoutMillis < 0) {
                throw new IllegalArgumentException("Invalid timeout: " + timeoutMillis);
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(this);
        }
    }
}
