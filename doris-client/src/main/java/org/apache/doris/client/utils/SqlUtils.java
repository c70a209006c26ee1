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

package org.apache.doris.client.utils;

import org.apache.doris.client.exception.DorisValidationException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Helpers for building statement text from caller supplied names. */
public final class SqlUtils {

    private static final Pattern QUERY_ID_PATTERN = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final Pattern HOST_PATTERN = Pattern.compile("[A-Za-z0-9.\\-:\\[\\]]+");

    private SqlUtils() {}

    /**
     * Quotes an identifier with backticks, doubling any embedded backtick.
     *
     * @throws DorisValidationException if {@code name} is null or blank
     */
    public static String quoteIdentifier(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new DorisValidationException("Identifier must not be empty");
        }
        return "`" + name.replace("`", "``") + "`";
    }

    /** Returns {@code `database`.`table`}. */
    public static String qualifiedName(String database, String table) {
        return quoteIdentifier(database) + "." + quoteIdentifier(table);
    }

    /** Returns the quoted identifiers joined by {@code ", "}. */
    public static String quoteIdentifiers(List<String> names) {
        return names.stream().map(SqlUtils::quoteIdentifier).collect(Collectors.joining(", "));
    }

    /** Returns {@code n} comma separated {@code ?} placeholders wrapped in parentheses. */
    public static String placeholders(int n) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('?');
        }
        return sb.append(')').toString();
    }

    public static String checkQueryId(String queryId) {
        if (queryId == null || !QUERY_ID_PATTERN.matcher(queryId).matches()) {
            throw new DorisValidationException("Invalid query id: " + queryId);
        }
        return queryId;
    }

    /** Validates a host/port pair and returns it as {@code host:port}. */
    public static String checkHostPort(String host, int port) {
        if (host == null || !HOST_PATTERN.matcher(host).matches()) {
            throw new DorisValidationException("Invalid host: " + host);
        }
        if (port <= 0 || port > 65535) {
            throw new DorisValidationException("Invalid port: " + port);
        }
        return host + ":" + port;
    }
}
