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

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows and column metadata returned by a statement.
 *
 * <p>Each row maps column label to the value returned natively by the driver, in column order.
 * Statements that produce no result set (DDL, DML, load submissions) carry an empty row list and
 * the driver's update count.
 */
public final class QueryResult {

    private final List<Map<String, Object>> rows;
    private final List<ColumnMetadata> fields;
    private final long updateCount;

    public QueryResult(List<Map<String, Object>> rows, List<ColumnMetadata> fields) {
        this(rows, fields, -1);
    }

    private QueryResult(
            List<Map<String, Object>> rows, List<ColumnMetadata> fields, long updateCount) {
        this.rows = Collections.unmodifiableList(rows);
        this.fields = Collections.unmodifiableList(fields);
        this.updateCount = updateCount;
    }

    /** Drains the given result set. The caller keeps ownership of {@code resultSet}. */
    public static QueryResult fromResultSet(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<ColumnMetadata> fields = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            fields.add(
                    new ColumnMetadata(
                            metaData.getColumnLabel(i),
                            metaData.getColumnTypeName(i),
                            metaData.getColumnType(i)));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(fields.get(i - 1).getName(), resultSet.getObject(i));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new QueryResult(rows, fields);
    }

    public static QueryResult ofUpdateCount(long updateCount) {
        return new QueryResult(Collections.emptyList(), Collections.emptyList(), updateCount);
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public List<ColumnMetadata> getFields() {
        return fields;
    }

    /** Returns the number of affected rows, or -1 if the statement produced a result set. */
    public long getUpdateCount() {
        return updateCount;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /** Returns the column labels, in order. */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (ColumnMetadata field : fields) {
            names.add(field.getName());
        }
        return names;
    }
}
