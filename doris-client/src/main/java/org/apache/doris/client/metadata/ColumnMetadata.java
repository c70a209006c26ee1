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

import java.util.Objects;

/** Name and type of a result column as reported by the JDBC driver. */
public final class ColumnMetadata {

    private final String name;
    private final String typeName;
    private final int jdbcType;

    public ColumnMetadata(String name, String typeName, int jdbcType) {
        this.name = name;
        this.typeName = typeName;
        this.jdbcType = jdbcType;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    /** Returns the {@link java.sql.Types} code of the column. */
    public int getJdbcType() {
        return jdbcType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnMetadata that = (ColumnMetadata) o;
        return jdbcType == that.jdbcType
                && name.equals(that.name)
                && Objects.equals(typeName, that.typeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeName, jdbcType);
    }

    @Override
    public String toString() {
        return name + " " + typeName;
    }
}
