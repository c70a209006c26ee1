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

import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;

import static org.apache.doris.client.JdbcMocks.resultSet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryResultTest {

    @Test
    void testFromResultSetKeepsColumnOrder() throws SQLException {
        ResultSet resultSet =
                resultSet(
                        Arrays.asList("z", "a", "m"),
                        Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4, null, 6)));

        QueryResult result = QueryResult.fromResultSet(resultSet);

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.getColumnNames()).containsExactly("z", "a", "m");
        assertThat(result.getRows().get(0).keySet()).containsExactly("z", "a", "m");
        assertThat(result.getRows().get(1)).containsEntry("a", null);
        assertThat(result.getFields().get(0).getTypeName()).isEqualTo("VARCHAR");
        assertThat(result.getUpdateCount()).isEqualTo(-1);
    }

    @Test
    void testEmptyResultSetKeepsFields() throws SQLException {
        QueryResult result =
                QueryResult.fromResultSet(
                        resultSet(Collections.singletonList("id"), Collections.emptyList()));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getColumnNames()).containsExactly("id");
    }

    @Test
    void testUpdateCount() {
        QueryResult result = QueryResult.ofUpdateCount(5);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getFields()).isEmpty();
        assertThat(result.getUpdateCount()).isEqualTo(5);
    }

    @Test
    void testRowsAreReadOnly() throws SQLException {
        QueryResult result =
                QueryResult.fromResultSet(
                        resultSet(
                                Collections.singletonList("id"),
                                Collections.singletonList(Collections.singletonList(1))));

        assertThatThrownBy(() -> result.getRows().get(0).put("id", 2))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
