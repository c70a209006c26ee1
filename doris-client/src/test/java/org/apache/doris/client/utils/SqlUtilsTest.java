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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlUtilsTest {

    @Test
    void testQuoteIdentifier() {
        assertThat(SqlUtils.quoteIdentifier("orders")).isEqualTo("`orders`");
        assertThat(SqlUtils.quoteIdentifier("a`b")).isEqualTo("`a``b`");
        assertThat(SqlUtils.qualifiedName("db", "t")).isEqualTo("`db`.`t`");
        assertThat(SqlUtils.quoteIdentifiers(Arrays.asList("a", "b"))).isEqualTo("`a`, `b`");
    }

    @Test
    void testBlankIdentifierRejected() {
        assertThatThrownBy(() -> SqlUtils.quoteIdentifier(" "))
                .isInstanceOf(DorisValidationException.class);
        assertThatThrownBy(() -> SqlUtils.quoteIdentifier(null))
                .isInstanceOf(DorisValidationException.class);
    }

    @Test
    void testPlaceholders() {
        assertThat(SqlUtils.placeholders(1)).isEqualTo("(?)");
        assertThat(SqlUtils.placeholders(3)).isEqualTo("(?, ?, ?)");
    }

    @Test
    void testCheckQueryId() {
        assertThat(SqlUtils.checkQueryId("a1b2-c3_d4")).isEqualTo("a1b2-c3_d4");
        assertThatThrownBy(() -> SqlUtils.checkQueryId("1; DROP DATABASE demo"))
                .isInstanceOf(DorisValidationException.class);
        assertThatThrownBy(() -> SqlUtils.checkQueryId(""))
                .isInstanceOf(DorisValidationException.class);
    }

    @Test
    void testCheckHostPort() {
        assertThat(SqlUtils.checkHostPort("be-1.example.com", 9050))
                .isEqualTo("be-1.example.com:9050");
        assertThatThrownBy(() -> SqlUtils.checkHostPort("be-1'; --", 9050))
                .isInstanceOf(DorisValidationException.class);
        assertThatThrownBy(() -> SqlUtils.checkHostPort("be-1", 0))
                .isInstanceOf(DorisValidationException.class);
        assertThatThrownBy(() -> SqlUtils.checkHostPort("be-1", 70000))
                .isInstanceOf(DorisValidationException.class);
    }
}
