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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatUtilsTest {

    @Test
    void testFormatBytes() {
        assertThat(FormatUtils.formatBytes(0)).isEqualTo("0 Bytes");
        assertThat(FormatUtils.formatBytes(512)).isEqualTo("512 Bytes");
        assertThat(FormatUtils.formatBytes(1024)).isEqualTo("1 KB");
        assertThat(FormatUtils.formatBytes(1536, 1)).isEqualTo("1.5 KB");
        assertThat(FormatUtils.formatBytes(1024L * 1024 * 1024)).isEqualTo("1 GB");
        assertThat(FormatUtils.formatBytes(1234567, 2)).isEqualTo("1.18 MB");
        assertThat(FormatUtils.formatBytes(1536, 0)).isEqualTo("2 KB");
    }

    @Test
    void testFormatBytesRejectsNegative() {
        assertThatThrownBy(() -> FormatUtils.formatBytes(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFormatDateTime() {
        ZoneId utc = ZoneOffset.UTC;
        Instant instant = Instant.parse("2024-03-05T07:08:09Z");

        assertThat(FormatUtils.formatDateTime(instant, utc)).isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime(instant.toEpochMilli(), utc))
                .isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime(Timestamp.from(instant), utc))
                .isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime(LocalDateTime.of(2024, 3, 5, 7, 8, 9), utc))
                .isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime("2024-03-05 07:08:09", utc))
                .isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime("2024-03-05T08:08:09+01:00", utc))
                .isEqualTo("2024/03/05 07:08:09");
        assertThat(FormatUtils.formatDateTime("2024-03-05", utc))
                .isEqualTo("2024/03/05 00:00:00");
    }

    @Test
    void testFormatDateTimeWithLocale() {
        String formatted =
                FormatUtils.formatDateTime(
                        Instant.parse("2024-03-05T07:08:09Z"), Locale.US, ZoneOffset.UTC);

        assertThat(formatted).contains("2024").contains("Mar");
    }

    @Test
    void testFormatDateTimeRejectsGarbage() {
        assertThatThrownBy(() -> FormatUtils.formatDateTime("yesterday", ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormatUtils.formatDateTime(new Object(), ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testProgressBar() {
        assertThat(FormatUtils.progressBar(5, 10, 10)).isEqualTo("[=====>     ] 50% (5/10)");
        assertThat(FormatUtils.progressBar(0, 4, 4)).isEqualTo("[>    ] 0% (0/4)");
        assertThat(FormatUtils.progressBar(4, 4, 4)).isEqualTo("[====>] 100% (4/4)");
        assertThat(FormatUtils.progressBar(5, 10))
                .startsWith("[===============>")
                .endsWith("] 50% (5/10)");
    }

    @Test
    void testProgressBarRejectsNonPositiveTotal() {
        assertThatThrownBy(() -> FormatUtils.progressBar(1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStringify() {
        assertThat(FormatUtils.stringify(null)).isEmpty();
        assertThat(FormatUtils.stringify(42)).isEqualTo("42");
        assertThat(FormatUtils.stringify("abc".getBytes(StandardCharsets.UTF_8))).isEqualTo("abc");
    }
}
