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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;

/** Stateless helpers that render sizes, timestamps and progress for console output. */
public final class FormatUtils {

    private static final String[] SIZE_UNITS = {
        "Bytes", "KB", "MB", "GB", "TB", "PB", "EB", "ZB", "YB"
    };

    private static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private static final int DEFAULT_PROGRESS_WIDTH = 30;

    private FormatUtils() {}

    public static String formatBytes(long bytes) {
        return formatBytes(bytes, 2);
    }

    /**
     * Formats a byte count with base-1024 units, e.g. {@code formatBytes(1536, 1)} returns {@code
     * "1.5 KB"}. Trailing zeros of the fraction are dropped.
     */
    public static String formatBytes(long bytes, int decimals) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Byte count must not be negative: " + bytes);
        }
        if (bytes == 0) {
            return "0 Bytes";
        }
        int unit = 0;
        long scaled = bytes;
        while (scaled >= 1024 && unit < SIZE_UNITS.length - 1) {
            scaled /= 1024;
            unit++;
        }
        BigDecimal value =
                BigDecimal.valueOf(bytes)
                        .divide(
                                BigDecimal.valueOf(1024).pow(unit),
                                Math.max(decimals, 0),
                                RoundingMode.HALF_UP)
                        .stripTrailingZeros();
        return value.toPlainString() + " " + SIZE_UNITS[unit];
    }

    /** Formats a timestamp as {@code yyyy/MM/dd HH:mm:ss} in the system time zone. */
    public static String formatDateTime(Object value) {
        return formatDateTime(value, ZoneId.systemDefault());
    }

    public static String formatDateTime(Object value, ZoneId zone) {
        return DATE_TIME_FORMATTER.format(toZonedDateTime(value, zone));
    }

    /** Formats a timestamp with the medium localized style of {@code locale}. */
    public static String formatDateTime(Object value, Locale locale, ZoneId zone) {
        return DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
                .withLocale(locale)
                .format(toZonedDateTime(value, zone));
    }

    private static ZonedDateTime toZonedDateTime(Object value, ZoneId zone) {
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(zone);
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(zone);
        } else if (value instanceof Instant) {
            return ((Instant) value).atZone(zone);
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone);
        } else if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone);
        } else if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay(zone);
        } else if (value instanceof Date) {
            return Instant.ofEpochMilli(((Date) value).getTime()).atZone(zone);
        } else if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue()).atZone(zone);
        } else if (value instanceof CharSequence) {
            return parse(value.toString(), zone);
        }
        throw new IllegalArgumentException("Unsupported date value: " + value);
    }

    private static ZonedDateTime parse(String text, ZoneId zone) {
        String trimmed = text.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(zone);
            }
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(
                            trimmed.replace(' ', 'T'), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).withZoneSameInstant(zone);
            }
            return ((LocalDateTime) parsed).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported date value: " + text, e);
        }
    }

    public static String progressBar(long current, long total) {
        return progressBar(current, total, DEFAULT_PROGRESS_WIDTH);
    }

    /** Renders e.g. {@code [===============>               ] 50% (5/10)}. */
    public static String progressBar(long current, long total, int width) {
        if (total <= 0) {
            throw new IllegalArgumentException("Total must be positive: " + total);
        }
        double ratio = (double) current / total;
        long percentage = Math.round(ratio * 100);
        int completed = (int) Math.max(0, Math.min(width, Math.round(ratio * width)));
        return "["
                + repeat('=', completed)
                + ">"
                + repeat(' ', width - completed)
                + "] "
                + percentage
                + "% ("
                + current
                + "/"
                + total
                + ")";
    }

    /** Renders a cell value for display; {@code null} becomes the empty string. */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
