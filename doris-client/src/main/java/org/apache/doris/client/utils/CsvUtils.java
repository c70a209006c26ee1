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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV encoding of query rows. Cells containing the delimiter, a double quote or a line break are
 * wrapped in double quotes with embedded quotes doubled.
 */
public final class CsvUtils {

    public static final String DEFAULT_DELIMITER = ",";

    private CsvUtils() {}

    public static String exportToCsv(List<Map<String, Object>> rows) {
        return exportToCsv(rows, DEFAULT_DELIMITER);
    }

    /**
     * Writes a header line with the keys of the first row followed by one line per row. Returns
     * the empty string for an empty row list.
     */
    public static String exportToCsv(List<Map<String, Object>> rows, String delimiter) {
        if (rows == null || rows.isEmpty()) {
            return "";
        }
        List<String> headers = new ArrayList<>(rows.get(0).keySet());
        StringBuilder csv = new StringBuilder();
        appendLine(csv, headers, delimiter);
        for (Map<String, Object> row : rows) {
            List<String> cells = new ArrayList<>(headers.size());
            for (String header : headers) {
                cells.add(FormatUtils.stringify(row.get(header)));
            }
            appendLine(csv, cells, delimiter);
        }
        return csv.toString();
    }

    private static void appendLine(StringBuilder csv, List<String> cells, String delimiter) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                csv.append(delimiter);
            }
            csv.append(escape(cells.get(i), delimiter));
        }
        csv.append('\n');
    }

    public static String escape(String cell, String delimiter) {
        if (cell.contains(delimiter)
                || cell.indexOf('"') >= 0
                || cell.indexOf('\n') >= 0
                || cell.indexOf('\r') >= 0) {
            return '"' + cell.replace("\"", "\"\"") + '"';
        }
        return cell;
    }

    public static List<List<String>> parseCsv(String text) {
        return parseCsv(text, DEFAULT_DELIMITER);
    }

    /**
     * Splits CSV text into records of cells, honoring quoted cells. A trailing line break does not
     * produce an extra empty record.
     */
    public static List<List<String>> parseCsv(String text, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean pending = false;

        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < n && text.charAt(i + 1) == '"') {
                        cell.append('"');
                        i += 2;
                    } else {
                        inQuotes = false;
                        i++;
                    }
                } else {
                    cell.append(c);
                    i++;
                }
            } else if (c == '"' && cell.length() == 0) {
                inQuotes = true;
                pending = true;
                i++;
            } else if (text.startsWith(delimiter, i)) {
                record.add(cell.toString());
                cell.setLength(0);
                pending = true;
                i += delimiter.length();
            } else if (c == '\n' || c == '\r') {
                record.add(cell.toString());
                records.add(record);
                record = new ArrayList<>();
                cell.setLength(0);
                pending = false;
                if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') {
                    i++;
                }
                i++;
            } else {
                cell.append(c);
                pending = true;
                i++;
            }
        }
        if (pending) {
            record.add(cell.toString());
            records.add(record);
        }
        return records;
    }
}
