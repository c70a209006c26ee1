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

package org.apache.doris.cli.format;

import org.apache.doris.client.utils.FormatUtils;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Formats rows as ASCII tables. */
public class TableFormatter {

    private static final int MIN_COLUMN_WIDTH = 4;

    private final List<String> columnNames;
    private final PrintWriter out;

    public TableFormatter(List<String> columnNames, PrintWriter out) {
        this.columnNames = columnNames;
        this.out = out;
    }

    /** Returns the keys of the first row, or an empty list. */
    public static List<String> columnsOf(List<? extends Map<String, ?>> rows) {
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(rows.get(0).keySet());
    }

    /** Prints rows whose values are looked up by column name. Missing values print empty. */
    public void printMaps(List<? extends Map<String, ?>> rows) {
        List<String[]> values = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            String[] cells = new String[columnNames.size()];
            for (int i = 0; i < columnNames.size(); i++) {
                cells[i] = FormatUtils.stringify(row.get(columnNames.get(i)));
            }
            values.add(cells);
        }
        print(values);
    }

    /** Prints rows given positionally. Cells beyond the header are ignored. */
    public void printLists(List<? extends List<?>> rows) {
        List<String[]> values = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            String[] cells = new String[columnNames.size()];
            for (int i = 0; i < columnNames.size(); i++) {
                cells[i] = i < row.size() ? FormatUtils.stringify(row.get(i)) : "";
            }
            values.add(cells);
        }
        print(values);
    }

    private void print(List<String[]> rows) {
        List<Integer> columnWidths = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            columnWidths.add(Math.max(name.length(), MIN_COLUMN_WIDTH));
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                columnWidths.set(i, Math.max(columnWidths.get(i), row[i].length()));
            }
        }

        printSeparator(columnWidths);
        printRow(columnNames.toArray(new String[0]), columnWidths);
        printSeparator(columnWidths);
        for (String[] row : rows) {
            printRow(row, columnWidths);
        }
        printSeparator(columnWidths);
        out.println(rows.size() + " row(s)");
        out.flush();
    }

    private void printRow(String[] values, List<Integer> columnWidths) {
        out.print("|");
        for (int i = 0; i < values.length; i++) {
            out.print(" ");
            out.print(padRight(values[i], columnWidths.get(i)));
            out.print(" |");
        }
        out.println();
    }

    private void printSeparator(List<Integer> columnWidths) {
        out.print("+");
        for (int width : columnWidths) {
            out.print(repeat("-", width + 2));
            out.print("+");
        }
        out.println();
    }

    private static String padRight(String s, int n) {
        return s + repeat(" ", n - s.length());
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
