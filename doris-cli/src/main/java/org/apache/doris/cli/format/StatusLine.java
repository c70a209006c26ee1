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

import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

import java.io.PrintWriter;

/** Prints the progress, success and failure lines of a command. */
public class StatusLine {

    static final String PROGRESS_SYMBOL = "-";
    static final String SUCCESS_SYMBOL = "✔";
    static final String FAILURE_SYMBOL = "✖";

    private final PrintWriter out;
    private final boolean color;

    public StatusLine(PrintWriter out, boolean color) {
        this.out = out;
        this.color = color;
    }

    public void start(String message) {
        print(
                PROGRESS_SYMBOL,
                AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN),
                message + "...");
    }

    public void succeed(String message) {
        print(SUCCESS_SYMBOL, AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN), message);
    }

    public void fail(String message) {
        print(FAILURE_SYMBOL, AttributedStyle.DEFAULT.foreground(AttributedStyle.RED), message);
    }

    /** Prints a highlighted section title. */
    public void title(String title) {
        if (color) {
            out.println(
                    new AttributedStringBuilder()
                            .styled(AttributedStyle.BOLD.foreground(AttributedStyle.BLUE), title)
                            .toAnsi());
        } else {
            out.println(title);
        }
        out.flush();
    }

    private void print(String symbol, AttributedStyle style, String message) {
        if (color) {
            out.println(
                    new AttributedStringBuilder()
                            .styled(style, symbol)
                            .append(' ')
                            .append(message)
                            .toAnsi());
        } else {
            out.println(symbol + " " + message);
        }
        out.flush();
    }
}
