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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal parser for flat argument vectors.
 *
 * <p>Recognizes {@code --key=value}, {@code --key value}, {@code --flag}, {@code -k value} and
 * {@code -f}. A flag that is not followed by a value maps to {@link Boolean#TRUE}; tokens that
 * follow no flag are ignored.
 */
public final class ArgsParser {

    private ArgsParser() {}

    public static Map<String, Object> parseArgs(String... args) {
        return parseArgs(Arrays.asList(args));
    }

    public static Map<String, Object> parseArgs(List<String> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        String currentKey = null;

        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length > 1) {
                    params.put(parts[0], parts[1]);
                    currentKey = null;
                } else {
                    currentKey = parts[0];
                    params.put(currentKey, Boolean.TRUE);
                }
            } else if (arg.startsWith("-")) {
                currentKey = arg.substring(1);
                params.put(currentKey, Boolean.TRUE);
            } else if (currentKey != null) {
                params.put(currentKey, arg);
                currentKey = null;
            }
        }
        return params;
    }
}
