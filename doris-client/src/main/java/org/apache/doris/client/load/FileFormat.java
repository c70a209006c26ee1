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

package org.apache.doris.client.load;

import org.apache.doris.client.exception.DorisValidationException;

import java.util.Locale;

/** File formats accepted by a bulk-load statement. */
public enum FileFormat {
    CSV,
    JSON,
    ORC,
    PARQUET;

    public static FileFormat fromString(String format) {
        if (format == null) {
            throw new DorisValidationException("File format must not be null");
        }
        switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "csv":
                return CSV;
            case "json":
                return JSON;
            case "orc":
                return ORC;
            case "parquet":
                return PARQUET;
            default:
                throw new DorisValidationException(
                        "Invalid file format: "
                                + format
                                + ". Valid options: csv, json, orc, parquet");
        }
    }

    /** Infers the format from the file extension: {@code .csv} is CSV, anything else ORC. */
    public static FileFormat inferFromPath(String filePath) {
        return filePath.toLowerCase(Locale.ROOT).endsWith(".csv") ? CSV : ORC;
    }
}
