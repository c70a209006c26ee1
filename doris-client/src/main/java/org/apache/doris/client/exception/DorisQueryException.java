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

package org.apache.doris.client.exception;

import javax.annotation.Nullable;

/** Thrown when the server rejects a statement or it fails while executing. */
public class DorisQueryException extends DorisException {

    private static final long serialVersionUID = 1L;

    @Nullable private final String sqlState;

    public DorisQueryException(String message, @Nullable String sqlState, Throwable cause) {
        super(ErrorKind.QUERY, message, cause);
        this.sqlState = sqlState;
    }

    /** Returns the SQLSTATE reported by the driver, if any. */
    @Nullable
    public String getSqlState() {
        return sqlState;
    }
}
