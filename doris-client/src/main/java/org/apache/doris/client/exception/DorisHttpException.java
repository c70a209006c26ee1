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

/**
 * Thrown when a request against the frontend HTTP API fails, either because the endpoint could not
 * be reached or because it answered with a non-2xx status.
 */
public class DorisHttpException extends DorisException {

    private static final long serialVersionUID = 1L;

    /** Status code of the response, or -1 when no response was received. */
    private final int statusCode;

    @Nullable private final String responseBody;

    public DorisHttpException(String message, int statusCode, @Nullable String responseBody) {
        super(ErrorKind.HTTP, message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public DorisHttpException(String message, Throwable cause) {
        super(ErrorKind.HTTP, message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getResponseBody() {
        return responseBody;
    }
}
