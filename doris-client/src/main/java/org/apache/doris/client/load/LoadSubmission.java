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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Acknowledgement of a submitted bulk-load job. The job runs asynchronously on the cluster and is
 * tracked by its label; the rows are whatever the engine returned on submission.
 */
public final class LoadSubmission {

    private final String label;
    private final List<Map<String, Object>> rows;
    private final String message;

    public LoadSubmission(String label, List<Map<String, Object>> rows, String message) {
        this.label = label;
        this.rows = Collections.unmodifiableList(rows);
        this.message = message;
    }

    public String getLabel() {
        return label;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public String getMessage() {
        return message;
    }
}
