/*
 * Copyright 2025 devteam@scivics-lab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.execgateway.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.json.JSONObject;

/**
 * The result of running one task on one host.
 *
 * <p>Immutable. The raw payload is whatever the automation engine reported
 * for the task (stdout, rc, facts, ...).</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class OutcomeRecord {

    private final String host;
    private final String taskName;
    private final Map<String, Object> payload;
    private final OutcomeStatus status;

    public OutcomeRecord(String host, String taskName, Map<String, Object> payload, OutcomeStatus status) {
        this.host = Objects.requireNonNull(host, "host");
        this.taskName = taskName == null ? "" : taskName;
        this.payload = payload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.status = Objects.requireNonNull(status, "status");
    }

    public String getHost() {
        return host;
    }

    public String getTaskName() {
        return taskName;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public OutcomeStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.OK;
    }

    /**
     * Converts this record to its wire form.
     *
     * @return {@code {"host", "task_name", "result", "success", "msg"}}
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("host", host);
        json.put("task_name", taskName);
        json.put("result", new JSONObject(payload));
        json.put("success", isSuccess());
        json.put("msg", status.label());
        return json;
    }

    @Override
    public String toString() {
        return String.format("OutcomeRecord{host='%s', task='%s', status=%s}", host, taskName, status.label());
    }
}
