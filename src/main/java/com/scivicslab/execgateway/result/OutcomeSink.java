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

import java.util.Map;

/**
 * Callback protocol through which a task runtime reports outcomes.
 *
 * <p>Implementations must accept calls from several worker threads at once.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface OutcomeSink {

    void recordOk(String host, String task, Map<String, Object> payload);

    void recordFailed(String host, String task, Map<String, Object> payload);

    void recordUnreachable(String host, String task, Map<String, Object> payload);

    /**
     * Records that the host pattern of the run matched no host.
     */
    void recordNoHostsMatched();

    /**
     * Records an outcome by status.
     *
     * @param status the outcome status
     * @param host the host name
     * @param task the task name
     * @param payload the raw result
     */
    default void record(OutcomeStatus status, String host, String task, Map<String, Object> payload) {
        switch (status) {
            case OK:
                recordOk(host, task, payload);
                break;
            case FAILED:
                recordFailed(host, task, payload);
                break;
            case UNREACHABLE:
                recordUnreachable(host, task, payload);
                break;
            default:
                throw new IllegalArgumentException("Unknown status: " + status);
        }
    }
}
