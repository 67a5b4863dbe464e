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

/**
 * Classification of one (host, task) outcome.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public enum OutcomeStatus {
    OK("ok"),
    FAILED("failed"),
    UNREACHABLE("unreachable");

    private final String label;

    OutcomeStatus(String label) {
        this.label = label;
    }

    /**
     * Gets the wire label of this status.
     *
     * @return {@code ok}, {@code failed} or {@code unreachable}
     */
    public String label() {
        return label;
    }
}
