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

package com.scivicslab.execgateway.safety;

import org.json.JSONObject;

/**
 * Out-of-band notice that a request was refused by the {@link SafetyFilter}.
 *
 * <p>A rejected request never reaches a host, so there is no outcome record;
 * the transport sends this notice instead.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class RejectionNotice {

    /** What the refused text was. */
    public enum Source {
        ARGUMENTS("arguments"),
        PLAYBOOK("playbook"),
        HOST_VARS("host variables");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Source source;
    private final String variable;

    public RejectionNotice(Source source, String variable) {
        this.source = source;
        this.variable = variable;
    }

    public Source getSource() {
        return source;
    }

    public String getVariable() {
        return variable;
    }

    public String getMessage() {
        return String.format("Forbidden variable [%s] found in %s; execution refused.",
            variable, source.label());
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("status", "rejected");
        json.put("source", source.label());
        json.put("variable", variable);
        json.put("message", getMessage());
        return json;
    }

    @Override
    public String toString() {
        return "RejectionNotice{" + getMessage() + "}";
    }
}
