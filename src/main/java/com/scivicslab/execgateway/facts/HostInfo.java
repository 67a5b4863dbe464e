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

package com.scivicslab.execgateway.facts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONObject;

/**
 * Normalized hardware and OS summary of one host.
 *
 * <p>A value missing from the host's facts is stored as {@link #UNKNOWN}.
 * Treat it as its own value; it is never a number.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class HostInfo {

    /** Sentinel for a fact the host did not report. */
    public static final String UNKNOWN = "unknown";

    public static final String HOST = "host";
    public static final String HOSTNAME = "hostname";
    public static final String CPU_MODEL = "cpu_model";
    public static final String CPU_NUMBER = "cpu_number";
    public static final String VCPU_NUMBER = "vcpu_number";
    public static final String KERNEL = "kernel";
    public static final String SYSTEM = "system";
    public static final String SERVER_MODEL = "server_model";
    public static final String RAM_TOTAL = "ram_total";
    public static final String SWAP_TOTAL = "swap_total";
    public static final String DISK_TOTAL = "disk_total";
    public static final String FILESYSTEMS = "filesystems";
    public static final String INTERFACES = "interfaces";

    private final Map<String, Object> fields;

    HostInfo(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Gets a field.
     *
     * @param name the field name, e.g. {@link #SERVER_MODEL}
     * @return the value, {@link #UNKNOWN}, or null for a name that is not a field
     */
    public Object get(String name) {
        return fields.get(name);
    }

    public boolean isUnknown(String name) {
        return UNKNOWN.equals(fields.get(name));
    }

    public String getHost() {
        return (String) fields.get(HOST);
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public JSONObject toJson() {
        return new JSONObject(fields);
    }

    @Override
    public String toString() {
        return "HostInfo" + fields;
    }
}
