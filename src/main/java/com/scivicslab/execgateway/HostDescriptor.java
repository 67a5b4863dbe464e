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

package com.scivicslab.execgateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Connection facts for one target host, as supplied by a client.
 *
 * <p>A descriptor is immutable. It is consumed once by {@link HostRecord#from}
 * when the inventory is built.</p>
 *
 * <h2>JSON form</h2>
 * <pre>{@code
 * {
 *   "hostname": "git",
 *   "ip": "192.168.5.2",
 *   "port": 22,
 *   "username": "root",
 *   "password": "secret",
 *   "private_key": "/home/ops/.ssh/id_rsa",
 *   "become": {"method": "sudo", "user": "root", "pass": "secret"},
 *   "groups": ["web", "test"],
 *   "vars": {"love": "yes"}
 * }
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class HostDescriptor {

    /** Default SSH port. */
    public static final int DEFAULT_PORT = 22;

    private final String hostname;
    private final String ip;
    private final int port;
    private final String username;
    private final String password;
    private final String privateKey;
    private final BecomeSpec become;
    private final List<String> groups;
    private final Map<String, Object> vars;

    private HostDescriptor(Builder builder) {
        this.hostname = builder.hostname;
        this.ip = builder.ip;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.privateKey = builder.privateKey;
        this.become = builder.become;
        this.groups = Collections.unmodifiableList(new ArrayList<>(builder.groups));
        this.vars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.vars));
    }

    /**
     * Creates a new builder.
     *
     * @return an empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a descriptor from its JSON form.
     *
     * <p>{@code host} and {@code pass} are accepted as aliases of {@code ip}
     * and {@code password}, which is what the browser console sends.</p>
     *
     * @param json the JSON object
     * @return the descriptor
     * @throws IllegalArgumentException if the port is not a number
     */
    public static HostDescriptor fromJson(JSONObject json) {
        Builder builder = builder()
            .hostname(json.optString("hostname", null))
            .ip(json.has("ip") ? json.optString("ip", null) : json.optString("host", null))
            .username(json.optString("username", null))
            .password(json.has("password") ? json.optString("password", null) : json.optString("pass", null))
            .privateKey(json.optString("private_key", null));

        if (json.has("port") && !json.isNull("port")) {
            Object port = json.get("port");
            try {
                builder.port(port instanceof Number ? ((Number) port).intValue() : Integer.parseInt(port.toString()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + port, e);
            }
        }

        JSONObject become = json.optJSONObject("become");
        if (become != null) {
            builder.become(new BecomeSpec(
                become.optString("method", null),
                become.optString("user", null),
                become.optString("pass", null)));
        }

        JSONArray groups = json.optJSONArray("groups");
        if (groups != null) {
            for (int i = 0; i < groups.length(); i++) {
                builder.group(groups.getString(i));
            }
        }

        JSONObject vars = json.optJSONObject("vars");
        if (vars != null) {
            builder.vars(vars.toMap());
        }
        return builder.build();
    }

    /**
     * Reads a JSON array of descriptors.
     *
     * @param array the JSON array
     * @return the descriptors in array order
     */
    public static List<HostDescriptor> fromJsonArray(JSONArray array) {
        List<HostDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            descriptors.add(fromJson(array.getJSONObject(i)));
        }
        return descriptors;
    }

    public String getHostname() {
        return hostname;
    }

    public String getIp() {
        return ip;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    /**
     * Gets the privilege escalation request.
     *
     * @return the become spec, or null when escalation was not requested
     */
    public BecomeSpec getBecome() {
        return become;
    }

    public List<String> getGroups() {
        return groups;
    }

    public Map<String, Object> getVars() {
        return vars;
    }

    @Override
    public String toString() {
        return String.format("HostDescriptor{hostname='%s', ip='%s', port=%d, groups=%s}",
            hostname, ip, port, groups);
    }

    /**
     * Privilege escalation request. Absent fields fall back to
     * {@code sudo} and {@code root} when the host record is built.
     */
    public static final class BecomeSpec {
        private final String method;
        private final String user;
        private final String pass;

        public BecomeSpec(String method, String user, String pass) {
            this.method = method;
            this.user = user;
            this.pass = pass;
        }

        public String getMethod() {
            return method;
        }

        public String getUser() {
            return user;
        }

        public String getPass() {
            return pass;
        }
    }

    /**
     * Builder for {@link HostDescriptor}.
     */
    public static final class Builder {
        private String hostname;
        private String ip;
        private int port = DEFAULT_PORT;
        private String username;
        private String password;
        private String privateKey;
        private BecomeSpec become;
        private final List<String> groups = new ArrayList<>();
        private final Map<String, Object> vars = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder privateKey(String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder become(BecomeSpec become) {
            this.become = become;
            return this;
        }

        public Builder group(String group) {
            if (!groups.contains(group)) {
                groups.add(group);
            }
            return this;
        }

        public Builder var(String key, Object value) {
            vars.put(key, value);
            return this;
        }

        public Builder vars(Map<String, ?> values) {
            vars.putAll(values);
            return this;
        }

        public HostDescriptor build() {
            return new HostDescriptor(this);
        }
    }
}
