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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single target host with the variable set the automation engine needs
 * to open a connection and, if requested, escalate privileges.
 *
 * <p>Host key verification is switched off for every record. Target fleets
 * are expected to be vetted before they are handed to the gateway.</p>
 *
 * <p>Extra variables from the descriptor are applied last, so they can
 * override anything set here except {@code ansible_host} and
 * {@code ansible_port}. For example a descriptor may carry its own
 * {@code ansible_user} and that value wins over {@code username}.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class HostRecord implements ExecutionTarget {

    /** Connection plugin that reuses OpenSSH (enables pipelining options). */
    public static final String CONNECTION_SSH = "ssh";

    /** Password/key based Python SSH transport. */
    public static final String CONNECTION_PARAMIKO = "paramiko";

    public static final String VAR_CONNECTION = "ansible_connection";
    public static final String VAR_HOST = "ansible_host";
    public static final String VAR_PORT = "ansible_port";
    public static final String VAR_USER = "ansible_user";
    public static final String VAR_SSH_PASS = "ansible_ssh_pass";
    public static final String VAR_PRIVATE_KEY = "ansible_ssh_private_key_file";
    public static final String VAR_HOST_KEY_CHECKING = "ansible_ssh_host_key_checking";
    public static final String VAR_SSH_ARGS = "ansible_ssh_args";
    public static final String VAR_PIPELINING = "ansible_ssh_pipelining";
    public static final String VAR_BECOME = "ansible_become";
    public static final String VAR_BECOME_METHOD = "ansible_become_method";
    public static final String VAR_BECOME_USER = "ansible_become_user";
    public static final String VAR_BECOME_PASS = "ansible_become_pass";

    private static final String DEFAULT_BECOME_METHOD = "sudo";
    private static final String DEFAULT_BECOME_USER = "root";

    private final String name;
    private final String address;
    private final int port;
    private final Map<String, Object> variables;

    private HostRecord(String name, String address, int port, Map<String, Object> variables) {
        this.name = name;
        this.address = address;
        this.port = port;
        this.variables = Collections.unmodifiableMap(variables);
    }

    /**
     * Builds a host record from a descriptor.
     *
     * @param descriptor the client supplied connection facts
     * @param connectionType the process-wide connection plugin name
     * @return the host record
     * @throws IllegalArgumentException if neither hostname nor ip is set,
     *         or the port is out of range
     */
    public static HostRecord from(HostDescriptor descriptor, String connectionType) {
        Objects.requireNonNull(descriptor, "descriptor");
        String name = isBlank(descriptor.getHostname()) ? descriptor.getIp() : descriptor.getHostname();
        String address = isBlank(descriptor.getIp()) ? descriptor.getHostname() : descriptor.getIp();
        if (isBlank(name) || isBlank(address)) {
            throw new IllegalArgumentException("Host descriptor needs a hostname or an ip: " + descriptor);
        }
        int port = descriptor.getPort();
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range for host " + name + ": " + port);
        }

        Map<String, Object> vars = new LinkedHashMap<>();
        boolean ssh = CONNECTION_SSH.equals(connectionType);

        vars.put(VAR_CONNECTION, connectionType);
        if (ssh) {
            vars.put(VAR_SSH_ARGS, "-C -o ControlMaster=auto -o ControlPersist=60s");
        }
        vars.put(VAR_HOST_KEY_CHECKING, false);
        vars.put(VAR_HOST, address);
        vars.put(VAR_PORT, port);

        if (!isBlank(descriptor.getUsername())) {
            vars.put(VAR_USER, descriptor.getUsername());
        }
        if (!isBlank(descriptor.getPassword())) {
            vars.put(VAR_SSH_PASS, descriptor.getPassword());
        }
        if (!isBlank(descriptor.getPrivateKey())) {
            vars.put(VAR_PRIVATE_KEY, descriptor.getPrivateKey());
        }
        if (ssh) {
            vars.put(VAR_PIPELINING, true);
        }

        HostDescriptor.BecomeSpec become = descriptor.getBecome();
        if (become != null) {
            String method = isBlank(become.getMethod()) ? DEFAULT_BECOME_METHOD : become.getMethod();
            vars.put(VAR_BECOME, true);
            vars.put(VAR_BECOME_METHOD, method);
            // sudo prompts break pipelining
            if (ssh && DEFAULT_BECOME_METHOD.equals(method)) {
                vars.put(VAR_PIPELINING, false);
            }
            vars.put(VAR_BECOME_USER, isBlank(become.getUser()) ? DEFAULT_BECOME_USER : become.getUser());
            vars.put(VAR_BECOME_PASS, become.getPass() == null ? "" : become.getPass());
        } else {
            vars.put(VAR_BECOME, false);
        }

        vars.putAll(descriptor.getVars());

        // address and port are not overridable
        vars.put(VAR_HOST, address);
        vars.put(VAR_PORT, port);

        return new HostRecord(name, address, port, vars);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    public Map<String, Object> getVariables() {
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HostRecord)) {
            return false;
        }
        return name.equals(((HostRecord) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return String.format("HostRecord{name='%s', address='%s', port=%d}", name, address, port);
    }
}
