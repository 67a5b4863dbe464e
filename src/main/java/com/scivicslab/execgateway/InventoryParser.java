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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parser for Ansible inventory files in INI format.
 *
 * <p>The parsed hosts are turned into {@link HostDescriptor}s so that a file
 * based inventory goes through the same {@link InventoryBuilder} path as a
 * client request. Example:</p>
 *
 * <pre>
 * git ansible_host=192.168.5.2
 *
 * [webservers]
 * web1 ansible_host=10.0.0.11 ansible_user=deploy
 * web2 ansible_host=10.0.0.12 ansible_port=2222
 *
 * [webservers:vars]
 * http_port=8080
 *
 * [all:vars]
 * ansible_password=secret
 * </pre>
 *
 * <p>Connection variables ({@code ansible_host}, {@code ansible_port},
 * {@code ansible_user}, {@code ansible_password}/{@code ansible_ssh_pass},
 * {@code ansible_ssh_private_key_file}, {@code ansible_become*}) are mapped
 * onto descriptor fields. Everything else is kept as an extra variable with
 * priority host vars &gt; group vars &gt; global vars.</p>
 *
 * @author devteam@scivics-lab.com
 */
public class InventoryParser {

    private static final Logger LOG = Logger.getLogger(InventoryParser.class.getName());

    /**
     * Parses an Ansible inventory file.
     *
     * @param input the input stream of the inventory file
     * @return the parsed inventory
     * @throws IOException if reading the file fails
     */
    public static ParsedInventory parse(InputStream input) throws IOException {
        ParsedInventory inventory = new ParsedInventory();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String currentGroup = null;
            boolean inVarsSection = false;
            boolean inChildrenSection = false;

            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();

                // Skip empty lines and comments
                if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                    continue;
                }

                if (line.startsWith("[") && line.endsWith("]")) {
                    String groupDeclaration = line.substring(1, line.length() - 1);
                    inVarsSection = false;
                    inChildrenSection = false;

                    if (groupDeclaration.endsWith(":vars")) {
                        inVarsSection = true;
                        currentGroup = groupDeclaration.substring(0, groupDeclaration.length() - 5);
                    } else if (groupDeclaration.endsWith(":children")) {
                        inChildrenSection = true;
                        currentGroup = null;
                        LOG.warning("Group nesting is not supported, ignoring section: " + line);
                    } else if (Inventory.ALL.equals(groupDeclaration)) {
                        // hosts under [all] belong to no named group
                        currentGroup = null;
                    } else {
                        currentGroup = groupDeclaration;
                        inventory.addGroup(currentGroup);
                    }
                    continue;
                }

                if (inChildrenSection) {
                    continue;
                }

                if (inVarsSection) {
                    int equalsIndex = line.indexOf('=');
                    if (equalsIndex > 0) {
                        String key = line.substring(0, equalsIndex).trim();
                        String value = line.substring(equalsIndex + 1).trim();

                        if (Inventory.ALL.equals(currentGroup)) {
                            inventory.addGlobalVar(key, value);
                        } else if (currentGroup != null) {
                            inventory.addGroupVar(currentGroup, key, value);
                        }
                    }
                } else {
                    // Format: hostname [key=value key=value ...]
                    String[] tokens = line.split("\\s+");
                    String hostname = tokens[0];
                    inventory.addHost(currentGroup, hostname);

                    for (int i = 1; i < tokens.length; i++) {
                        String token = tokens[i];
                        int equalsIndex = token.indexOf('=');
                        if (equalsIndex > 0) {
                            String key = token.substring(0, equalsIndex).trim();
                            String value = token.substring(equalsIndex + 1).trim();
                            inventory.addHostVar(hostname, key, value);
                        }
                    }
                }
            }
        }

        return inventory;
    }

    /**
     * Represents a parsed Ansible inventory.
     */
    public static class ParsedInventory {
        private final Map<String, List<String>> groups = new LinkedHashMap<>();
        private final Set<String> hosts = new LinkedHashSet<>();
        private final Map<String, String> globalVars = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> groupVars = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> hostVars = new LinkedHashMap<>();

        public void addGroup(String groupName) {
            groups.putIfAbsent(groupName, new ArrayList<>());
        }

        /**
         * Adds a host, optionally to a group.
         *
         * @param groupName the group, or null for a host listed before any section
         * @param hostname the host name
         */
        public void addHost(String groupName, String hostname) {
            hosts.add(hostname);
            if (groupName != null) {
                List<String> members = groups.computeIfAbsent(groupName, k -> new ArrayList<>());
                if (!members.contains(hostname)) {
                    members.add(hostname);
                }
            }
        }

        public void addGlobalVar(String key, String value) {
            globalVars.put(key, value);
        }

        public void addGroupVar(String groupName, String key, String value) {
            groupVars.computeIfAbsent(groupName, k -> new LinkedHashMap<>()).put(key, value);
        }

        public void addHostVar(String hostname, String key, String value) {
            hostVars.computeIfAbsent(hostname, k -> new LinkedHashMap<>()).put(key, value);
        }

        public List<String> getHosts(String groupName) {
            return groups.getOrDefault(groupName, new ArrayList<>());
        }

        public Map<String, String> getGlobalVars() {
            return new LinkedHashMap<>(globalVars);
        }

        public Map<String, String> getGroupVars(String groupName) {
            return new LinkedHashMap<>(groupVars.getOrDefault(groupName, new LinkedHashMap<>()));
        }

        public Map<String, String> getHostVars(String hostname) {
            return new LinkedHashMap<>(hostVars.getOrDefault(hostname, new LinkedHashMap<>()));
        }

        public Map<String, List<String>> getAllGroups() {
            return new LinkedHashMap<>(groups);
        }

        /**
         * Converts the parsed hosts to descriptors, one per distinct host.
         *
         * @return the descriptors in order of first appearance
         * @throws IllegalArgumentException if a port value is not a number
         */
        public List<HostDescriptor> toDescriptors() {
            List<HostDescriptor> descriptors = new ArrayList<>();
            for (String hostname : hosts) {
                List<String> memberOf = new ArrayList<>();
                groups.forEach((group, members) -> {
                    if (members.contains(hostname)) {
                        memberOf.add(group);
                    }
                });

                // Merge vars with priority: host vars > group vars > global vars
                Map<String, String> effectiveVars = new LinkedHashMap<>(globalVars);
                for (String group : memberOf) {
                    effectiveVars.putAll(getGroupVars(group));
                }
                effectiveVars.putAll(getHostVars(hostname));

                descriptors.add(toDescriptor(hostname, memberOf, effectiveVars));
            }
            return descriptors;
        }

        private static HostDescriptor toDescriptor(String hostname, List<String> memberOf,
                                                   Map<String, String> vars) {
            HostDescriptor.Builder builder = HostDescriptor.builder()
                .hostname(hostname)
                .ip(vars.remove("ansible_host"))
                .username(vars.remove("ansible_user"))
                .privateKey(vars.remove("ansible_ssh_private_key_file"));

            String password = vars.remove("ansible_password");
            String sshPass = vars.remove("ansible_ssh_pass");
            builder.password(password != null ? password : sshPass);

            String port = vars.remove("ansible_port");
            if (port != null) {
                try {
                    builder.port(Integer.parseInt(port));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid ansible_port for host " + hostname + ": " + port, e);
                }
            }

            String become = vars.remove("ansible_become");
            String becomeMethod = vars.remove("ansible_become_method");
            String becomeUser = vars.remove("ansible_become_user");
            String becomePass = vars.remove("ansible_become_pass");
            if (becomePass == null) {
                becomePass = vars.remove("ansible_become_password");
            }
            if (become != null && isTrue(become)) {
                builder.become(new HostDescriptor.BecomeSpec(becomeMethod, becomeUser, becomePass));
            }

            memberOf.forEach(builder::group);
            builder.vars(vars);
            return builder.build();
        }

        private static boolean isTrue(String value) {
            return "true".equalsIgnoreCase(value) || "yes".equalsIgnoreCase(value) || "1".equals(value);
        }
    }
}
