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

package com.scivicslab.execgateway.engine;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import com.scivicslab.execgateway.HostRecord;
import com.scivicslab.execgateway.Inventory;

/**
 * Writes an {@link Inventory} as an Ansible YAML inventory file.
 *
 * <pre>
 * all:
 *   hosts:
 *     git:
 *       ansible_host: 192.168.5.2
 *       ansible_port: 22
 *   children:
 *     web:
 *       hosts:
 *         git: {}
 * </pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class InventoryWriter {

    private final VariableManager variables;

    public InventoryWriter(VariableManager variables) {
        this.variables = variables;
    }

    /**
     * Builds the YAML document tree.
     *
     * @param inventory the inventory
     * @return the document as nested maps
     */
    public Map<String, Object> toDocument(Inventory inventory) {
        Map<String, Object> hosts = new LinkedHashMap<>();
        for (HostRecord host : inventory.getHosts()) {
            hosts.put(host.getName(), variables.hostVariables(host));
        }

        Map<String, Object> children = new LinkedHashMap<>();
        for (Map.Entry<String, Set<HostRecord>> group : inventory.getGroups().entrySet()) {
            if (Inventory.ALL.equals(group.getKey()) || group.getValue().isEmpty()) {
                continue;
            }
            Map<String, Object> members = new LinkedHashMap<>();
            group.getValue().forEach(host -> members.put(host.getName(), new LinkedHashMap<>()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("hosts", members);
            children.put(group.getKey(), body);
        }

        Map<String, Object> all = new LinkedHashMap<>();
        all.put("hosts", hosts);
        if (!children.isEmpty()) {
            all.put("children", children);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(Inventory.ALL, all);
        return document;
    }

    /**
     * Writes the inventory file.
     *
     * @param inventory the inventory
     * @param file the target file, which should already be private to the owner
     * @throws IOException if writing fails
     */
    public void write(Inventory inventory, Path file) throws IOException {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        Yaml yaml = new Yaml(options);

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            yaml.dump(toDocument(inventory), writer);
        }
    }
}
