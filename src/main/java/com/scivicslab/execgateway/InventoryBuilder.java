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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Builds an {@link Inventory} from a flat list of host descriptors.
 *
 * <p>Each descriptor becomes one {@link HostRecord}. A host joins every group
 * it names (groups are created on first sight) or {@value Inventory#UNGROUPED}
 * when it names none, and it always joins {@value Inventory#ALL}.</p>
 *
 * <p>Two descriptors resolving to the same host name are rejected with
 * {@link DuplicateHostException} instead of silently overwriting each other.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Inventory inventory = new InventoryBuilder(HostRecord.CONNECTION_PARAMIKO)
 *     .build(List.of(descriptor));
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class InventoryBuilder {

    private static final Logger LOG = Logger.getLogger(InventoryBuilder.class.getName());

    private final String connectionType;

    /**
     * Constructs a builder using the given connection plugin for every host.
     *
     * @param connectionType the connection plugin name
     */
    public InventoryBuilder(String connectionType) {
        this.connectionType = connectionType;
    }

    /**
     * Builds the inventory.
     *
     * @param descriptors the host descriptors
     * @return the inventory
     * @throws DuplicateHostException if two descriptors share a host name
     * @throws IllegalArgumentException if a descriptor is invalid
     */
    public Inventory build(List<HostDescriptor> descriptors) {
        Map<String, HostRecord> hosts = new LinkedHashMap<>();
        Map<String, Set<HostRecord>> groups = new LinkedHashMap<>();
        groups.put(Inventory.UNGROUPED, new LinkedHashSet<>());

        for (HostDescriptor descriptor : descriptors) {
            HostRecord host = HostRecord.from(descriptor, connectionType);
            if (hosts.containsKey(host.getName())) {
                throw new DuplicateHostException(host.getName());
            }
            hosts.put(host.getName(), host);

            // every host is in all already; naming it is not a group membership
            List<String> groupNames = descriptor.getGroups().stream()
                .filter(groupName -> !Inventory.ALL.equals(groupName))
                .collect(Collectors.toList());
            if (groupNames.isEmpty()) {
                groups.get(Inventory.UNGROUPED).add(host);
            }
            for (String groupName : groupNames) {
                groups.computeIfAbsent(groupName, k -> new LinkedHashSet<>()).add(host);
            }
        }

        Inventory inventory = new Inventory(hosts, groups);
        LOG.fine("Built " + inventory);
        return inventory;
    }

    public String getConnectionType() {
        return connectionType;
    }
}
