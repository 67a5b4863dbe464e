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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory inventory of target hosts and their groups.
 *
 * <p>An inventory is built fresh for every request by {@link InventoryBuilder}
 * and is read-only afterwards. The groups {@value #ALL} and
 * {@value #UNGROUPED} always exist.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class Inventory {

    /** Group every host belongs to. */
    public static final String ALL = "all";

    /** Group of hosts that declared no group. */
    public static final String UNGROUPED = "ungrouped";

    private final Map<String, HostRecord> hosts;
    private final Map<String, Set<HostRecord>> groups;

    Inventory(Map<String, HostRecord> hosts, Map<String, Set<HostRecord>> groups) {
        this.hosts = Collections.unmodifiableMap(new LinkedHashMap<>(hosts));
        Map<String, Set<HostRecord>> copy = new LinkedHashMap<>();
        copy.put(ALL, Collections.unmodifiableSet(new LinkedHashSet<>(hosts.values())));
        copy.put(UNGROUPED, Collections.emptySet());
        groups.forEach((name, members) -> {
            if (!ALL.equals(name)) {
                copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(members)));
            }
        });
        this.groups = Collections.unmodifiableMap(copy);
    }

    /**
     * Resolves a host pattern to the matching hosts.
     *
     * <p>The pattern is either {@value #ALL}, a group name or a host name.
     * Group names, {@value #ALL} included, are checked before host names.
     * An unknown pattern yields an empty set; the caller reports that as
     * "no hosts matched".</p>
     *
     * @param pattern the host pattern
     * @return the matching hosts in insertion order, never null
     */
    public Set<HostRecord> resolveHosts(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return Collections.emptySet();
        }
        String trimmed = pattern.trim();
        Set<HostRecord> group = groups.get(trimmed);
        if (group != null) {
            return group;
        }
        HostRecord host = hosts.get(trimmed);
        return host == null ? Collections.emptySet() : Collections.singleton(host);
    }

    /**
     * Gets a host by name.
     *
     * @param name the host name
     * @return the host, or null if absent
     */
    public HostRecord getHost(String name) {
        return hosts.get(name);
    }

    public Collection<HostRecord> getHosts() {
        return hosts.values();
    }

    /**
     * Gets all groups with their members.
     *
     * @return group name to members, including {@value #ALL} and {@value #UNGROUPED}
     */
    public Map<String, Set<HostRecord>> getGroups() {
        return groups;
    }

    /**
     * Gets the members of a group.
     *
     * @param name the group name
     * @return the members, or null if the group is undefined
     */
    public Set<HostRecord> getGroup(String name) {
        return groups.get(name);
    }

    public int size() {
        return hosts.size();
    }

    @Override
    public String toString() {
        return String.format("Inventory{hosts=%s, groups=%s}", hosts.keySet(), groups.keySet());
    }
}
