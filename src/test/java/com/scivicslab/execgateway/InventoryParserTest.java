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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for InventoryParser.
 *
 * @author devteam@scivics-lab.com
 */
@DisplayName("Inventory Parser Tests")
class InventoryParserTest {

    private static InventoryParser.ParsedInventory parseFixture() throws IOException {
        InputStream input = InventoryParserTest.class.getResourceAsStream("/test-inventory.ini");
        assertNotNull(input, "Test inventory file should exist");
        return InventoryParser.parse(input);
    }

    private static Map<String, HostDescriptor> descriptorsByName() throws IOException {
        return parseFixture().toDescriptors().stream()
            .collect(Collectors.toMap(HostDescriptor::getHostname, Function.identity()));
    }

    @Test
    @DisplayName("Should parse inventory file with groups")
    void testParseInventoryGroups() throws IOException {
        InventoryParser.ParsedInventory inventory = parseFixture();

        Map<String, List<String>> groups = inventory.getAllGroups();
        assertTrue(groups.containsKey("webservers"), "Should have webservers group");
        assertTrue(groups.containsKey("dbservers"), "Should have dbservers group");
        assertFalse(groups.containsKey("legacy"), "Children sections should be ignored");

        assertEquals(List.of("web1", "web2"), inventory.getHosts("webservers"));
        assertEquals(List.of("db1", "web1"), inventory.getHosts("dbservers"));
    }

    @Test
    @DisplayName("Should parse global and group variables")
    void testParseVars() throws IOException {
        InventoryParser.ParsedInventory inventory = parseFixture();

        assertEquals("secret", inventory.getGlobalVars().get("ansible_password"));
        assertEquals("8080", inventory.getGroupVars("webservers").get("http_port"));
    }

    @Test
    @DisplayName("Should produce one descriptor per distinct host")
    void testOneDescriptorPerHost() throws IOException {
        List<HostDescriptor> descriptors = parseFixture().toDescriptors();

        assertEquals(List.of("git", "web1", "web2", "db1"),
            descriptors.stream().map(HostDescriptor::getHostname).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should map connection variables onto descriptor fields")
    void testConnectionVariables() throws IOException {
        Map<String, HostDescriptor> hosts = descriptorsByName();

        HostDescriptor web1 = hosts.get("web1");
        assertEquals("10.0.0.11", web1.getIp());
        assertEquals("deploy", web1.getUsername());
        assertEquals("secret", web1.getPassword());
        assertFalse(web1.getVars().containsKey("ansible_host"));

        assertEquals(2222, hosts.get("web2").getPort());
        assertEquals(22, hosts.get("git").getPort());
    }

    @Test
    @DisplayName("Should map ansible_become onto a become spec")
    void testBecome() throws IOException {
        Map<String, HostDescriptor> hosts = descriptorsByName();

        HostDescriptor db1 = hosts.get("db1");
        assertNotNull(db1.getBecome());
        assertEquals("dbsecret", db1.getBecome().getPass());
        assertNull(hosts.get("web1").getBecome());
    }

    @Test
    @DisplayName("Should merge variables with host over group over global priority")
    void testVariablePriority() throws IOException {
        Map<String, HostDescriptor> hosts = descriptorsByName();

        assertEquals("80", hosts.get("git").getVars().get("http_port"));
        assertEquals("8080", hosts.get("web2").getVars().get("http_port"));
        // web1 is in webservers then dbservers; the later group wins
        assertEquals("5432", hosts.get("web1").getVars().get("http_port"));
    }

    @Test
    @DisplayName("Should keep group membership and leave leading hosts ungrouped")
    void testGroups() throws IOException {
        Map<String, HostDescriptor> hosts = descriptorsByName();

        assertTrue(hosts.get("git").getGroups().isEmpty());
        assertEquals(List.of("webservers", "dbservers"), hosts.get("web1").getGroups());
    }

    @Test
    @DisplayName("Should leave hosts of an [all] section ungrouped")
    void testAllSection() throws IOException {
        String ini = "[all]\nlb1 ansible_host=10.0.2.1\n\n[web]\nweb1\n";
        List<HostDescriptor> descriptors =
            InventoryParser.parse(new ByteArrayInputStream(ini.getBytes(StandardCharsets.UTF_8))).toDescriptors();

        assertEquals(2, descriptors.size());
        assertTrue(descriptors.get(0).getGroups().isEmpty());

        Inventory inventory = new InventoryBuilder(HostRecord.CONNECTION_PARAMIKO).build(descriptors);
        assertEquals(1, inventory.resolveHosts(Inventory.UNGROUPED).size());
        assertEquals("lb1", inventory.resolveHosts(Inventory.UNGROUPED).iterator().next().getName());
    }

    @Test
    @DisplayName("Should reject a non numeric ansible_port")
    void testInvalidPort() throws IOException {
        String ini = "[web]\nweb1 ansible_port=ssh\n";
        InventoryParser.ParsedInventory inventory =
            InventoryParser.parse(new ByteArrayInputStream(ini.getBytes(StandardCharsets.UTF_8)));

        assertThrows(IllegalArgumentException.class, inventory::toDescriptors);
    }

    @Test
    @DisplayName("Should feed the inventory builder")
    void testBuildInventory() throws IOException {
        Inventory inventory = new InventoryBuilder(HostRecord.CONNECTION_PARAMIKO)
            .build(parseFixture().toDescriptors());

        assertEquals(4, inventory.resolveHosts("all").size());
        assertEquals(2, inventory.resolveHosts("dbservers").size());
        assertEquals(1, inventory.resolveHosts("ungrouped").size());
    }
}
