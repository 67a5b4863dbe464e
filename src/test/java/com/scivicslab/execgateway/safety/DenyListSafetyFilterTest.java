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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for DenyListSafetyFilter.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("DenyListSafetyFilter")
class DenyListSafetyFilterTest {

    private final SafetyFilter filter = new DenyListSafetyFilter();

    @Nested
    @DisplayName("Refused text")
    class Refused {

        @Test
        @DisplayName("Should flag a template reference to the ssh password")
        void shouldFlagTemplateReference() {
            assertEquals(Optional.of("ansible_become_pass"), filter.scan("{{ ansible_become_pass }}"));
            assertEquals(Optional.of("ansible_ssh_pass"), filter.scan("echo {{ansible_ssh_pass}}"));
        }

        @Test
        @DisplayName("Should flag ansible_ssh_pass wherever it appears")
        void shouldFlagAnyOccurrence() {
            for (String text : List.of(
                    "ansible_ssh_pass",
                    "echo ansible_ssh_pass > /tmp/x",
                    "x=ansible_ssh_pass",
                    "cat /tmp/ansible_ssh_pass.txt",
                    "- debug: var=ansible_ssh_pass")) {
                assertEquals(Optional.of("ansible_ssh_pass"), filter.scan(text), text);
            }
        }

        @Test
        @DisplayName("Should match case-insensitively and report the deny-list spelling")
        void shouldIgnoreCase() {
            assertEquals(Optional.of("vault_password"), filter.scan("echo {{ VAULT_Password }}"));
        }

        @Test
        @DisplayName("Should report the longer name when one name extends another")
        void shouldPreferLongestName() {
            assertEquals(Optional.of("ansible_become_password"), filter.scan("{{ ansible_become_password }}"));
            assertEquals(Optional.of("ansible_ssh_private_key_file"),
                filter.scan("cat {{ ansible_ssh_private_key_file }}"));
        }

        @Test
        @DisplayName("Should flag hostvars even as a mapping key")
        void shouldFlagHostvars() {
            assertEquals(Optional.of("hostvars"), filter.scan("msg: \"{{ hostvars['web1'] }}\""));
            assertEquals(Optional.of("hostvars"), filter.scan("hostvars: x"));
        }

        @Test
        @DisplayName("Should flag a secret after a vars section")
        void shouldFlagSecretInsidePlaybook() {
            String playbook = "- hosts: all\n"
                + "  vars:\n"
                + "    x: 1\n"
                + "  tasks:\n"
                + "    - shell: echo {{ ansible_password }}\n";

            assertEquals(Optional.of("ansible_password"), filter.scan(playbook));
        }

        @Test
        @DisplayName("Should flag secret names inside longer words")
        void shouldFlagSecretInsideWord() {
            assertEquals(Optional.of("vault_password"), filter.scan("cat my_vault_password_file"));
            assertEquals(Optional.of("ansible_password"), filter.scan("group_vars/all/ansible_password.yml"));
        }

        @Test
        @DisplayName("Should flag the vars variable itself")
        void shouldFlagVarsVariable() {
            assertEquals(Optional.of("vars"), filter.scan("echo {{ vars }}"));
        }
    }

    @Nested
    @DisplayName("Accepted text")
    class Accepted {

        @Test
        @DisplayName("Should not flag the vars keyword")
        void shouldNotFlagVarsKeyword() {
            assertTrue(filter.scan("vars:").isEmpty());
            assertTrue(filter.scan("- hosts: all\n  vars:\n    greeting: hello\n").isEmpty());
        }

        @Test
        @DisplayName("Should not flag the vars_files keyword")
        void shouldNotFlagVarsFilesKeyword() {
            assertTrue(filter.scan("  vars_files:\n    - common.yml\n").isEmpty());
        }

        @Test
        @DisplayName("Should not flag keys that end in vars")
        void shouldNotFlagKeysEndingInVars() {
            assertTrue(filter.scan("- hosts: all\n  tasks:\n    - include_vars: common.yml\n").isEmpty());
            assertTrue(filter.scan("    - include_vars:\n        file: web.yml\n").isEmpty());
        }

        @Test
        @DisplayName("Should not flag vars inside a longer identifier")
        void shouldNotFlagVarsInsideIdentifier() {
            assertTrue(filter.scan("  vars_prompt:\n    - name: release\n      prompt: Release?\n").isEmpty());
            assertTrue(filter.scan("ls /etc/ansible/group_vars").isEmpty());
            assertTrue(filter.scan("cat host_vars/web1.yml").isEmpty());
            assertTrue(filter.scan("echo {{ myvars }}").isEmpty());
        }

        @Test
        @DisplayName("Should accept ordinary commands")
        void shouldAcceptOrdinaryCommands() {
            assertTrue(filter.scan("echo hi").isEmpty());
            assertTrue(filter.scan("ls -lha /tmp").isEmpty());
            assertTrue(filter.scan("df -h && uptime").isEmpty());
        }

        @Test
        @DisplayName("Should accept empty and null text")
        void shouldAcceptEmptyText() {
            assertTrue(filter.scan("").isEmpty());
            assertTrue(filter.scan(null).isEmpty());
        }
    }

    @Test
    @DisplayName("Should honor a custom deny-list")
    void shouldHonorCustomDenyList() {
        SafetyFilter custom = new DenyListSafetyFilter(List.of("db_password"));

        assertEquals(Optional.of("db_password"), custom.scan("echo {{ DB_PASSWORD }}"));
        assertTrue(custom.scan("echo {{ ansible_ssh_pass }}").isEmpty());
    }

    @Test
    @DisplayName("Should honor custom whole-identifier names")
    void shouldHonorCustomIdentifierNames() {
        SafetyFilter custom = new DenyListSafetyFilter(List.of("env"), List.of());

        assertEquals(Optional.of("env"), custom.scan("echo {{ env['HOME'] }}"));
        assertTrue(custom.scan("echo {{ environment }}").isEmpty());
    }

    @Test
    @DisplayName("Should scan strings nested in variable values")
    void shouldScanNestedValues() {
        Map<String, Object> vars = Map.of(
            "port", 8080,
            "users", List.of("alice", Map.of("note", "{{ vault_password }}")));

        assertEquals(Optional.of("vault_password"), filter.scanValue(vars));
        assertTrue(filter.scanValue(Map.of("port", 8080, "name", "web")).isEmpty());
        assertTrue(filter.scanValue(null).isEmpty());
    }

    @Test
    @DisplayName("Should render a rejection notice")
    void shouldRenderRejectionNotice() {
        RejectionNotice notice = new RejectionNotice(RejectionNotice.Source.PLAYBOOK, "hostvars");

        JSONObject json = notice.toJson();
        assertEquals("rejected", json.getString("status"));
        assertEquals("playbook", json.getString("source"));
        assertEquals("hostvars", json.getString("variable"));
        assertTrue(json.getString("message").contains("[hostvars]"));
    }
}
