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

import java.util.Map;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for HostRecord and HostDescriptor.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("HostRecord")
class HostRecordTest {

    @Nested
    @DisplayName("Naming")
    class Naming {

        @Test
        @DisplayName("Should be named by hostname and addressed by ip")
        void shouldUseHostnameAndIp() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git").ip("192.168.5.2").build(), HostRecord.CONNECTION_PARAMIKO);

            assertEquals("git", host.getName());
            assertEquals("192.168.5.2", host.getAddress());
            assertEquals(22, host.getPort());
        }

        @Test
        @DisplayName("Should fall back to ip when hostname is missing")
        void shouldFallBackToIp() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .ip("10.0.0.99").build(), HostRecord.CONNECTION_PARAMIKO);

            assertEquals("10.0.0.99", host.getName());
            assertEquals("10.0.0.99", host.getVariables().get(HostRecord.VAR_HOST));
        }

        @Test
        @DisplayName("Should fall back to hostname when ip is missing")
        void shouldFallBackToHostname() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git.example.com").build(), HostRecord.CONNECTION_PARAMIKO);

            assertEquals("git.example.com", host.getAddress());
        }

        @Test
        @DisplayName("Should reject a descriptor without hostname and ip")
        void shouldRejectAnonymousDescriptor() {
            HostDescriptor descriptor = HostDescriptor.builder().port(22).build();

            assertThrows(IllegalArgumentException.class,
                () -> HostRecord.from(descriptor, HostRecord.CONNECTION_PARAMIKO));
        }

        @Test
        @DisplayName("Should reject a port out of range")
        void shouldRejectBadPort() {
            HostDescriptor descriptor = HostDescriptor.builder().hostname("git").port(70000).build();

            assertThrows(IllegalArgumentException.class,
                () -> HostRecord.from(descriptor, HostRecord.CONNECTION_PARAMIKO));
        }
    }

    @Nested
    @DisplayName("Connection variables")
    class ConnectionVariables {

        @Test
        @DisplayName("Should set connection, address, port and credentials")
        void shouldSetConnectionVariables() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git").ip("192.168.5.2").port(2222)
                .username("ops").password("x").privateKey("/keys/id_rsa")
                .build(), HostRecord.CONNECTION_PARAMIKO);

            Map<String, Object> vars = host.getVariables();
            assertEquals("paramiko", vars.get(HostRecord.VAR_CONNECTION));
            assertEquals("192.168.5.2", vars.get(HostRecord.VAR_HOST));
            assertEquals(2222, vars.get(HostRecord.VAR_PORT));
            assertEquals("ops", vars.get(HostRecord.VAR_USER));
            assertEquals("x", vars.get(HostRecord.VAR_SSH_PASS));
            assertEquals("/keys/id_rsa", vars.get(HostRecord.VAR_PRIVATE_KEY));
            assertEquals(false, vars.get(HostRecord.VAR_HOST_KEY_CHECKING));
        }

        @Test
        @DisplayName("Should only set pipelining options for the ssh plugin")
        void shouldSetSshOptionsOnlyForSsh() {
            HostDescriptor descriptor = HostDescriptor.builder().hostname("git").build();

            HostRecord paramiko = HostRecord.from(descriptor, HostRecord.CONNECTION_PARAMIKO);
            HostRecord ssh = HostRecord.from(descriptor, HostRecord.CONNECTION_SSH);

            assertFalse(paramiko.getVariables().containsKey(HostRecord.VAR_PIPELINING));
            assertFalse(paramiko.getVariables().containsKey(HostRecord.VAR_SSH_ARGS));
            assertEquals(true, ssh.getVariables().get(HostRecord.VAR_PIPELINING));
            assertTrue(ssh.getVariables().containsKey(HostRecord.VAR_SSH_ARGS));
        }

        @Test
        @DisplayName("Should not expose secrets in toString")
        void shouldHideSecrets() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git").password("topsecret").build(), HostRecord.CONNECTION_PARAMIKO);

            assertFalse(host.toString().contains("topsecret"));
        }
    }

    @Nested
    @DisplayName("Privilege escalation")
    class Become {

        @Test
        @DisplayName("Should disable escalation explicitly when become is absent")
        void shouldDisableBecome() {
            HostRecord host = HostRecord.from(HostDescriptor.builder().hostname("git").build(),
                HostRecord.CONNECTION_PARAMIKO);

            assertEquals(false, host.getVariables().get(HostRecord.VAR_BECOME));
            assertFalse(host.getVariables().containsKey(HostRecord.VAR_BECOME_METHOD));
        }

        @Test
        @DisplayName("Should default method to sudo and user to root")
        void shouldDefaultBecome() {
            HostRecord host = HostRecord.from(HostDescriptor.builder().hostname("git")
                .become(new HostDescriptor.BecomeSpec(null, null, null)).build(),
                HostRecord.CONNECTION_PARAMIKO);

            Map<String, Object> vars = host.getVariables();
            assertEquals(true, vars.get(HostRecord.VAR_BECOME));
            assertEquals("sudo", vars.get(HostRecord.VAR_BECOME_METHOD));
            assertEquals("root", vars.get(HostRecord.VAR_BECOME_USER));
            assertEquals("", vars.get(HostRecord.VAR_BECOME_PASS));
        }

        @Test
        @DisplayName("Should turn pipelining off for sudo over ssh")
        void shouldDisablePipeliningForSudo() {
            HostRecord host = HostRecord.from(HostDescriptor.builder().hostname("git")
                .become(new HostDescriptor.BecomeSpec("sudo", "admin", "pw")).build(),
                HostRecord.CONNECTION_SSH);

            assertEquals(false, host.getVariables().get(HostRecord.VAR_PIPELINING));
            assertEquals("admin", host.getVariables().get(HostRecord.VAR_BECOME_USER));
        }
    }

    @Nested
    @DisplayName("Extra variables")
    class ExtraVariables {

        @Test
        @DisplayName("Should let extra variables shadow non-critical keys")
        void shouldShadowNonCriticalKeys() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git").username("ops")
                .var(HostRecord.VAR_USER, "other")
                .var("love", "yes")
                .build(), HostRecord.CONNECTION_PARAMIKO);

            assertEquals("other", host.getVariables().get(HostRecord.VAR_USER));
            assertEquals("yes", host.getVariables().get("love"));
        }

        @Test
        @DisplayName("Should keep address and port against extra variables")
        void shouldProtectAddressAndPort() {
            HostRecord host = HostRecord.from(HostDescriptor.builder()
                .hostname("git").ip("192.168.5.2").port(22)
                .var(HostRecord.VAR_HOST, "10.6.6.6")
                .var(HostRecord.VAR_PORT, 2200)
                .build(), HostRecord.CONNECTION_PARAMIKO);

            assertEquals("192.168.5.2", host.getVariables().get(HostRecord.VAR_HOST));
            assertEquals(22, host.getVariables().get(HostRecord.VAR_PORT));
        }
    }

    @Nested
    @DisplayName("JSON descriptors")
    class JsonDescriptors {

        @Test
        @DisplayName("Should accept the console field aliases host and pass")
        void shouldAcceptAliases() {
            HostDescriptor descriptor = HostDescriptor.fromJson(new JSONObject()
                .put("hostname", "git").put("host", "192.168.5.2").put("port", "2222").put("pass", "x"));

            assertEquals("192.168.5.2", descriptor.getIp());
            assertEquals(2222, descriptor.getPort());
            assertEquals("x", descriptor.getPassword());
        }

        @Test
        @DisplayName("Should read become, groups and vars")
        void shouldReadNestedFields() {
            HostDescriptor descriptor = HostDescriptor.fromJson(new JSONObject(
                "{\"hostname\":\"db1\",\"become\":{\"user\":\"postgres\"},"
                + "\"groups\":[\"db\",\"db\"],\"vars\":{\"love\":\"yes\"}}"));

            assertEquals("postgres", descriptor.getBecome().getUser());
            assertNull(descriptor.getBecome().getMethod());
            assertEquals(1, descriptor.getGroups().size());
            assertEquals("yes", descriptor.getVars().get("love"));
        }

        @Test
        @DisplayName("Should reject a non numeric port")
        void shouldRejectNonNumericPort() {
            JSONObject json = new JSONObject().put("hostname", "git").put("port", "ssh");

            assertThrows(IllegalArgumentException.class, () -> HostDescriptor.fromJson(json));
        }
    }
}
