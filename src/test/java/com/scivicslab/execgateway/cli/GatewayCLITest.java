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

package com.scivicslab.execgateway.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.scivicslab.execgateway.TestResources;
import com.scivicslab.execgateway.engine.FakeTaskRuntime;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;

import picocli.CommandLine;

/**
 * Tests for the command line subcommands, run against a fake task runtime.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("GatewayCLI")
class GatewayCLITest {

    @TempDir
    Path tempDir;

    private final List<FakeTaskRuntime> runtimes = new ArrayList<>();
    private StringWriter out;
    private StringWriter err;

    private FakeTaskRuntime.HostBehavior behavior;

    private final TaskRuntimeFactory factory = (options, variables) -> {
        FakeTaskRuntime runtime = new FakeTaskRuntime(behavior);
        runtimes.add(runtime);
        return runtime;
    };

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        behavior = (host, sink) -> sink.recordOk(host.getName(), "", Map.of("rc", 0, "stdout", "hi"));
    }

    private int run(Callable<Integer> command, String... args) {
        CommandLine cmd = new CommandLine(command);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private String hostsFile() {
        return TestResources.path("/hosts.json").toString();
    }

    @Nested
    @DisplayName("exec")
    class Exec {

        @Test
        @DisplayName("Should print the result set and exit 0 when every host succeeded")
        void shouldExitOk() {
            int exitCode = run(new ExecCLI(factory), "--hosts", hostsFile(), "-a", "echo hi");

            assertEquals(EngineCommand.EXIT_OK, exitCode);
            JSONObject results = new JSONObject(out.toString());
            assertEquals(3, results.getJSONArray("ok").length());
            assertEquals("echo hi", runtimes.get(0).getTasks().get(0).getModuleArgs());
        }

        @Test
        @DisplayName("Should exit 1 when a host failed")
        void shouldExitFailed() {
            behavior = (host, sink) -> sink.recordUnreachable(host.getName(), "", Map.of("msg", "timed out"));

            int exitCode = run(new ExecCLI(factory), "--hosts", hostsFile(), "-p", "web", "-a", "uptime");

            assertEquals(EngineCommand.EXIT_FAILED, exitCode);
            assertEquals(1, new JSONObject(out.toString()).getJSONArray("unreachable").length());
        }

        @Test
        @DisplayName("Should exit 1 when no host matched")
        void shouldExitNoMatch() {
            int exitCode = run(new ExecCLI(factory), "--hosts", hostsFile(), "-p", "nowhere");

            assertEquals(EngineCommand.EXIT_FAILED, exitCode);
            assertFalse(new JSONObject(out.toString()).isNull("error"));
        }

        @Test
        @DisplayName("Should exit 3 and print the notice when the arguments are refused")
        void shouldExitRejected() {
            int exitCode = run(new ExecCLI(factory), "--hosts", hostsFile(), "-a", "echo {{ ansible_become_pass }}");

            assertEquals(EngineCommand.EXIT_REJECTED, exitCode);
            assertEquals("ansible_become_pass", new JSONObject(out.toString()).getString("variable"));
            assertTrue(runtimes.isEmpty());
        }

        @Test
        @DisplayName("Should exit 2 without any inventory")
        void shouldRequireInventory() {
            int exitCode = run(new ExecCLI(factory), "-a", "uptime");

            assertEquals(EngineCommand.EXIT_USAGE, exitCode);
            assertTrue(err.toString().contains("--inventory"));
        }

        @Test
        @DisplayName("Should exit 2 on a malformed host list")
        void shouldRejectMalformedHostList() throws IOException {
            Path hosts = Files.writeString(tempDir.resolve("hosts.json"), "{\"hostname\": ");

            assertEquals(EngineCommand.EXIT_USAGE, run(new ExecCLI(factory), "--hosts", hosts.toString()));
        }

        @Test
        @DisplayName("Should exit 1 when the host list cannot be read")
        void shouldFailOnMissingFile() {
            int exitCode = run(new ExecCLI(factory), "--hosts", tempDir.resolve("absent.json").toString());

            assertEquals(EngineCommand.EXIT_FAILED, exitCode);
        }

        @Test
        @DisplayName("Should refuse a host defined in both the INI inventory and the host list")
        void shouldRefuseHostInBothInputs() {
            int exitCode = run(new ExecCLI(factory),
                "-i", TestResources.path("/test-inventory.ini").toString(),
                "--hosts", TestResources.path("/hosts.json").toString());

            assertEquals(EngineCommand.EXIT_USAGE, exitCode);
            assertTrue(err.toString().contains("git"));
        }
    }

    @Nested
    @DisplayName("playbook")
    class Playbook {

        @Test
        @DisplayName("Should run an accepted playbook")
        void shouldRunPlaybook() {
            int exitCode = run(new PlaybookCLI(factory),
                "--hosts", hostsFile(), TestResources.path("/playbooks/site.yml").toString());

            assertEquals(EngineCommand.EXIT_OK, exitCode);
            assertEquals(1, runtimes.get(0).getPlaybooks().size());
        }

        @Test
        @DisplayName("Should exit 3 for a playbook reading host variables")
        void shouldRejectPlaybook() {
            int exitCode = run(new PlaybookCLI(factory),
                "--hosts", hostsFile(), TestResources.path("/playbooks/leak.yml").toString());

            assertEquals(EngineCommand.EXIT_REJECTED, exitCode);
            assertEquals("playbook", new JSONObject(out.toString()).getString("source"));
        }

        @Test
        @DisplayName("Should exit 2 for a missing playbook")
        void shouldRequirePlaybookFile() {
            int exitCode = run(new PlaybookCLI(factory),
                "--hosts", hostsFile(), tempDir.resolve("absent.yml").toString());

            assertEquals(EngineCommand.EXIT_USAGE, exitCode);
            assertTrue(runtimes.isEmpty());
        }
    }

    @Test
    @DisplayName("facts should print one summary per host")
    void shouldPrintFacts() {
        behavior = (host, sink) -> sink.recordOk(host.getName(), "",
            Map.of("ansible_facts", Map.of("ansible_hostname", host.getName(), "ansible_memtotal_mb", 2048)));

        int exitCode = run(new FactsCLI(factory), "--hosts", hostsFile(), "-p", "scm");

        assertEquals(EngineCommand.EXIT_OK, exitCode);
        JSONArray infos = new JSONArray(out.toString());
        assertEquals(1, infos.length());
        assertEquals("git", infos.getJSONObject(0).getString("hostname"));
        assertEquals(2, infos.getJSONObject(0).getInt("ram_total"));
        assertEquals("setup", runtimes.get(0).getTasks().get(0).getModuleName());
    }

    @Test
    @DisplayName("Should print usage and exit 2 without a subcommand")
    void shouldPrintUsage() {
        int exitCode = run(new GatewayCLI());

        assertEquals(EngineCommand.EXIT_USAGE, exitCode);
        assertTrue(err.toString().contains("exec-gateway"));
    }
}
