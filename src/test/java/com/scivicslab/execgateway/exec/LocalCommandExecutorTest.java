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

package com.scivicslab.execgateway.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

/**
 * Tests for LocalCommandExecutor.
 *
 * <p>These tests start real processes on the local machine.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@DisplayName("LocalCommandExecutor")
@EnabledOnOs({OS.LINUX, OS.MAC})
public class LocalCommandExecutorTest {

    private LocalCommandExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new LocalCommandExecutor();
    }

    private static List<String> sh(String script) {
        return List.of("/bin/sh", "-c", script);
    }

    @Nested
    @DisplayName("Basic Command Execution")
    class BasicExecution {

        @Test
        @DisplayName("Should capture stdout and exit code")
        void shouldCaptureStdout() throws IOException {
            CommandResult result = executor.execute(sh("echo 'Hello World'"), Map.of());

            assertTrue(result.isSuccess());
            assertEquals("Hello World", result.getStdout());
            assertEquals(0, result.getExitCode());
        }

        @Test
        @DisplayName("Should capture stderr separately")
        void shouldCaptureStderr() throws IOException {
            CommandResult result = executor.execute(sh("echo out; echo err >&2; exit 3"), Map.of());

            assertFalse(result.isSuccess());
            assertEquals(3, result.getExitCode());
            assertEquals("out", result.getStdout());
            assertEquals("err", result.getStderr());
        }

        @Test
        @DisplayName("Should pass the environment to the process")
        void shouldPassEnvironment() throws IOException {
            CommandResult result = executor.execute(sh("echo $ANSIBLE_STDOUT_CALLBACK"),
                Map.of("ANSIBLE_STDOUT_CALLBACK", "json"));

            assertEquals("json", result.getStdout());
        }

        @Test
        @DisplayName("Should not split arguments containing spaces")
        void shouldKeepArgumentsWhole() throws IOException {
            CommandResult result = executor.execute(List.of("/bin/echo", "a  b"), Map.of());

            assertEquals("a  b", result.getStdout());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should throw when the executable does not exist")
        void shouldThrowForMissingExecutable() {
            assertThrows(IOException.class,
                () -> executor.execute(List.of("/nonexistent/ansible"), Map.of()));
        }

        @Test
        @DisplayName("Should kill a process exceeding the timeout")
        void shouldKillOnTimeout() throws IOException {
            LocalCommandExecutor quick = new LocalCommandExecutor(1);

            CommandResult result = quick.execute(sh("sleep 10"), Map.of());

            assertEquals(CommandResult.KILLED, result.getExitCode());
            assertEquals("Command timed out", result.getStderr());
        }
    }
}
