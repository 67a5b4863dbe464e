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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command executor that runs processes on the gateway machine.
 *
 * <p>stdout and stderr are drained on separate threads so a chatty process
 * cannot block on a full pipe. A process still running after the timeout is
 * killed and reported with exit code {@link CommandResult#KILLED}.</p>
 *
 * @author devteam@scivicslab.com
 */
public class LocalCommandExecutor implements CommandExecutor {

    private static final Logger LOG = Logger.getLogger(LocalCommandExecutor.class.getName());

    /** Default wall clock limit for one process. */
    public static final long DEFAULT_TIMEOUT_SECONDS = 300;

    private final long timeoutSeconds;

    /**
     * Constructs a local command executor with the default timeout.
     */
    public LocalCommandExecutor() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Constructs a local command executor.
     *
     * @param timeoutSeconds wall clock limit for one process
     */
    public LocalCommandExecutor(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public CommandResult execute(List<String> command, Map<String, String> environment) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(environment);
        pb.redirectErrorStream(false);

        LOG.fine(() -> "Starting: " + String.join(" ", command));
        Process process = pb.start();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Thread stdoutThread = drain(process.getInputStream(), stdout, "stdout");
        Thread stderrThread = drain(process.getErrorStream(), stderr, "stderr");

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                LOG.warning("Process timed out after " + timeoutSeconds + "s: " + command.get(0));
                return new CommandResult(snapshot(stdout), "Command timed out", CommandResult.KILLED);
            }

            stdoutThread.join(1000);
            stderrThread.join(1000);

            int exitCode = process.exitValue();
            return new CommandResult(snapshot(stdout).trim(), snapshot(stderr).trim(), exitCode);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(snapshot(stdout), "Interrupted: " + e.getMessage(), CommandResult.KILLED);
        }
    }

    private static Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                LOG.log(Level.FINE, "Stream closed while reading " + name, e);
            }
        }, "exec-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
