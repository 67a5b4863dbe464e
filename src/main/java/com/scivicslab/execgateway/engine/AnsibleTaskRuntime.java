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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.json.JSONObject;

import com.scivicslab.execgateway.HostRecord;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.exec.CommandExecutor;
import com.scivicslab.execgateway.exec.CommandResult;
import com.scivicslab.execgateway.result.OutcomeSink;

/**
 * {@link TaskRuntime} that drives the {@code ansible} and
 * {@code ansible-playbook} command-line tools.
 *
 * <p>Each runtime owns a scratch directory (mode 0700) holding the generated
 * inventory, the extra-vars file and the engine's local temp directory, and a
 * fixed worker pool of {@code forks} threads. Ad-hoc runs start one engine
 * process per target host on that pool; hosts beyond the pool width wait for
 * a free worker. Playbook runs start a single {@code ansible-playbook}
 * process which fans out by itself with the same width.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class AnsibleTaskRuntime implements TaskRuntime {

    private static final Logger LOG = Logger.getLogger(AnsibleTaskRuntime.class.getName());

    private static final String INVENTORY_FILE = "inventory.yml";
    private static final String EXTRA_VARS_FILE = "extra-vars.json";
    private static final String LOCAL_TEMP_DIR = "tmp";

    private static final AtomicInteger RUNTIME_SEQUENCE = new AtomicInteger();

    private final EngineOptions options;
    private final VariableManager variables;
    private final CommandExecutor executor;
    private final AnsibleJsonOutputParser parser = new AnsibleJsonOutputParser();
    private final Path scratchDirectory;
    private final ExecutorService workers;

    /**
     * Constructs a runtime and allocates its scratch directory.
     *
     * @param options the engine options
     * @param variables the variables of the run
     * @param executor launches the engine processes
     * @throws IOException if the scratch directory cannot be created
     */
    public AnsibleTaskRuntime(EngineOptions options, VariableManager variables, CommandExecutor executor)
            throws IOException {
        this.options = options;
        this.variables = variables;
        this.executor = executor;
        this.scratchDirectory = createPrivateDirectory();
        Files.createDirectories(scratchDirectory.resolve(LOCAL_TEMP_DIR));
        this.workers = Executors.newFixedThreadPool(options.getForks(), workerThreads());
        LOG.fine("Runtime scratch directory: " + scratchDirectory);
    }

    @Override
    public void runAdHoc(ModuleTask task, Inventory inventory, Set<HostRecord> targets, OutcomeSink sink)
            throws IOException {
        Path inventoryFile = prepare(inventory);

        List<Future<?>> futures = new ArrayList<>();
        for (HostRecord target : targets) {
            futures.add(workers.submit(() -> runOnHost(task, target, inventoryFile, sink)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for hosts", e);
            } catch (ExecutionException e) {
                LOG.log(Level.SEVERE, "Worker failed", e.getCause());
            }
        }
    }

    private void runOnHost(ModuleTask task, HostRecord target, Path inventoryFile, OutcomeSink sink) {
        List<String> command = new ArrayList<>();
        command.add(executable("ansible"));
        command.add(target.getName());
        command.add("-i");
        command.add(inventoryFile.toString());
        command.add("-m");
        command.add(task.getModuleName());
        if (!task.getModuleArgs().isEmpty()) {
            command.add("-a");
            command.add(task.getModuleArgs());
        }
        command.add("--forks");
        command.add("1");
        addCommonOptions(command);

        CommandResult result;
        try {
            result = executor.execute(command, environment());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not start engine for host " + target.getName(), e);
            sink.recordFailed(target.getName(), task.getModuleName(),
                failurePayload("Could not start automation engine: " + e.getMessage(), null));
            return;
        }

        int recorded = 0;
        try {
            AnsibleJsonOutputParser.ParsedRun run = parser.parse(result.getStdout());
            for (AnsibleJsonOutputParser.ParsedOutcome outcome : run.getOutcomes()) {
                if (!target.getName().equals(outcome.getHost())) {
                    continue;
                }
                String taskName = outcome.getTaskName().isEmpty() ? task.getModuleName() : outcome.getTaskName();
                sink.record(outcome.getStatus(), outcome.getHost(), taskName, outcome.getPayload());
                recorded++;
            }
        } catch (IOException e) {
            LOG.warning("Unreadable engine output for host " + target.getName() + ": " + e.getMessage());
        }

        if (recorded == 0) {
            String message = result.getExitCode() == CommandResult.KILLED
                ? "Automation engine timed out"
                : "Automation engine reported no result";
            sink.recordFailed(target.getName(), task.getModuleName(), failurePayload(message, result));
        }
    }

    @Override
    public void runPlaybook(Path playbook, Inventory inventory, Set<HostRecord> targets, OutcomeSink sink)
            throws IOException {
        Path inventoryFile = prepare(inventory);

        List<String> command = new ArrayList<>();
        command.add(executable("ansible-playbook"));
        command.add("-i");
        command.add(inventoryFile.toString());
        command.add("--limit");
        command.add(targets.stream().map(HostRecord::getName).collect(Collectors.joining(",")));
        command.add("--forks");
        command.add(String.valueOf(options.getForks()));
        addCommonOptions(command);
        command.add(playbook.toAbsolutePath().toString());

        CommandResult result = executor.execute(command, environment());
        AnsibleJsonOutputParser.ParsedRun run;
        try {
            run = parser.parse(result.getStdout());
        } catch (IOException e) {
            throw new IOException("Playbook " + playbook.getFileName() + " exited with " + result.getExitCode()
                + ": " + result.getStderr(), e);
        }

        if (!run.hasAnyHost()) {
            sink.recordNoHostsMatched();
            return;
        }
        for (AnsibleJsonOutputParser.ParsedOutcome outcome : run.getOutcomes()) {
            sink.record(outcome.getStatus(), outcome.getHost(), outcome.getTaskName(), outcome.getPayload());
        }
    }

    @Override
    public Path getScratchDirectory() {
        return scratchDirectory;
    }

    @Override
    public void cleanup() {
        workers.shutdownNow();
    }

    /**
     * Builds the environment of every engine process.
     *
     * @return the environment variables
     */
    Map<String, String> environment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ANSIBLE_STDOUT_CALLBACK", "json");
        env.put("ANSIBLE_LOAD_CALLBACK_PLUGINS", "1");
        env.put("ANSIBLE_HOST_KEY_CHECKING", "False");
        env.put("ANSIBLE_RETRY_FILES_ENABLED", "False");
        env.put("ANSIBLE_NOCOLOR", "1");
        env.put("ANSIBLE_LOCAL_TEMP", scratchDirectory.resolve(LOCAL_TEMP_DIR).toString());
        return env;
    }

    private void addCommonOptions(List<String> command) {
        command.add("--timeout");
        command.add(String.valueOf(options.getTimeoutSeconds()));
        if (options.getRemoteUser() != null) {
            command.add("-u");
            command.add(options.getRemoteUser());
        }
        if (options.getPrivateKeyFile() != null) {
            command.add("--private-key");
            command.add(options.getPrivateKeyFile());
        }
        if (options.isCheck()) {
            command.add("--check");
        }
        if (!variables.getExtraVars().isEmpty()) {
            command.add("-e");
            command.add("@" + scratchDirectory.resolve(EXTRA_VARS_FILE));
        }
    }

    private Path prepare(Inventory inventory) throws IOException {
        Path inventoryFile = createPrivateFile(INVENTORY_FILE);
        new InventoryWriter(variables).write(inventory, inventoryFile);

        if (!variables.getExtraVars().isEmpty()) {
            Path extraVarsFile = createPrivateFile(EXTRA_VARS_FILE);
            Files.writeString(extraVarsFile, new JSONObject(variables.getExtraVars()).toString(),
                StandardCharsets.UTF_8);
        }
        return inventoryFile;
    }

    private String executable(String name) {
        Path bin = options.getAnsibleBin();
        return bin == null ? name : bin.resolve(name).toString();
    }

    private Map<String, Object> failurePayload(String message, CommandResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("msg", message);
        if (result != null) {
            payload.put("rc", result.getExitCode());
            payload.put("stdout", result.getStdout());
            payload.put("stderr", result.getStderr());
        }
        return payload;
    }

    private Path createPrivateFile(String name) throws IOException {
        Path file = scratchDirectory.resolve(name);
        Files.deleteIfExists(file);
        try {
            return Files.createFile(file, ownerOnly("rw-------"));
        } catch (UnsupportedOperationException e) {
            return Files.createFile(file);
        }
    }

    private static Path createPrivateDirectory() throws IOException {
        try {
            return Files.createTempDirectory("exec-gateway-", ownerOnly("rwx------"));
        } catch (UnsupportedOperationException e) {
            return Files.createTempDirectory("exec-gateway-");
        }
    }

    private static FileAttribute<Set<PosixFilePermission>> ownerOnly(String permissions) {
        return PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString(permissions));
    }

    private static ThreadFactory workerThreads() {
        int runtimeId = RUNTIME_SEQUENCE.incrementAndGet();
        AtomicInteger threadId = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "runtime-" + runtimeId + "-worker-" + threadId.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
