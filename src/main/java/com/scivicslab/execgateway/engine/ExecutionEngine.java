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
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.scivicslab.execgateway.HostRecord;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.facts.FactsSummarizer;
import com.scivicslab.execgateway.facts.HostInfo;
import com.scivicslab.execgateway.result.ResultCollector;
import com.scivicslab.execgateway.result.ResultSet;
import com.scivicslab.execgateway.safety.DenyListSafetyFilter;
import com.scivicslab.execgateway.safety.RejectionNotice;
import com.scivicslab.execgateway.safety.SafetyFilter;

/**
 * Runs modules and playbooks against an inventory and collects the outcomes.
 *
 * <p>An engine is built per request together with its inventory and its
 * {@link ResultCollector}; nothing is shared between requests. Calls block
 * until every dispatched host has reported or timed out.</p>
 *
 * <p>No exception leaves the public entry points. Per-host results land in
 * the collector, a pattern matching no host sets the collector's global
 * error, text refused by the {@link SafetyFilter} yields a
 * {@link RejectionNotice}, and engine faults are logged. Every run that
 * acquired a {@link TaskRuntime} releases it exactly once and deletes its
 * scratch directory, however the run ends.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Inventory inventory = new InventoryBuilder(HostRecord.CONNECTION_PARAMIKO).build(descriptors);
 * ResultCollector collector = new ResultCollector();
 * ExecutionEngine engine = new ExecutionEngine(EngineOptions.defaults(), inventory, collector);
 *
 * engine.runCommand("uptime", "web");
 * ResultSet results = collector.snapshot();
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class ExecutionEngine {

    private static final Logger LOG = Logger.getLogger(ExecutionEngine.class.getName());

    /** Module gathering system facts. */
    public static final String FACTS_MODULE = "setup";

    public static final String SHELL_MODULE = "shell";
    public static final String SCRIPT_MODULE = "script";
    public static final String COPY_MODULE = "copy";

    private final EngineOptions options;
    private final Inventory inventory;
    private final VariableManager variableManager;
    private final ResultCollector collector;
    private final TaskRuntimeFactory runtimeFactory;
    private final SafetyFilter safetyFilter;

    /**
     * Constructs an engine driving the Ansible tools with the default
     * safety filter.
     *
     * @param options the engine options
     * @param inventory the inventory of this request
     * @param collector the collector of this request
     */
    public ExecutionEngine(EngineOptions options, Inventory inventory, ResultCollector collector) {
        this(options, inventory, collector, new AnsibleRuntimeFactory(), new DenyListSafetyFilter());
    }

    /**
     * Constructs an engine with explicit collaborators.
     *
     * @param options the engine options
     * @param inventory the inventory of this request
     * @param collector the collector of this request
     * @param runtimeFactory creates the task runtime of each run
     * @param safetyFilter screens user supplied text
     */
    public ExecutionEngine(EngineOptions options, Inventory inventory, ResultCollector collector,
                           TaskRuntimeFactory runtimeFactory, SafetyFilter safetyFilter) {
        this.options = options;
        this.inventory = inventory;
        this.variableManager = new VariableManager(options.getExtraVars());
        this.collector = collector;
        this.runtimeFactory = runtimeFactory;
        this.safetyFilter = safetyFilter;
    }

    /**
     * Runs one module against the hosts matching a pattern, without
     * screening the arguments. Use {@link #runCheckedModule} for user input.
     *
     * @param moduleName the module, e.g. {@code shell}
     * @param moduleArgs the module arguments
     * @param hostPattern {@code all}, a group name or a host name
     */
    public void runModule(String moduleName, String moduleArgs, String hostPattern) {
        ModuleTask task;
        try {
            task = new ModuleTask(moduleName, moduleArgs);
        } catch (IllegalArgumentException e) {
            LOG.severe("Rejected module invocation: " + e.getMessage());
            return;
        }
        Set<HostRecord> targets = inventory.resolveHosts(hostPattern);
        execute("module " + moduleName + " on '" + hostPattern + "'", targets,
            runtime -> runtime.runAdHoc(task, inventory, targets, collector));
    }

    /**
     * Screens the module arguments and runs the module if they are clean.
     *
     * @param moduleName the module
     * @param moduleArgs the user supplied arguments
     * @param hostPattern the host pattern
     * @return the rejection notice, or empty if the module was run
     */
    public Optional<RejectionNotice> runCheckedModule(String moduleName, String moduleArgs, String hostPattern) {
        Optional<RejectionNotice> rejection = screen(moduleArgs, RejectionNotice.Source.ARGUMENTS);
        if (rejection.isEmpty()) {
            runModule(moduleName, moduleArgs, hostPattern);
        }
        return rejection;
    }

    /**
     * Runs a shell command line.
     *
     * @param command the command line
     * @param hostPattern the host pattern
     * @return the rejection notice, or empty if the command was run
     */
    public Optional<RejectionNotice> runCommand(String command, String hostPattern) {
        return runCheckedModule(SHELL_MODULE, command, hostPattern);
    }

    /**
     * Transfers a local script to the hosts and runs it.
     *
     * @param scriptArgs the script path followed by its arguments
     * @param hostPattern the host pattern
     * @return the rejection notice, or empty if the script was run
     */
    public Optional<RejectionNotice> runScript(String scriptArgs, String hostPattern) {
        return runCheckedModule(SCRIPT_MODULE, scriptArgs, hostPattern);
    }

    /**
     * Copies a file to the hosts.
     *
     * @param copyArgs the {@code copy} module arguments, e.g. {@code src=/tmp/a dest=/etc/a}
     * @param hostPattern the host pattern
     * @param uploadedSource a temporary local source to delete afterwards, or null
     * @return the rejection notice, or empty if the copy was run
     */
    public Optional<RejectionNotice> runCopy(String copyArgs, String hostPattern, Path uploadedSource) {
        try {
            return runCheckedModule(COPY_MODULE, copyArgs, hostPattern);
        } finally {
            if (uploadedSource != null) {
                try {
                    Files.deleteIfExists(uploadedSource);
                } catch (IOException e) {
                    LOG.log(Level.WARNING, "Failed to delete uploaded file " + uploadedSource, e);
                }
            }
        }
    }

    /**
     * Screens a playbook and runs all of its tasks, limited to the hosts
     * matching a pattern.
     *
     * @param playbook the playbook file
     * @param hostPattern the host pattern
     * @return the rejection notice, or empty if the playbook was run or
     *         could not be read
     */
    public Optional<RejectionNotice> runPlaybook(Path playbook, String hostPattern) {
        String content;
        try {
            content = Files.readString(playbook, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.SEVERE, "Cannot read playbook " + playbook, e);
            return Optional.empty();
        }

        Optional<RejectionNotice> rejection = screen(content, RejectionNotice.Source.PLAYBOOK);
        if (rejection.isPresent()) {
            return rejection;
        }

        Set<HostRecord> targets = inventory.resolveHosts(hostPattern);
        execute("playbook " + playbook.getFileName() + " on '" + hostPattern + "'", targets,
            runtime -> runtime.runPlaybook(playbook, inventory, targets, collector));
        return Optional.empty();
    }

    /**
     * Gathers facts from the matching hosts and summarizes them.
     *
     * <p>Hosts that failed or were unreachable stay visible through the
     * collector.</p>
     *
     * @param hostPattern the host pattern
     * @return one summary per host that answered
     */
    public List<HostInfo> getServerInfo(String hostPattern) {
        runModule(FACTS_MODULE, "", hostPattern);
        return new FactsSummarizer().summarize(collector.snapshot());
    }

    /**
     * Gets the outcomes collected so far.
     *
     * @return the collector's snapshot
     */
    public ResultSet getResults() {
        return collector.snapshot();
    }

    public EngineOptions getOptions() {
        return options;
    }

    public VariableManager getVariableManager() {
        return variableManager;
    }

    private Optional<RejectionNotice> screen(String text, RejectionNotice.Source source) {
        Optional<String> offending = safetyFilter.scan(text);
        if (offending.isEmpty()) {
            return Optional.empty();
        }
        RejectionNotice notice = new RejectionNotice(source, offending.get());
        LOG.warning(notice.getMessage());
        return Optional.of(notice);
    }

    private void execute(String description, Set<HostRecord> targets, RuntimeAction action) {
        Optional<TaskRuntime> runtime = acquireRuntime();
        try {
            if (targets.isEmpty()) {
                LOG.info("No hosts matched for " + description);
                collector.recordNoHostsMatched();
                return;
            }
            if (runtime.isEmpty()) {
                return;
            }
            LOG.info("Running " + description + " on " + targets.size() + " host(s)");
            action.run(runtime.get());
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Execution failed: " + description, e);
        } finally {
            runtime.ifPresent(this::teardown);
        }
    }

    private Optional<TaskRuntime> acquireRuntime() {
        try {
            return Optional.of(runtimeFactory.create(options, variableManager));
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.SEVERE, "Cannot create task runtime", e);
            return Optional.empty();
        }
    }

    private void teardown(TaskRuntime runtime) {
        try {
            runtime.cleanup();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Task runtime cleanup failed", e);
        } finally {
            purge(runtime.getScratchDirectory());
        }
    }

    private static void purge(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warning("Failed to delete " + path + ": " + e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to purge scratch directory " + directory, e);
        }
    }

    /**
     * Work done with an acquired runtime.
     */
    @FunctionalInterface
    private interface RuntimeAction {
        void run(TaskRuntime runtime) throws IOException;
    }
}
