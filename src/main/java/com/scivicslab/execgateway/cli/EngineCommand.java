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

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

import com.scivicslab.execgateway.GatewayConfig;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.engine.AnsibleRuntimeFactory;
import com.scivicslab.execgateway.engine.EngineOptions;
import com.scivicslab.execgateway.engine.ExecutionEngine;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;
import com.scivicslab.execgateway.result.ResultSet;
import com.scivicslab.execgateway.result.ResultCollector;
import com.scivicslab.execgateway.safety.DenyListSafetyFilter;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base of the subcommands that run something against an inventory.
 *
 * <p>Exit codes:</p>
 * <ul>
 *   <li>0 - every host succeeded</li>
 *   <li>1 - a host failed or was unreachable, no host matched, or an input
 *       file could not be read</li>
 *   <li>2 - invalid input</li>
 *   <li>3 - refused by the safety filter</li>
 * </ul>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public abstract class EngineCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(EngineCommand.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_REJECTED = 3;

    @Mixin
    CommonOptions common;

    @Mixin
    TargetOptions targets;

    @Spec
    CommandSpec spec;

    private final TaskRuntimeFactory runtimeFactory;

    protected EngineCommand() {
        this(new AnsibleRuntimeFactory());
    }

    protected EngineCommand(TaskRuntimeFactory runtimeFactory) {
        this.runtimeFactory = runtimeFactory;
    }

    @Override
    public Integer call() {
        try {
            common.configureLogging();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Warning: Failed to setup file logging: " + e.getMessage());
        }

        try {
            String problem = validate();
            if (problem != null) {
                spec.commandLine().getErr().println(problem);
                return EXIT_USAGE;
            }

            GatewayConfig config = common.loadConfig();
            Inventory inventory = targets.loadInventory(config);
            EngineOptions options = targets.engineOptions(config);
            LOG.fine("Engine options: " + options);

            ResultCollector collector = new ResultCollector();
            ExecutionEngine engine = new ExecutionEngine(options, inventory, collector,
                runtimeFactory, new DenyListSafetyFilter());
            return execute(engine, targets.pattern);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            spec.commandLine().getOut().flush();
            spec.commandLine().getErr().flush();
            common.closeLogging();
        }
    }

    /**
     * Checks subcommand specific arguments before anything is loaded.
     *
     * @return a message describing the problem, or null if the arguments are usable
     */
    protected String validate() {
        return null;
    }

    /**
     * Runs the subcommand.
     *
     * @param engine the engine bound to the loaded inventory
     * @param pattern the host pattern
     * @return the exit code
     */
    protected abstract int execute(ExecutionEngine engine, String pattern);

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Maps a result set to an exit code.
     *
     * @param results the results of the run
     * @return {@link #EXIT_OK} if at least one host reported and none failed
     */
    protected static int exitCode(ResultSet results) {
        boolean clean = results.getError().isEmpty()
            && results.getFailed().isEmpty()
            && results.getUnreachable().isEmpty()
            && !results.getOk().isEmpty();
        return clean ? EXIT_OK : EXIT_FAILED;
    }
}
