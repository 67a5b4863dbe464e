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

import java.util.Optional;

import com.scivicslab.execgateway.engine.ExecutionEngine;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;
import com.scivicslab.execgateway.result.ResultSet;
import com.scivicslab.execgateway.safety.RejectionNotice;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI subcommand running one module on the matching hosts.
 *
 * <h2>Usage</h2>
 * <pre>
 * exec-gateway exec -i hosts.ini -p web -a "uptime"
 * exec-gateway exec --hosts hosts.json -m copy -a "src=/tmp/motd dest=/etc/motd"
 * </pre>
 *
 * <p>Prints the result set as JSON, or the rejection notice when the
 * arguments reference a protected variable.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "exec",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Run one module on the hosts matching a pattern."
)
public class ExecCLI extends EngineCommand {

    @Option(
        names = {"-m", "--module"},
        description = "Module name (default: ${DEFAULT-VALUE})",
        defaultValue = "shell"
    )
    String module;

    @Option(
        names = {"-a", "--args"},
        description = "Module arguments",
        defaultValue = ""
    )
    String moduleArgs;

    public ExecCLI() {
        super();
    }

    ExecCLI(TaskRuntimeFactory runtimeFactory) {
        super(runtimeFactory);
    }

    @Override
    protected int execute(ExecutionEngine engine, String pattern) {
        Optional<RejectionNotice> rejection = engine.runCheckedModule(module, moduleArgs, pattern);
        if (rejection.isPresent()) {
            out().println(rejection.get().toJson().toString(2));
            return EXIT_REJECTED;
        }
        ResultSet results = engine.getResults();
        out().println(results.toJson().toString(2));
        return exitCode(results);
    }
}
