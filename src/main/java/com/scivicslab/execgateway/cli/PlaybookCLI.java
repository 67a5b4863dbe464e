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

import java.io.File;
import java.util.Optional;

import com.scivicslab.execgateway.engine.ExecutionEngine;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;
import com.scivicslab.execgateway.result.ResultSet;
import com.scivicslab.execgateway.safety.RejectionNotice;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI subcommand running a playbook, limited to the matching hosts.
 *
 * <h2>Usage</h2>
 * <pre>
 * exec-gateway playbook -i hosts.ini -p db site.yml
 * </pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "playbook",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Run a playbook on the hosts matching a pattern."
)
public class PlaybookCLI extends EngineCommand {

    @Parameters(
        index = "0",
        description = "Playbook file"
    )
    File playbook;

    public PlaybookCLI() {
        super();
    }

    PlaybookCLI(TaskRuntimeFactory runtimeFactory) {
        super(runtimeFactory);
    }

    @Override
    protected String validate() {
        if (!playbook.isFile()) {
            return "Playbook not found: " + playbook;
        }
        return null;
    }

    @Override
    protected int execute(ExecutionEngine engine, String pattern) {
        Optional<RejectionNotice> rejection = engine.runPlaybook(playbook.toPath(), pattern);
        if (rejection.isPresent()) {
            out().println(rejection.get().toJson().toString(2));
            return EXIT_REJECTED;
        }
        ResultSet results = engine.getResults();
        out().println(results.toJson().toString(2));
        return exitCode(results);
    }
}
