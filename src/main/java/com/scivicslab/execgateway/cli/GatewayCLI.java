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

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code exec-gateway} command.
 *
 * <h2>Usage</h2>
 * <pre>
 * exec-gateway serve --port 8000
 * exec-gateway exec -i hosts.ini -p web -a "uptime"
 * exec-gateway playbook -i hosts.ini site.yml
 * exec-gateway facts --hosts hosts.json
 * </pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "exec-gateway",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Run commands and playbooks on remote hosts.",
    subcommands = {
        ServeCLI.class,
        ExecCLI.class,
        PlaybookCLI.class,
        FactsCLI.class
    }
)
public class GatewayCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new GatewayCLI()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EngineCommand.EXIT_USAGE;
    }
}
