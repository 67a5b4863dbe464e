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

import java.util.List;

import org.json.JSONArray;

import com.scivicslab.execgateway.engine.ExecutionEngine;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;
import com.scivicslab.execgateway.facts.HostInfo;
import com.scivicslab.execgateway.result.ResultSet;

import picocli.CommandLine.Command;

/**
 * CLI subcommand printing a hardware and OS summary per host.
 *
 * <h2>Usage</h2>
 * <pre>
 * exec-gateway facts -i hosts.ini -p all
 * </pre>
 *
 * <p>Hosts that failed or were unreachable are absent from the output and
 * turn the exit code to 1.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "facts",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Gather and summarize system facts of the matching hosts."
)
public class FactsCLI extends EngineCommand {

    public FactsCLI() {
        super();
    }

    FactsCLI(TaskRuntimeFactory runtimeFactory) {
        super(runtimeFactory);
    }

    @Override
    protected int execute(ExecutionEngine engine, String pattern) {
        List<HostInfo> infos = engine.getServerInfo(pattern);
        JSONArray array = new JSONArray();
        infos.forEach(info -> array.put(info.toJson()));
        out().println(array.toString(2));

        ResultSet results = engine.getResults();
        return exitCode(results);
    }
}
