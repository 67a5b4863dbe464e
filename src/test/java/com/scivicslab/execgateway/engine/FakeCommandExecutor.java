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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.scivicslab.execgateway.exec.CommandExecutor;
import com.scivicslab.execgateway.exec.CommandResult;

/**
 * CommandExecutor that records the command lines it is given and answers
 * with canned engine output instead of starting processes.
 */
public class FakeCommandExecutor implements CommandExecutor {

    private final Function<List<String>, CommandResult> responder;
    private final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, String>> environments = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param responder computes the result of a command line; returning null
     *        makes the launch fail with an IOException
     */
    public FakeCommandExecutor(Function<List<String>, CommandResult> responder) {
        this.responder = responder;
    }

    public static FakeCommandExecutor returning(String stdout) {
        return new FakeCommandExecutor(command -> new CommandResult(stdout, "", 0));
    }

    @Override
    public CommandResult execute(List<String> command, Map<String, String> environment) throws IOException {
        commands.add(List.copyOf(command));
        environments.add(Map.copyOf(environment));
        CommandResult result = responder.apply(command);
        if (result == null) {
            throw new IOException("Cannot run program \"" + command.get(0) + "\"");
        }
        return result;
    }

    public List<List<String>> getCommands() {
        return commands;
    }

    public List<String> lastCommand() {
        return commands.get(commands.size() - 1);
    }

    public Map<String, String> lastEnvironment() {
        return environments.get(environments.size() - 1);
    }

    /**
     * Gets the value following an option in a command line.
     *
     * @param command the command line
     * @param option the option, e.g. {@code -i}
     * @return the option value
     */
    public static String optionValue(List<String> command, String option) {
        int index = command.indexOf(option);
        if (index < 0 || index + 1 >= command.size()) {
            throw new AssertionError("Option " + option + " missing from " + command);
        }
        return command.get(index + 1);
    }

    /**
     * Builds the callback document of an ad-hoc run on one host.
     *
     * @param host the host name
     * @param result the host result JSON
     * @return the engine output
     */
    public static String adHocOutput(String host, String result) {
        return "{\"plays\": [{\"play\": {\"name\": \"Ansible Ad-Hoc\"}, \"tasks\": [{\"task\": {\"name\": \"\"}, "
            + "\"hosts\": {\"" + host + "\": " + result + "}}]}], \"stats\": {\"" + host + "\": {}}}";
    }
}
