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

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Abstraction for launching the automation engine's command-line tools.
 *
 * <p>The task runtime talks to this interface only, so tests can replace the
 * real processes with canned output.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface CommandExecutor {

    /**
     * Runs a command and waits for it to finish.
     *
     * @param command the program and its arguments, not passed through a shell
     * @param environment variables added to the inherited environment
     * @return the result of command execution
     * @throws IOException if the process cannot be started
     */
    CommandResult execute(List<String> command, Map<String, String> environment) throws IOException;
}
