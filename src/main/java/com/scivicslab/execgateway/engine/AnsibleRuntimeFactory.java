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

import com.scivicslab.execgateway.exec.CommandExecutor;
import com.scivicslab.execgateway.exec.LocalCommandExecutor;

/**
 * Creates {@link AnsibleTaskRuntime}s.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class AnsibleRuntimeFactory implements TaskRuntimeFactory {

    private final CommandExecutor executor;

    /**
     * Constructs a factory whose runtimes launch local processes, bounded by
     * the command timeout of the engine options.
     */
    public AnsibleRuntimeFactory() {
        this(null);
    }

    /**
     * Constructs a factory whose runtimes use the given executor.
     *
     * @param executor the executor, or null for a {@link LocalCommandExecutor}
     */
    public AnsibleRuntimeFactory(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public TaskRuntime create(EngineOptions options, VariableManager variables) throws IOException {
        CommandExecutor processExecutor = executor != null
            ? executor
            : new LocalCommandExecutor(options.getCommandTimeoutSeconds());
        return new AnsibleTaskRuntime(options, variables, processExecutor);
    }
}
