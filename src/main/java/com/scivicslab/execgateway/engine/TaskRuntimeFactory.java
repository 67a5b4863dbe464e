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

/**
 * Creates the {@link TaskRuntime} of a run.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskRuntimeFactory {

    /**
     * Creates a runtime bound to the given settings.
     *
     * @param options the engine options
     * @param variables the variables of the run
     * @return a new runtime
     * @throws IOException if the scratch directory cannot be set up
     */
    TaskRuntime create(EngineOptions options, VariableManager variables) throws IOException;
}
