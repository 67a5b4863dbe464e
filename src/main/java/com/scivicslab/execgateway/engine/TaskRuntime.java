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
import java.nio.file.Path;
import java.util.Set;

import com.scivicslab.execgateway.HostRecord;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.result.OutcomeSink;

/**
 * The concurrent task-execution runtime of one run.
 *
 * <p>A runtime is created per run by a {@link TaskRuntimeFactory}, used for
 * exactly one execution and then released by the {@link ExecutionEngine}:
 * {@link #cleanup()} first, then the scratch directory is deleted.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface TaskRuntime {

    /**
     * Runs one module on every target host and blocks until each host has
     * reported. Every target reports exactly one outcome to the sink.
     *
     * @param task the module invocation
     * @param inventory the inventory of the run
     * @param targets the hosts to run on, never empty
     * @param sink receives the outcomes
     * @throws IOException if the run cannot be carried out at all
     */
    void runAdHoc(ModuleTask task, Inventory inventory, Set<HostRecord> targets, OutcomeSink sink)
        throws IOException;

    /**
     * Runs all tasks of a playbook, limited to the target hosts, and blocks
     * until the playbook has finished.
     *
     * @param playbook the playbook file
     * @param inventory the inventory of the run
     * @param targets the hosts the playbook may touch, never empty
     * @param sink receives the outcomes in play and task order
     * @throws IOException if the playbook cannot be run or its result read
     */
    void runPlaybook(Path playbook, Inventory inventory, Set<HostRecord> targets, OutcomeSink sink)
        throws IOException;

    /**
     * Gets the private working directory of this runtime.
     *
     * @return the scratch directory
     */
    Path getScratchDirectory();

    /**
     * Releases workers and other resources held by this runtime.
     */
    void cleanup();
}
