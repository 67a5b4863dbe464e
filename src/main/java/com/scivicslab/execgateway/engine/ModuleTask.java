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

import java.util.Objects;

/**
 * A single ad-hoc module invocation.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class ModuleTask {

    private final String moduleName;
    private final String moduleArgs;

    public ModuleTask(String moduleName, String moduleArgs) {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("Module name is required");
        }
        this.moduleName = moduleName;
        this.moduleArgs = moduleArgs == null ? "" : moduleArgs;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getModuleArgs() {
        return moduleArgs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModuleTask)) {
            return false;
        }
        ModuleTask other = (ModuleTask) o;
        return moduleName.equals(other.moduleName) && moduleArgs.equals(other.moduleArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName, moduleArgs);
    }

    @Override
    public String toString() {
        return moduleName + " " + moduleArgs;
    }
}
