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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.scivicslab.execgateway.ExecutionTarget;

/**
 * Supplies the variables of a run: per-host variables for the inventory and
 * engine-wide extra variables, which take precedence over everything else.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class VariableManager {

    private final Map<String, Object> extraVars;

    public VariableManager(Map<String, Object> extraVars) {
        this.extraVars = extraVars == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraVars));
    }

    public Map<String, Object> getExtraVars() {
        return extraVars;
    }

    /**
     * Gets the variables written for a host, without null values.
     *
     * @param target the host
     * @return a mutable copy of the host variables
     */
    public Map<String, Object> hostVariables(ExecutionTarget target) {
        Map<String, Object> vars = new LinkedHashMap<>();
        target.getVariables().forEach((key, value) -> {
            if (value != null) {
                vars.put(key, value);
            }
        });
        return vars;
    }
}
