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

package com.scivicslab.execgateway.gateway;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import org.json.JSONArray;
import org.json.JSONObject;

import com.scivicslab.execgateway.GatewayConfig;
import com.scivicslab.execgateway.HostDescriptor;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.InventoryBuilder;
import com.scivicslab.execgateway.engine.AnsibleRuntimeFactory;
import com.scivicslab.execgateway.engine.EngineOptions;
import com.scivicslab.execgateway.engine.ExecutionEngine;
import com.scivicslab.execgateway.engine.TaskRuntimeFactory;
import com.scivicslab.execgateway.result.ResultCollector;
import com.scivicslab.execgateway.result.ResultSet;
import com.scivicslab.execgateway.safety.DenyListSafetyFilter;
import com.scivicslab.execgateway.safety.RejectionNotice;
import com.scivicslab.execgateway.safety.SafetyFilter;

/**
 * Turns one client request into one execution and its JSON answer.
 *
 * <p>Every request gets its own inventory, collector and engine.</p>
 *
 * <h2>Single host</h2>
 * <pre>{@code
 * {"hostname": "git", "host": "192.168.5.2", "port": 22,
 *  "username": "root", "pass": "secret", "module": "shell", "cmd": "echo hi"}
 * }</pre>
 * <p>The answer is the first outcome of the run, or {@code {"error": ...}}.</p>
 *
 * <h2>Several hosts</h2>
 * <pre>{@code
 * {"hosts": [{...}, {...}], "pattern": "web", "module": "shell", "cmd": "uptime"}
 * }</pre>
 * <p>The answer is the whole result set.</p>
 *
 * <p>A request refused by the safety filter is answered with the rejection
 * notice. Host {@code vars} are screened as well as {@code cmd}, since a
 * variable is templated wherever the command references it.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class GatewayRequestHandler {

    private static final Logger LOG = Logger.getLogger(GatewayRequestHandler.class.getName());

    public static final String DEFAULT_MODULE = ExecutionEngine.SHELL_MODULE;
    public static final String DEFAULT_COMMAND = "ls -lha /tmp";

    private final GatewayConfig config;
    private final TaskRuntimeFactory runtimeFactory;
    private final SafetyFilter safetyFilter = new DenyListSafetyFilter();

    public GatewayRequestHandler(GatewayConfig config) {
        this(config, new AnsibleRuntimeFactory());
    }

    public GatewayRequestHandler(GatewayConfig config, TaskRuntimeFactory runtimeFactory) {
        this.config = config;
        this.runtimeFactory = runtimeFactory;
    }

    /**
     * Handles a request.
     *
     * @param request the request JSON
     * @return the answer JSON
     * @throws IllegalArgumentException if the request names no host, a host
     *         descriptor is invalid, or two hosts share a name
     */
    public JSONObject handle(JSONObject request) {
        JSONArray hostArray = request.optJSONArray("hosts");
        boolean multiHost = hostArray != null;

        List<HostDescriptor> descriptors;
        String pattern;
        if (multiHost) {
            descriptors = HostDescriptor.fromJsonArray(hostArray);
            pattern = request.optString("pattern", Inventory.ALL);
        } else {
            HostDescriptor descriptor = HostDescriptor.fromJson(request);
            descriptors = List.of(descriptor);
            pattern = firstNonBlank(descriptor.getHostname(), descriptor.getIp());
        }
        if (descriptors.isEmpty() || pattern == null) {
            throw new IllegalArgumentException("Request names no host");
        }

        Optional<RejectionNotice> varsRejection = screenHostVars(descriptors);
        if (varsRejection.isPresent()) {
            return varsRejection.get().toJson();
        }

        String module = request.optString("module", DEFAULT_MODULE);
        String command = request.optString("cmd", DEFAULT_COMMAND);

        Inventory inventory = new InventoryBuilder(config.getConnectionType()).build(descriptors);
        EngineOptions options = config.engineOptions().build();
        ResultCollector collector = new ResultCollector();
        ExecutionEngine engine = new ExecutionEngine(options, inventory, collector,
            runtimeFactory, safetyFilter);

        LOG.info(String.format("Request: module=%s pattern=%s hosts=%d", module, pattern, inventory.size()));
        Optional<RejectionNotice> rejection = engine.runCheckedModule(module, command, pattern);
        if (rejection.isPresent()) {
            return rejection.get().toJson();
        }

        ResultSet results = collector.snapshot();
        if (multiHost) {
            return results.toJson();
        }
        return results.firstOutcomeJson()
            .orElseGet(() -> new JSONObject().put("error", "No result was reported"));
    }

    private Optional<RejectionNotice> screenHostVars(List<HostDescriptor> descriptors) {
        for (HostDescriptor descriptor : descriptors) {
            Optional<String> offending = safetyFilter.scanValue(descriptor.getVars());
            if (offending.isPresent()) {
                RejectionNotice notice = new RejectionNotice(RejectionNotice.Source.HOST_VARS, offending.get());
                LOG.warning(notice.getMessage());
                return Optional.of(notice);
            }
        }
        return Optional.empty();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
