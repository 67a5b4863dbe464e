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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;

import com.scivicslab.execgateway.GatewayConfig;
import com.scivicslab.execgateway.HostDescriptor;
import com.scivicslab.execgateway.Inventory;
import com.scivicslab.execgateway.InventoryBuilder;
import com.scivicslab.execgateway.InventoryParser;
import com.scivicslab.execgateway.engine.EngineOptions;

import picocli.CommandLine.Option;

/**
 * Options selecting the target hosts and tuning the engine.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class TargetOptions {

    @Option(
        names = {"-i", "--inventory"},
        description = "Path to Ansible INI inventory file"
    )
    File inventoryFile;

    @Option(
        names = {"--hosts"},
        description = "Path to a JSON array of host descriptors"
    )
    File hostsFile;

    @Option(
        names = {"-p", "--pattern"},
        description = "'all', a group name or a host name (default: ${DEFAULT-VALUE})",
        defaultValue = "all"
    )
    String pattern;

    @Option(
        names = {"--forks"},
        description = "Number of hosts worked on concurrently"
    )
    Integer forks;

    @Option(
        names = {"--check"},
        description = "Dry run: report changes without making them"
    )
    boolean check;

    /**
     * Reads the host descriptors from the inventory file and/or the JSON
     * host list and builds the inventory.
     *
     * @param config the gateway configuration
     * @return the inventory
     * @throws IOException if an input file cannot be read
     * @throws IllegalArgumentException if no input is given, a descriptor is
     *         invalid, or two hosts share a name
     */
    Inventory loadInventory(GatewayConfig config) throws IOException {
        if (inventoryFile == null && hostsFile == null) {
            throw new IllegalArgumentException("Either --inventory or --hosts is required");
        }

        List<HostDescriptor> descriptors = new ArrayList<>();
        if (inventoryFile != null) {
            try (InputStream is = Files.newInputStream(inventoryFile.toPath())) {
                descriptors.addAll(InventoryParser.parse(is).toDescriptors());
            }
        }
        if (hostsFile != null) {
            String json = Files.readString(hostsFile.toPath(), StandardCharsets.UTF_8);
            try {
                descriptors.addAll(HostDescriptor.fromJsonArray(new JSONArray(json)));
            } catch (JSONException e) {
                throw new IllegalArgumentException("Invalid host list " + hostsFile + ": " + e.getMessage(), e);
            }
        }
        return new InventoryBuilder(config.getConnectionType()).build(descriptors);
    }

    /**
     * Creates the engine options, command line values overriding the
     * configuration.
     *
     * @param config the gateway configuration
     * @return the engine options
     */
    EngineOptions engineOptions(GatewayConfig config) {
        EngineOptions.Builder builder = config.engineOptions();
        if (forks != null) {
            builder.forks(forks);
        }
        if (check) {
            builder.check(true);
        }
        return builder.build();
    }
}
