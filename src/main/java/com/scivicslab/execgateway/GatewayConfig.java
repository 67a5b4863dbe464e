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

package com.scivicslab.execgateway;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

import com.scivicslab.execgateway.engine.EngineOptions;

/**
 * Process-wide gateway settings.
 *
 * <p>Values are layered; later sources win:</p>
 * <ol>
 *   <li>{@code /gateway.properties} on the classpath</li>
 *   <li>an optional external properties file</li>
 *   <li>{@code gateway.*} system properties</li>
 * </ol>
 *
 * <p>Command line options override the result for one invocation by way of
 * the {@link EngineOptions.Builder} returned from {@link #engineOptions()}.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class GatewayConfig {

    private static final Logger LOG = Logger.getLogger(GatewayConfig.class.getName());

    public static final String PREFIX = "gateway.";

    public static final String CONNECTION = "gateway.connection";
    public static final String FORKS = "gateway.forks";
    public static final String TIMEOUT = "gateway.timeout";
    public static final String COMMAND_TIMEOUT = "gateway.command-timeout";
    public static final String REMOTE_USER = "gateway.remote-user";
    public static final String PRIVATE_KEY_FILE = "gateway.private-key-file";
    public static final String CHECK = "gateway.check";
    public static final String ANSIBLE_BIN = "gateway.ansible-bin";
    public static final String HTTP_BIND = "gateway.http.bind";
    public static final String HTTP_PORT = "gateway.http.port";

    public static final String DEFAULT_CONNECTION = HostRecord.CONNECTION_PARAMIKO;
    public static final String DEFAULT_HTTP_BIND = "0.0.0.0";
    public static final int DEFAULT_HTTP_PORT = 8000;

    private static final String CLASSPATH_RESOURCE = "/gateway.properties";

    private final Properties properties;

    GatewayConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads the configuration.
     *
     * @param externalFile an external properties file, or null
     * @return the configuration
     * @throws IOException if the external file cannot be read
     */
    public static GatewayConfig load(Path externalFile) throws IOException {
        Properties props = new Properties();

        try (InputStream is = GatewayConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        }

        if (externalFile != null) {
            try (InputStream is = Files.newInputStream(externalFile)) {
                props.load(is);
            }
            LOG.info("Loaded configuration from " + externalFile);
        }

        Properties system = System.getProperties();
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, system.getProperty(name));
            }
        }
        return new GatewayConfig(props);
    }

    /**
     * Gets the connection plugin used for every host record.
     *
     * @return {@code paramiko} or {@code ssh}
     */
    public String getConnectionType() {
        return get(CONNECTION, DEFAULT_CONNECTION);
    }

    public String getHttpBind() {
        return get(HTTP_BIND, DEFAULT_HTTP_BIND);
    }

    public int getHttpPort() {
        return getInt(HTTP_PORT, DEFAULT_HTTP_PORT);
    }

    /**
     * Creates an engine options builder preset from this configuration.
     *
     * @return the builder
     * @throws IllegalArgumentException if a numeric value is malformed or out of range
     */
    public EngineOptions.Builder engineOptions() {
        EngineOptions.Builder builder = new EngineOptions.Builder()
            .check(Boolean.parseBoolean(get(CHECK, "false")))
            .forks(getInt(FORKS, EngineOptions.defaultForks()))
            .timeoutSeconds(getInt(TIMEOUT, EngineOptions.DEFAULT_TIMEOUT_SECONDS))
            .commandTimeoutSeconds(getInt(COMMAND_TIMEOUT, (int) EngineOptions.DEFAULT_COMMAND_TIMEOUT_SECONDS))
            .remoteUser(get(REMOTE_USER, EngineOptions.DEFAULT_REMOTE_USER))
            .privateKeyFile(get(PRIVATE_KEY_FILE, null));

        String bin = get(ANSIBLE_BIN, null);
        if (bin != null) {
            builder.ansibleBin(Paths.get(bin));
        }
        return builder;
    }

    /**
     * Gets a raw value.
     *
     * @param key the property key
     * @param defaultValue returned when the key is absent or blank
     * @return the trimmed value
     */
    public String get(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }
}
