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

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-engine settings, fixed at construction and never changed during a run.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EngineOptions options = new EngineOptions.Builder()
 *     .forks(8)
 *     .remoteUser("deploy")
 *     .build();
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class EngineOptions {

    /** Default connection timeout in seconds. */
    public static final int DEFAULT_TIMEOUT_SECONDS = 15;

    /** Default wall clock limit of one engine process in seconds. */
    public static final long DEFAULT_COMMAND_TIMEOUT_SECONDS = 300;

    /** Default remote login user. */
    public static final String DEFAULT_REMOTE_USER = "root";

    private final boolean check;
    private final int forks;
    private final String remoteUser;
    private final String privateKeyFile;
    private final Map<String, Object> extraVars;
    private final int timeoutSeconds;
    private final long commandTimeoutSeconds;
    private final Path ansibleBin;

    private EngineOptions(Builder builder) {
        this.check = builder.check;
        this.forks = builder.forks;
        this.remoteUser = builder.remoteUser;
        this.privateKeyFile = builder.privateKeyFile;
        this.extraVars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraVars));
        this.timeoutSeconds = builder.timeoutSeconds;
        this.commandTimeoutSeconds = builder.commandTimeoutSeconds;
        this.ansibleBin = builder.ansibleBin;
    }

    /**
     * Gets the default concurrency width: twice the available processors.
     *
     * @return the default number of forks
     */
    public static int defaultForks() {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    /**
     * Creates options with every default.
     *
     * @return default options
     */
    public static EngineOptions defaults() {
        return new Builder().build();
    }

    /** Dry run: report what would change without changing it. */
    public boolean isCheck() {
        return check;
    }

    public int getForks() {
        return forks;
    }

    public String getRemoteUser() {
        return remoteUser;
    }

    /**
     * Gets the default private key file.
     *
     * @return the key path, or null to rely on host variables or an agent
     */
    public String getPrivateKeyFile() {
        return privateKeyFile;
    }

    public Map<String, Object> getExtraVars() {
        return extraVars;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    /**
     * Gets the directory holding the engine executables.
     *
     * @return the directory, or null to resolve them from PATH
     */
    public Path getAnsibleBin() {
        return ansibleBin;
    }

    @Override
    public String toString() {
        return String.format("EngineOptions{check=%s, forks=%d, remoteUser='%s', timeout=%ds, extraVars=%s}",
            check, forks, remoteUser, timeoutSeconds, extraVars.keySet());
    }

    /**
     * Builder for creating EngineOptions instances with fluent API.
     */
    public static class Builder {
        private boolean check;
        private int forks = defaultForks();
        private String remoteUser = DEFAULT_REMOTE_USER;
        private String privateKeyFile;
        private final Map<String, Object> extraVars = new LinkedHashMap<>();
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private long commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_SECONDS;
        private Path ansibleBin;

        public Builder check(boolean check) {
            this.check = check;
            return this;
        }

        public Builder forks(int forks) {
            if (forks < 1) {
                throw new IllegalArgumentException("forks must be positive: " + forks);
            }
            this.forks = forks;
            return this;
        }

        public Builder remoteUser(String remoteUser) {
            this.remoteUser = remoteUser;
            return this;
        }

        public Builder privateKeyFile(String privateKeyFile) {
            this.privateKeyFile = privateKeyFile;
            return this;
        }

        public Builder extraVars(Map<String, ?> extraVars) {
            this.extraVars.putAll(extraVars);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            if (timeoutSeconds < 1) {
                throw new IllegalArgumentException("timeout must be positive: " + timeoutSeconds);
            }
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder commandTimeoutSeconds(long commandTimeoutSeconds) {
            if (commandTimeoutSeconds < 1) {
                throw new IllegalArgumentException("command timeout must be positive: " + commandTimeoutSeconds);
            }
            this.commandTimeoutSeconds = commandTimeoutSeconds;
            return this;
        }

        public Builder ansibleBin(Path ansibleBin) {
            this.ansibleBin = ansibleBin;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
