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
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import com.scivicslab.execgateway.GatewayConfig;

import picocli.CommandLine.Option;

/**
 * Options shared by every subcommand: configuration file and logging.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class CommonOptions {

    private static final Logger LOG = Logger.getLogger(CommonOptions.class.getName());

    @Option(
        names = {"--config"},
        description = "Properties file overriding the bundled gateway.properties"
    )
    File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    boolean verbose;

    @Option(
        names = {"--log-file"},
        description = "Also write log records to this file"
    )
    File logFile;

    private FileHandler fileHandler;

    /**
     * Loads the configuration, honoring {@code --config}.
     *
     * @return the configuration
     * @throws IOException if the configuration file cannot be read
     */
    GatewayConfig loadConfig() throws IOException {
        return GatewayConfig.load(configFile == null ? null : configFile.toPath());
    }

    /**
     * Sets up file logging and the log level.
     *
     * @throws IOException if the log file cannot be opened
     */
    void configureLogging() throws IOException {
        Logger rootLogger = Logger.getLogger("");
        if (logFile != null) {
            fileHandler = new FileHandler(logFile.getAbsolutePath(), true);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        }
        configureLogLevel(verbose);
    }

    /**
     * Configures log level based on verbose flag.
     */
    private static void configureLogLevel(boolean verbose) {
        Level targetLevel = verbose ? Level.FINE : Level.INFO;

        Logger rootLogger = Logger.getLogger("");
        rootLogger.setLevel(targetLevel);

        // the console shows warnings only unless verbose
        for (Handler handler : rootLogger.getHandlers()) {
            handler.setLevel(targetLevel);
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(verbose ? Level.FINE : Level.WARNING);
            }
        }

        if (verbose) {
            LOG.info("Verbose mode enabled - log level set to FINE");
        }
    }

    /**
     * Detaches and closes the log file handler, if any.
     */
    void closeLogging() {
        if (fileHandler != null) {
            Logger.getLogger("").removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
        }
    }
}
