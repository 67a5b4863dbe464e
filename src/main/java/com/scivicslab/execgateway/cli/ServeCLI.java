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

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

import com.scivicslab.execgateway.GatewayConfig;
import com.scivicslab.execgateway.gateway.GatewayHttpServer;
import com.scivicslab.execgateway.gateway.GatewayRequestHandler;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI subcommand serving the HTTP transport until interrupted.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * exec-gateway serve --port 8000
 *
 * curl -X POST localhost:8000/run \
 *      -d '{"hostname":"git","host":"192.168.5.2","pass":"secret","cmd":"uptime"}'
 * }</pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@Command(
    name = "serve",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    description = "Serve the execution gateway over HTTP."
)
public class ServeCLI implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(ServeCLI.class.getName());

    @Mixin
    CommonOptions common;

    @Option(
        names = {"--bind"},
        description = "Interface to listen on (default: gateway.http.bind)"
    )
    String bind;

    @Option(
        names = {"--port"},
        description = "HTTP port (default: gateway.http.port)"
    )
    Integer port;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    @Override
    public Integer call() {
        GatewayHttpServer server = null;
        try {
            common.configureLogging();
            GatewayConfig config = common.loadConfig();

            String address = bind != null ? bind : config.getHttpBind();
            int httpPort = port != null ? port : config.getHttpPort();
            server = new GatewayHttpServer(address, httpPort, new GatewayRequestHandler(config));
            server.start();

            GatewayHttpServer running = server;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.stop();
                shutdownLatch.countDown();
            }, "Gateway-Shutdown"));

            System.out.println("Gateway is running on " + address + ":" + running.getPort()
                + ". Press Ctrl+C to stop.");
            shutdownLatch.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Interrupted, shutting down");
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Failed to start gateway: " + e.getMessage());
            return 1;
        } finally {
            if (server != null) {
                server.stop();
            }
            common.closeLogging();
        }
    }
}
