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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.JSONException;
import org.json.JSONObject;

import com.scivicslab.execgateway.Version;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * HTTP transport of the gateway.
 *
 * <ul>
 *   <li>{@code POST /run} - executes a request, see {@link GatewayRequestHandler}</li>
 *   <li>{@code GET /} - the browser console</li>
 *   <li>{@code GET /info} - server name and version</li>
 * </ul>
 *
 * <p>Requests are served on a fixed pool since each one blocks until its
 * hosts have reported.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class GatewayHttpServer {

    private static final Logger LOG = Logger.getLogger(GatewayHttpServer.class.getName());

    private static final String INDEX_RESOURCE = "/static/index.html";
    private static final String JSON_TYPE = "application/json; charset=utf-8";
    private static final int REQUEST_THREADS = 8;

    private final String bindAddress;
    private final int port;
    private final GatewayRequestHandler handler;

    private HttpServer httpServer;
    private ExecutorService executor;

    /**
     * Constructs a server; nothing is bound until {@link #start()}.
     *
     * @param bindAddress the interface to listen on
     * @param port the port, 0 for an ephemeral one
     * @param handler executes the requests
     */
    public GatewayHttpServer(String bindAddress, int port, GatewayRequestHandler handler) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.handler = handler;
    }

    /**
     * Binds and starts serving.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/run", this::handleRun);
        httpServer.createContext("/info", this::handleInfo);
        httpServer.createContext("/", this::handleIndex);
        executor = Executors.newFixedThreadPool(REQUEST_THREADS);
        httpServer.setExecutor(executor);
        httpServer.start();
        LOG.info("Gateway listening on " + bindAddress + ":" + getPort());
    }

    /**
     * Stops serving.
     */
    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            httpServer = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Gets the bound port.
     *
     * @return the actual port once started, otherwise the configured one
     */
    public int getPort() {
        return httpServer == null ? port : httpServer.getAddress().getPort();
    }

    private void handleRun(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        JSONObject request;
        try (InputStream is = exchange.getRequestBody()) {
            request = new JSONObject(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (JSONException e) {
            sendJson(exchange, 400, error("Malformed request: " + e.getMessage()));
            return;
        }

        try {
            sendJson(exchange, 200, handler.handle(request));
        } catch (IllegalArgumentException | JSONException e) {
            // a host entry of the wrong JSON type is an invalid descriptor
            LOG.warning("Bad request: " + e.getMessage());
            sendJson(exchange, 400, error(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Request failed", e);
            sendJson(exchange, 500, error(String.valueOf(e.getMessage())));
        }
    }

    private void handleInfo(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        sendJson(exchange, 200, Version.toJson());
    }

    private void handleIndex(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendJson(exchange, 404, error("Not found"));
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        byte[] page;
        try (InputStream is = GatewayHttpServer.class.getResourceAsStream(INDEX_RESOURCE)) {
            if (is == null) {
                sendJson(exchange, 404, error("Console page is not bundled"));
                return;
            }
            page = is.readAllBytes();
        }
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(200, page.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(page);
        }
    }

    private static JSONObject error(String message) {
        return new JSONObject().put("error", message);
    }

    private static void sendJson(HttpExchange exchange, int status, JSONObject body) throws IOException {
        byte[] response = body.toString().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", JSON_TYPE);
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
