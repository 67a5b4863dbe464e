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
import java.util.Properties;
import java.util.logging.Logger;

import org.json.JSONObject;

/**
 * Version of the gateway, read from version.properties which Maven fills
 * in at build time. Reported by {@code --version} and by {@code GET /info}.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class Version {

    private static final Logger LOG = Logger.getLogger(Version.class.getName());

    public static final String NAME = "remote-exec-gateway";

    static final String UNKNOWN = "unknown";

    private static final String VERSION = load(Version.class.getResourceAsStream("/version.properties"));

    private Version() {
    }

    static String load(InputStream is) {
        if (is == null) {
            return UNKNOWN;
        }
        try (is) {
            Properties props = new Properties();
            props.load(is);
            String version = props.getProperty("version", "").trim();
            // an unfiltered resource still holds the Maven placeholder
            return version.isEmpty() || version.startsWith("${") ? UNKNOWN : version;
        } catch (IOException e) {
            LOG.fine("version.properties unreadable: " + e.getMessage());
            return UNKNOWN;
        }
    }

    public static String get() {
        return VERSION;
    }

    /**
     * Returns the name and version, e.g. {@code remote-exec-gateway 1.0.0}.
     *
     * @return the display string
     */
    public static String full() {
        return NAME + " " + VERSION;
    }

    /**
     * Returns the body of {@code GET /info}.
     *
     * @return {@code {"server": ..., "version": ...}}
     */
    public static JSONObject toJson() {
        return new JSONObject()
            .put("server", NAME)
            .put("version", VERSION);
    }
}
