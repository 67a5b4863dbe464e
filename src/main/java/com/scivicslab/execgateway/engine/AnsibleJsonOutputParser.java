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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import com.scivicslab.execgateway.result.OutcomeStatus;

/**
 * Reads the document printed by Ansible's {@code json} stdout callback.
 *
 * <pre>
 * {"plays": [{"play": {...},
 *             "tasks": [{"task": {"name": "..."},
 *                        "hosts": {"git": {"rc": 0, "stdout": "hi", ...}}}]}],
 *  "stats": {"git": {"ok": 1, "failures": 0, "unreachable": 0, ...}}}
 * </pre>
 *
 * <p>Host results are classified {@code unreachable} when they carry
 * {@code "unreachable": true}, {@code failed} when they carry
 * {@code "failed": true}, and {@code ok} otherwise. Skipped results are not
 * outcomes and are dropped.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class AnsibleJsonOutputParser {

    /**
     * Parses the callback output.
     *
     * @param stdout the process standard output, possibly preceded by
     *        non-JSON lines such as warnings
     * @return the parsed run
     * @throws IOException if the output contains no callback document
     */
    public ParsedRun parse(String stdout) throws IOException {
        if (stdout == null) {
            throw new IOException("No output from automation engine");
        }
        int start = documentStart(stdout);
        if (start < 0) {
            throw new IOException("No JSON result document in engine output");
        }

        JSONObject document;
        try {
            document = new JSONObject(new JSONTokener(stdout.substring(start)));
        } catch (JSONException e) {
            throw new IOException("Malformed JSON result document: " + e.getMessage(), e);
        }

        List<ParsedOutcome> outcomes = new ArrayList<>();
        int hostResults = 0;

        JSONArray plays = document.optJSONArray("plays");
        if (plays != null) {
            for (int p = 0; p < plays.length(); p++) {
                JSONArray tasks = plays.getJSONObject(p).optJSONArray("tasks");
                if (tasks == null) {
                    continue;
                }
                for (int t = 0; t < tasks.length(); t++) {
                    JSONObject task = tasks.getJSONObject(t);
                    JSONObject taskInfo = task.optJSONObject("task");
                    String taskName = taskInfo == null ? "" : taskInfo.optString("name", "");
                    JSONObject hosts = task.optJSONObject("hosts");
                    if (hosts == null) {
                        continue;
                    }
                    for (String host : hosts.keySet()) {
                        hostResults++;
                        JSONObject result = hosts.getJSONObject(host);
                        if (result.optBoolean("skipped", false)) {
                            continue;
                        }
                        String name = taskName.isEmpty() ? result.optString("action", "") : taskName;
                        outcomes.add(new ParsedOutcome(host, name, classify(result), result.toMap()));
                    }
                }
            }
        }

        JSONObject stats = document.optJSONObject("stats");
        boolean anyHost = hostResults > 0 || (stats != null && !stats.isEmpty());
        return new ParsedRun(outcomes, anyHost);
    }

    static OutcomeStatus classify(JSONObject result) {
        if (result.optBoolean("unreachable", false)) {
            return OutcomeStatus.UNREACHABLE;
        }
        if (result.optBoolean("failed", false)) {
            return OutcomeStatus.FAILED;
        }
        return OutcomeStatus.OK;
    }

    private static int documentStart(String stdout) {
        if (stdout.startsWith("{")) {
            return 0;
        }
        int index = stdout.indexOf("\n{");
        return index < 0 ? -1 : index + 1;
    }

    /**
     * Outcomes of one engine process.
     */
    public static final class ParsedRun {
        private final List<ParsedOutcome> outcomes;
        private final boolean anyHost;

        ParsedRun(List<ParsedOutcome> outcomes, boolean anyHost) {
            this.outcomes = Collections.unmodifiableList(outcomes);
            this.anyHost = anyHost;
        }

        public List<ParsedOutcome> getOutcomes() {
            return outcomes;
        }

        /**
         * Tells whether any host was touched, skipped ones included.
         *
         * @return false when every play matched no host
         */
        public boolean hasAnyHost() {
            return anyHost;
        }
    }

    /**
     * One host result of one task.
     */
    public static final class ParsedOutcome {
        private final String host;
        private final String taskName;
        private final OutcomeStatus status;
        private final Map<String, Object> payload;

        ParsedOutcome(String host, String taskName, OutcomeStatus status, Map<String, Object> payload) {
            this.host = host;
            this.taskName = taskName;
            this.status = status;
            this.payload = payload;
        }

        public String getHost() {
            return host;
        }

        public String getTaskName() {
            return taskName;
        }

        public OutcomeStatus getStatus() {
            return status;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }
    }
}
