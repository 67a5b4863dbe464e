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

package com.scivicslab.execgateway.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Outcomes of one execution request, split by status.
 *
 * <p>The error is set only when the host pattern matched no host.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class ResultSet {

    private final List<OutcomeRecord> ok;
    private final List<OutcomeRecord> failed;
    private final List<OutcomeRecord> unreachable;
    private final String error;

    public ResultSet(List<OutcomeRecord> ok, List<OutcomeRecord> failed,
                     List<OutcomeRecord> unreachable, String error) {
        this.ok = Collections.unmodifiableList(new ArrayList<>(ok));
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
        this.unreachable = Collections.unmodifiableList(new ArrayList<>(unreachable));
        this.error = error;
    }

    public List<OutcomeRecord> getOk() {
        return ok;
    }

    public List<OutcomeRecord> getFailed() {
        return failed;
    }

    public List<OutcomeRecord> getUnreachable() {
        return unreachable;
    }

    /**
     * Gets the global error.
     *
     * @return the "no hosts matched" message, if any
     */
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isEmpty() {
        return ok.isEmpty() && failed.isEmpty() && unreachable.isEmpty();
    }

    public int size() {
        return ok.size() + failed.size() + unreachable.size();
    }

    /**
     * Gets the first available outcome, preferring ok over failed over
     * unreachable.
     *
     * @return the first outcome, or empty if no host reported
     */
    public Optional<OutcomeRecord> firstOutcome() {
        if (!ok.isEmpty()) {
            return Optional.of(ok.get(0));
        }
        if (!failed.isEmpty()) {
            return Optional.of(failed.get(0));
        }
        if (!unreachable.isEmpty()) {
            return Optional.of(unreachable.get(0));
        }
        return Optional.empty();
    }

    /**
     * Converts the first available outcome to JSON, falling back to the
     * global error.
     *
     * @return the outcome JSON, {@code {"error": ...}}, or empty when nothing
     *         was recorded at all
     */
    public Optional<JSONObject> firstOutcomeJson() {
        Optional<OutcomeRecord> first = firstOutcome();
        if (first.isPresent()) {
            return Optional.of(first.get().toJson());
        }
        return getError().map(message -> new JSONObject().put("error", message));
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("ok", toArray(ok));
        json.put("failed", toArray(failed));
        json.put("unreachable", toArray(unreachable));
        json.put("error", error == null ? JSONObject.NULL : error);
        return json;
    }

    private static JSONArray toArray(List<OutcomeRecord> records) {
        JSONArray array = new JSONArray();
        records.forEach(r -> array.put(r.toJson()));
        return array;
    }

    @Override
    public String toString() {
        return String.format("ResultSet{ok=%d, failed=%d, unreachable=%d, error=%s}",
            ok.size(), failed.size(), unreachable.size(), error);
    }
}
