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
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Collects the outcomes of one execution request.
 *
 * <p>A new collector is created for every request and handed to the engine
 * explicitly; it is never shared between requests. All methods lock on the
 * collector, so workers may report concurrently. Within a bucket the order is
 * arrival order.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class ResultCollector implements OutcomeSink {

    private static final Logger LOG = Logger.getLogger(ResultCollector.class.getName());

    /** Global error recorded when a host pattern matches nothing. */
    public static final String NO_HOSTS_MATCHED = "skipping: No match hosts.";

    private final List<OutcomeRecord> ok = new ArrayList<>();
    private final List<OutcomeRecord> failed = new ArrayList<>();
    private final List<OutcomeRecord> unreachable = new ArrayList<>();
    private String error;

    @Override
    public synchronized void recordOk(String host, String task, Map<String, Object> payload) {
        ok.add(new OutcomeRecord(host, task, payload, OutcomeStatus.OK));
        LOG.fine(() -> "ok: " + host + " [" + task + "]");
    }

    @Override
    public synchronized void recordFailed(String host, String task, Map<String, Object> payload) {
        failed.add(new OutcomeRecord(host, task, payload, OutcomeStatus.FAILED));
        LOG.fine(() -> "failed: " + host + " [" + task + "]");
    }

    @Override
    public synchronized void recordUnreachable(String host, String task, Map<String, Object> payload) {
        unreachable.add(new OutcomeRecord(host, task, payload, OutcomeStatus.UNREACHABLE));
        LOG.fine(() -> "unreachable: " + host + " [" + task + "]");
    }

    @Override
    public synchronized void recordNoHostsMatched() {
        error = NO_HOSTS_MATCHED;
    }

    /**
     * Returns a copy of the current state. Safe to call while workers are
     * still reporting.
     *
     * @return the result set
     */
    public synchronized ResultSet snapshot() {
        return new ResultSet(ok, failed, unreachable, error);
    }
}
