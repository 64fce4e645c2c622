package me.golemcore.runtime.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters describing what the runtime has done so far. Updated by the loop
 * thread and by dispatch workers; safe to read from any thread.
 */
public class RuntimeStats {

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();
    private final AtomicLong eventsFolded = new AtomicLong();
    private final AtomicLong updatesSkipped = new AtomicLong();
    private final AtomicLong actionsSubmitted = new AtomicLong();
    private final AtomicLong actionsSucceeded = new AtomicLong();
    private final AtomicLong actionsFailed = new AtomicLong();

    void recordCycle() {
        cycles.incrementAndGet();
    }

    void recordFetchFailure() {
        fetchFailures.incrementAndGet();
    }

    void recordFolded(long events) {
        eventsFolded.addAndGet(events);
    }

    void recordSkipped(long updates) {
        updatesSkipped.addAndGet(updates);
    }

    void recordSubmitted(long actions) {
        actionsSubmitted.addAndGet(actions);
    }

    void recordSucceeded() {
        actionsSucceeded.incrementAndGet();
    }

    void recordFailed() {
        actionsFailed.incrementAndGet();
    }

    public long getCycles() {
        return cycles.get();
    }

    public long getFetchFailures() {
        return fetchFailures.get();
    }

    public long getEventsFolded() {
        return eventsFolded.get();
    }

    public long getUpdatesSkipped() {
        return updatesSkipped.get();
    }

    public long getActionsSubmitted() {
        return actionsSubmitted.get();
    }

    public long getActionsSucceeded() {
        return actionsSucceeded.get();
    }

    public long getActionsFailed() {
        return actionsFailed.get();
    }

    @Override
    public String toString() {
        return "cycles=" + getCycles() + ", fetchFailures=" + getFetchFailures()
                + ", eventsFolded=" + getEventsFolded() + ", updatesSkipped=" + getUpdatesSkipped()
                + ", actionsSubmitted=" + getActionsSubmitted() + ", actionsSucceeded=" + getActionsSucceeded()
                + ", actionsFailed=" + getActionsFailed();
    }
}
