package me.golemcore.runtime.domain.model;

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

import java.util.List;
import java.util.OptionalLong;

/**
 * One fetched batch of events.
 *
 * @param events
 *            decoded events in ascending update id order
 * @param lastUpdateId
 *            highest update id received in the batch, including updates that were
 *            dropped because they were malformed or of an unsupported kind; empty
 *            when nothing was received
 * @param skipped
 *            number of received updates that were dropped
 */
public record EventBatch(List<Event> events, OptionalLong lastUpdateId, int skipped) {

    public EventBatch {
        events = List.copyOf(events);
        if (skipped < 0) {
            throw new IllegalArgumentException("skipped must not be negative: " + skipped);
        }
    }

    public static EventBatch empty() {
        return new EventBatch(List.of(), OptionalLong.empty(), 0);
    }

    /**
     * Batch whose watermark is derived from the events themselves.
     */
    public static EventBatch of(List<Event> events) {
        OptionalLong last = events.stream().mapToLong(Event::updateId).max();
        return new EventBatch(events, last, 0);
    }

    public boolean isEmpty() {
        return events.isEmpty() && lastUpdateId.isEmpty();
    }
}
