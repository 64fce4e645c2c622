package me.golemcore.runtime.port.outbound;

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

import me.golemcore.runtime.domain.model.EventBatch;

import java.time.Duration;

/**
 * Port for pulling inbound events from the platform.
 */
public interface EventSourcePort {

    /**
     * Fetch the next batch of events with update id {@code >= cursor}.
     *
     * <p>
     * May block up to {@code timeout} waiting for new events (long polling) and
     * returns an empty batch if none arrived. Read-only: calling again with the
     * same cursor after a failure is safe.
     *
     * @param cursor
     *            lowest update id to return
     * @param timeout
     *            long-poll duration
     * @return events in strictly increasing update id order
     * @throws TransportException
     *             on network, timeout or API failure
     */
    EventBatch fetch(long cursor, Duration timeout) throws TransportException;

    /**
     * Abort a {@link #fetch} blocked on another thread, making it fail promptly
     * with a {@link TransportException}. No-op when nothing is in flight.
     */
    default void cancel() {
    }
}
