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

/**
 * Bounded exponential backoff between failed fetches. The first failure waits
 * the initial delay, each further consecutive failure multiplies it, never
 * exceeding the maximum. A successful fetch resets it.
 *
 * <p>
 * Not thread-safe; owned by the loop thread.
 */
public class FetchBackoff {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    private int consecutiveFailures;
    private long nextDelayMs;

    public FetchBackoff(long initialDelayMs, long maxDelayMs, double multiplier) {
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: initial=" + initialDelayMs + "ms, max=" + maxDelayMs + "ms");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0: " + multiplier);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.nextDelayMs = initialDelayMs;
    }

    public static FetchBackoff from(RuntimeLoopConfig config) {
        return new FetchBackoff(config.getBackoffInitialDelayMs(), config.getBackoffMaxDelayMs(),
                config.getBackoffMultiplier());
    }

    /**
     * Record a failure and return how long to wait before the next attempt.
     */
    public long onFailure() {
        consecutiveFailures++;
        long delay = nextDelayMs;
        nextDelayMs = Math.min(maxDelayMs, (long) Math.ceil(nextDelayMs * multiplier));
        return delay;
    }

    public void reset() {
        consecutiveFailures = 0;
        nextDelayMs = initialDelayMs;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
