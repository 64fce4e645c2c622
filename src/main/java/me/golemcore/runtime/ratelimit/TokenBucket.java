package me.golemcore.runtime.ratelimit;

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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Token bucket pacing outbound platform calls. Holds up to {@code capacity}
 * tokens and refills them evenly over {@code refillPeriod}.
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.tokens = new AtomicLong(capacity);
        this.lastRefillNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        return tryConsume(1);
    }

    /**
     * Try to consume {@code numTokens} tokens at once.
     */
    public synchronized RateLimitResult tryConsume(long numTokens) {
        refill();

        if (tokens.get() >= numTokens) {
            long remaining = tokens.addAndGet(-numTokens);
            return RateLimitResult.allowed(remaining);
        }

        return RateLimitResult.denied(calculateWaitTimeMs(numTokens - tokens.get()));
    }

    public synchronized long availableTokens() {
        refill();
        return tokens.get();
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill() {
        long now = System.nanoTime();
        long lastRefill = lastRefillNanos.get();
        long elapsedNanos = now - lastRefill;

        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();

        if (tokensToAdd > 0) {
            long newTokens = Math.min(capacity, tokens.get() + tokensToAdd);
            tokens.set(newTokens);
            lastRefillNanos.set(now);
        }
    }

    private long calculateWaitTimeMs(long tokensNeeded) {
        long nanosPerToken = refillPeriod.toNanos() / capacity;
        return Math.max(1, (nanosPerToken * tokensNeeded) / 1_000_000);
    }
}
