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

/**
 * Result of a token bucket check.
 *
 * @param allowed
 *            whether a token was taken
 * @param remainingTokens
 *            tokens left after the check
 * @param waitTime
 *            when denied, how long until a token becomes available;
 *            {@link Duration#ZERO} when allowed
 */
public record RateLimitResult(boolean allowed, long remainingTokens, Duration waitTime) {

    public static RateLimitResult allowed(long remaining) {
        return new RateLimitResult(true, remaining, Duration.ZERO);
    }

    public static RateLimitResult denied(long waitMs) {
        return new RateLimitResult(false, 0, Duration.ofMillis(waitMs));
    }
}
