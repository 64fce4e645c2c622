package me.golemcore.runtime.bot;

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

import me.golemcore.runtime.domain.model.Identity;

/**
 * State of {@link GreetingBot}: who the bot is and what it has seen so far.
 */
public record GreetingState(Identity identity, long messagesSeen, long pings) {

    GreetingState withMessageSeen() {
        return new GreetingState(identity, messagesSeen + 1, pings);
    }

    GreetingState withPing() {
        return new GreetingState(identity, messagesSeen, pings + 1);
    }
}
