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

import java.util.Objects;

/**
 * The bot account the runtime acts as, resolved once at bootstrap.
 */
public record Identity(UserId id, String firstName, String lastName, String username) {

    public Identity {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Whether {@code mention} (with or without the leading {@code @}) names this
     * bot. Telegram usernames are case-insensitive.
     */
    public boolean isAddressedBy(String mention) {
        if (mention == null || username == null) {
            return false;
        }
        String stripped = mention.startsWith("@") ? mention.substring(1) : mention;
        return username.equalsIgnoreCase(stripped);
    }
}
