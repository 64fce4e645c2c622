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

/**
 * Sender of an inbound event.
 *
 * @param id
 *            user identifier
 * @param bot
 *            whether the sender is itself a bot
 * @param firstName
 *            first name, always present
 * @param lastName
 *            last name, may be {@code null}
 * @param username
 *            username without the leading {@code @}, may be {@code null}
 * @param languageCode
 *            IETF language tag of the user's client, may be {@code null}
 */
public record User(UserId id, boolean bot, String firstName, String lastName, String username,
        String languageCode) {

    public String displayName() {
        if (lastName == null || lastName.isBlank()) {
            return firstName;
        }
        return firstName + " " + lastName;
    }
}
