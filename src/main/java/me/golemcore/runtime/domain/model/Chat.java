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
 * Chat an inbound message belongs to.
 *
 * @param id
 *            chat identifier
 * @param type
 *            one of {@code private}, {@code group}, {@code supergroup},
 *            {@code channel}
 * @param title
 *            title for groups and channels, {@code null} for private chats
 * @param username
 *            public username, may be {@code null}
 */
public record Chat(ChatId id, String type, String title, String username) {

    public boolean isPrivate() {
        return "private".equals(type);
    }
}
