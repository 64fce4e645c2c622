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

import java.time.Instant;
import java.util.Optional;

/**
 * Payload of a {@link MessageEvent}.
 *
 * @param id
 *            message id within the chat
 * @param chat
 *            chat the message was posted in
 * @param from
 *            sender, {@code null} for anonymous channel posts
 * @param date
 *            server-side send time
 * @param text
 *            text body, {@code null} for non-text messages (stickers, media)
 * @param replyToMessageId
 *            id of the message this one replies to, {@code null} if none
 */
public record IncomingMessage(MessageId id, Chat chat, User from, Instant date, String text,
        MessageId replyToMessageId) {

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Bot command carried by the text, if the text starts with {@code /}.
     */
    public Optional<BotCommand> command() {
        return BotCommand.parse(text);
    }
}
