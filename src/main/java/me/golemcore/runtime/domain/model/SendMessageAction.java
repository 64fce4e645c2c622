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

import lombok.Builder;

import java.util.Objects;

/**
 * Send a text message to a chat.
 *
 * @param chatId
 *            destination chat
 * @param text
 *            message body
 * @param parseMode
 *            formatting mode, {@code null} for plain text
 * @param replyToMessageId
 *            message to reply to, {@code null} for none
 * @param keyboard
 *            inline keyboard to attach, {@code null} for none
 * @param disableNotification
 *            deliver silently
 */
@Builder
public record SendMessageAction(ChatId chatId, String text, ParseMode parseMode, MessageId replyToMessageId,
        InlineKeyboard keyboard, boolean disableNotification) implements Action {

    public SendMessageAction {
        Objects.requireNonNull(chatId, "chatId");
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Message text must not be empty");
        }
    }

    public static SendMessageAction text(ChatId chatId, String text) {
        return SendMessageAction.builder().chatId(chatId).text(text).build();
    }

    public static SendMessageAction reply(IncomingMessage to, String text) {
        return SendMessageAction.builder()
                .chatId(to.chat().id())
                .replyToMessageId(to.id())
                .text(text)
                .build();
    }

    @Override
    public String describe() {
        return "sendMessage(chat=" + chatId + ", " + text.length() + " chars)";
    }
}
