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
 * Payload of a {@link CallbackQueryEvent}, raised when a user presses an inline
 * keyboard button.
 *
 * @param id
 *            identifier to answer the query with
 * @param from
 *            user who pressed the button
 * @param chatId
 *            chat of the message carrying the keyboard, {@code null} when the
 *            keyboard was attached to an inline-mode message
 * @param messageId
 *            message carrying the keyboard, {@code null} in the same case
 * @param inlineMessageId
 *            identifier of the inline-mode message, {@code null} otherwise
 * @param data
 *            callback data of the pressed button, may be {@code null}
 */
public record CallbackQuery(CallbackQueryId id, User from, ChatId chatId, MessageId messageId,
        String inlineMessageId, String data) {
}
