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

package me.golemcore.runtime.adapter.outbound.telegram;

import me.golemcore.runtime.domain.model.CallbackQuery;
import me.golemcore.runtime.domain.model.CallbackQueryEvent;
import me.golemcore.runtime.domain.model.CallbackQueryId;
import me.golemcore.runtime.domain.model.Chat;
import me.golemcore.runtime.domain.model.ChatId;
import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.IncomingMessage;
import me.golemcore.runtime.domain.model.InlineQuery;
import me.golemcore.runtime.domain.model.InlineQueryEvent;
import me.golemcore.runtime.domain.model.InlineQueryId;
import me.golemcore.runtime.domain.model.MessageEvent;
import me.golemcore.runtime.domain.model.MessageId;
import me.golemcore.runtime.domain.model.User;
import me.golemcore.runtime.domain.model.UserId;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.time.Instant;
import java.util.Optional;

/**
 * Maps Telegram {@link Update} objects onto domain {@link Event}s.
 *
 * <p>
 * Only new messages, inline queries and callback queries are mapped; other
 * update kinds (edits, channel posts, polls, ...) yield an empty result. An
 * update that claims a supported kind but lacks a required field raises
 * {@link IllegalArgumentException}.
 */
@Component
public class TelegramUpdateMapper {

    public Optional<Event> map(long updateId, Update update) {
        if (update.hasMessage()) {
            return Optional.of(new MessageEvent(updateId, toMessage(update.getMessage())));
        }
        if (update.hasInlineQuery()) {
            return Optional.of(new InlineQueryEvent(updateId, toInlineQuery(update.getInlineQuery())));
        }
        if (update.hasCallbackQuery()) {
            return Optional.of(new CallbackQueryEvent(updateId, toCallbackQuery(update.getCallbackQuery())));
        }
        return Optional.empty();
    }

    IncomingMessage toMessage(Message message) {
        require(message.getMessageId(), "message.message_id");
        org.telegram.telegrambots.meta.api.objects.chat.Chat chat = require(message.getChat(), "message.chat");
        Integer date = message.getDate();
        Message replyTo = message.getReplyToMessage();
        return new IncomingMessage(
                new MessageId(message.getMessageId()),
                toChat(chat),
                message.getFrom() != null ? toUser(message.getFrom()) : null,
                date != null ? Instant.ofEpochSecond(date) : null,
                message.getText(),
                replyTo != null && replyTo.getMessageId() != null ? new MessageId(replyTo.getMessageId()) : null);
    }

    InlineQuery toInlineQuery(org.telegram.telegrambots.meta.api.objects.inlinequery.InlineQuery query) {
        return new InlineQuery(
                new InlineQueryId(require(query.getId(), "inline_query.id")),
                toUser(require(query.getFrom(), "inline_query.from")),
                query.getQuery() != null ? query.getQuery() : "",
                query.getOffset() != null ? query.getOffset() : "");
    }

    CallbackQuery toCallbackQuery(org.telegram.telegrambots.meta.api.objects.CallbackQuery query) {
        MaybeInaccessibleMessage message = query.getMessage();
        ChatId chatId = null;
        MessageId messageId = null;
        if (message != null) {
            chatId = new ChatId(require(message.getChatId(), "callback_query.message.chat"));
            messageId = new MessageId(require(message.getMessageId(), "callback_query.message.message_id"));
        }
        return new CallbackQuery(
                new CallbackQueryId(require(query.getId(), "callback_query.id")),
                toUser(require(query.getFrom(), "callback_query.from")),
                chatId,
                messageId,
                query.getInlineMessageId(),
                query.getData());
    }

    User toUser(org.telegram.telegrambots.meta.api.objects.User user) {
        return new User(
                new UserId(require(user.getId(), "user.id")),
                Boolean.TRUE.equals(user.getIsBot()),
                user.getFirstName() != null ? user.getFirstName() : "",
                user.getLastName(),
                user.getUserName(),
                user.getLanguageCode());
    }

    Chat toChat(org.telegram.telegrambots.meta.api.objects.chat.Chat chat) {
        return new Chat(
                new ChatId(require(chat.getId(), "chat.id")),
                chat.getType(),
                chat.getTitle(),
                chat.getUserName());
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Missing required field " + field);
        }
        return value;
    }
}
