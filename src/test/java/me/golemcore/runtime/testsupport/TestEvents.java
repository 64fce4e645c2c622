package me.golemcore.runtime.testsupport;

import me.golemcore.runtime.domain.model.CallbackQuery;
import me.golemcore.runtime.domain.model.CallbackQueryEvent;
import me.golemcore.runtime.domain.model.CallbackQueryId;
import me.golemcore.runtime.domain.model.Chat;
import me.golemcore.runtime.domain.model.ChatId;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.model.IncomingMessage;
import me.golemcore.runtime.domain.model.InlineQuery;
import me.golemcore.runtime.domain.model.InlineQueryEvent;
import me.golemcore.runtime.domain.model.InlineQueryId;
import me.golemcore.runtime.domain.model.MessageEvent;
import me.golemcore.runtime.domain.model.MessageId;
import me.golemcore.runtime.domain.model.User;
import me.golemcore.runtime.domain.model.UserId;

import java.time.Instant;

/**
 * Factory methods for domain events used across tests.
 */
public final class TestEvents {

    public static final long CHAT_ID = 42L;
    public static final Identity BOT = new Identity(new UserId(7L), "Golem", null, "golem_bot");
    public static final User ALICE = new User(new UserId(1001L), false, "Alice", null, "alice", "en");

    private TestEvents() {
    }

    public static MessageEvent text(long updateId, String text) {
        return text(updateId, CHAT_ID, text);
    }

    public static MessageEvent text(long updateId, long chatId, String text) {
        IncomingMessage message = new IncomingMessage(
                new MessageId((int) updateId),
                new Chat(new ChatId(chatId), "private", null, "alice"),
                ALICE,
                Instant.parse("2026-01-01T00:00:00Z"),
                text,
                null);
        return new MessageEvent(updateId, message);
    }

    public static InlineQueryEvent inline(long updateId, String query) {
        return new InlineQueryEvent(updateId,
                new InlineQuery(new InlineQueryId("iq-" + updateId), ALICE, query, ""));
    }

    public static CallbackQueryEvent callback(long updateId, String data) {
        return new CallbackQueryEvent(updateId, new CallbackQuery(new CallbackQueryId("cb-" + updateId), ALICE,
                new ChatId(CHAT_ID), new MessageId(5), null, data));
    }
}
