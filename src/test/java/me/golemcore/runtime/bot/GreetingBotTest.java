package me.golemcore.runtime.bot;

import me.golemcore.runtime.domain.model.AnswerCallbackQueryAction;
import me.golemcore.runtime.domain.model.AnswerInlineQueryAction;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.KeyboardButton;
import me.golemcore.runtime.domain.model.SendMessageAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.golemcore.runtime.testsupport.TestEvents.BOT;
import static me.golemcore.runtime.testsupport.TestEvents.CHAT_ID;
import static me.golemcore.runtime.testsupport.TestEvents.callback;
import static me.golemcore.runtime.testsupport.TestEvents.inline;
import static me.golemcore.runtime.testsupport.TestEvents.text;
import static org.junit.jupiter.api.Assertions.*;

class GreetingBotTest {

    private GreetingBot bot;
    private GreetingState initial;

    @BeforeEach
    void setUp() {
        bot = new GreetingBot();
        FoldResult<GreetingState> init = bot.init(BOT);
        assertTrue(init.actions().isEmpty());
        initial = init.state();
    }

    @Test
    void start_sendsWelcomeWithPingButton() {
        FoldResult<GreetingState> result = bot.reduce(text(1, "/start"), initial);

        assertEquals(1, result.actions().size());
        SendMessageAction welcome = assertInstanceOf(SendMessageAction.class, result.actions().get(0));
        assertEquals("Welcome", welcome.text());
        assertEquals(CHAT_ID, welcome.chatId().value());
        KeyboardButton button = welcome.keyboard().rows().get(0).get(0);
        assertEquals(GreetingBot.PING_DATA, button.callbackData());
        assertEquals(1, result.state().messagesSeen());
    }

    @Test
    void help_listsCommands() {
        FoldResult<GreetingState> result = bot.reduce(text(1, "/help@golem_bot"), initial);

        SendMessageAction help = assertInstanceOf(SendMessageAction.class, result.actions().get(0));
        assertTrue(help.text().contains("/start"));
    }

    @Test
    void commandForAnotherBotIsIgnored() {
        FoldResult<GreetingState> result = bot.reduce(text(1, "/start@other_bot"), initial);

        assertTrue(result.actions().isEmpty());
        assertEquals(1, result.state().messagesSeen());
    }

    @Test
    void unknownCommandRepliesWithHint() {
        FoldResult<GreetingState> result = bot.reduce(text(9, "/dance"), initial);

        SendMessageAction hint = assertInstanceOf(SendMessageAction.class, result.actions().get(0));
        assertTrue(hint.text().contains("/dance"));
        assertNotNull(hint.replyToMessageId());
    }

    @Test
    void plainTextProducesNoAction() {
        FoldResult<GreetingState> result = bot.reduce(text(1, "hello"), initial);

        assertTrue(result.actions().isEmpty());
        assertEquals(1, result.state().messagesSeen());
    }

    @Test
    void pingCallbackIsAnsweredWithPong() {
        FoldResult<GreetingState> result = bot.reduce(callback(2, "ping"), initial);

        AnswerCallbackQueryAction answer = assertInstanceOf(AnswerCallbackQueryAction.class,
                result.actions().get(0));
        assertEquals("pong", answer.text());
        assertEquals(1, result.state().pings());
    }

    @Test
    void unknownCallbackIsAcknowledgedSilently() {
        FoldResult<GreetingState> result = bot.reduce(callback(2, "other"), initial);

        AnswerCallbackQueryAction answer = assertInstanceOf(AnswerCallbackQueryAction.class,
                result.actions().get(0));
        assertNull(answer.text());
        assertSame(initial, result.state());
    }

    @Test
    void inlineQueryIsEchoed() {
        FoldResult<GreetingState> result = bot.reduce(inline(3, "cats"), initial);

        AnswerInlineQueryAction answer = assertInstanceOf(AnswerInlineQueryAction.class, result.actions().get(0));
        assertEquals(1, answer.results().size());
        assertEquals("cats", answer.results().get(0).messageText());
    }

    @Test
    void blankInlineQueryGetsEmptyAnswer() {
        FoldResult<GreetingState> result = bot.reduce(inline(3, " "), initial);

        AnswerInlineQueryAction answer = assertInstanceOf(AnswerInlineQueryAction.class, result.actions().get(0));
        assertTrue(answer.results().isEmpty());
    }
}
