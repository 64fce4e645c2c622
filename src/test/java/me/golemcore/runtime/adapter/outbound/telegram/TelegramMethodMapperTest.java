package me.golemcore.runtime.adapter.outbound.telegram;

import me.golemcore.runtime.adapter.outbound.telegram.TelegramMethodMapper.MessageChunk;
import me.golemcore.runtime.domain.model.AnswerCallbackQueryAction;
import me.golemcore.runtime.domain.model.AnswerInlineQueryAction;
import me.golemcore.runtime.domain.model.CallbackQueryId;
import me.golemcore.runtime.domain.model.ChatId;
import me.golemcore.runtime.domain.model.InlineArticle;
import me.golemcore.runtime.domain.model.InlineKeyboard;
import me.golemcore.runtime.domain.model.InlineQueryId;
import me.golemcore.runtime.domain.model.KeyboardButton;
import me.golemcore.runtime.domain.model.MessageId;
import me.golemcore.runtime.domain.model.ParseMode;
import me.golemcore.runtime.domain.model.SendMessageAction;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.AnswerInlineQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.inlinequery.result.InlineQueryResultArticle;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TelegramMethodMapperTest {

    private final TelegramMethodMapper mapper = new TelegramMethodMapper();

    @Test
    void toSendMessages_shortTextIsOneMessage() {
        SendMessageAction action = SendMessageAction.builder()
                .chatId(new ChatId(42))
                .text("<b>Welcome</b>")
                .parseMode(ParseMode.HTML)
                .replyToMessageId(new MessageId(7))
                .keyboard(InlineKeyboard.singleRow(KeyboardButton.callback("Ping", "ping")))
                .build();

        List<SendMessage> methods = mapper.toSendMessages(action);

        assertEquals(1, methods.size());
        SendMessage method = methods.get(0);
        assertEquals("42", method.getChatId());
        assertEquals("<b>Welcome</b>", method.getText());
        assertEquals("HTML", method.getParseMode());
        assertEquals(7, method.getReplyToMessageId());
        InlineKeyboardMarkup markup = assertInstanceOf(InlineKeyboardMarkup.class, method.getReplyMarkup());
        assertEquals("ping", markup.getKeyboard().get(0).get(0).getCallbackData());
    }

    @Test
    void toSendMessages_longTextIsSplitWithReplyFirstAndKeyboardLast() {
        String paragraph = "a".repeat(3000);
        SendMessageAction action = SendMessageAction.builder()
                .chatId(new ChatId(42))
                .text(paragraph + "\n\n" + paragraph)
                .replyToMessageId(new MessageId(7))
                .keyboard(InlineKeyboard.singleRow(KeyboardButton.link("Docs", "https://example.org")))
                .build();

        List<SendMessage> methods = mapper.toSendMessages(action);

        assertEquals(2, methods.size());
        assertEquals(paragraph, methods.get(0).getText());
        assertEquals(paragraph, methods.get(1).getText());
        assertEquals(7, methods.get(0).getReplyToMessageId());
        assertNull(methods.get(1).getReplyToMessageId());
        assertNull(methods.get(0).getReplyMarkup());
        assertNotNull(methods.get(1).getReplyMarkup());
    }

    @Test
    void chunk_shortTextIsSingleFirstAndLastChunk() {
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("hello", 20);

        assertEquals(List.of(new MessageChunk("hello", true, true)), chunks);
    }

    @Test
    void chunk_fallsBackToHardCut() {
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("x".repeat(10), 4);

        assertEquals(List.of("xxxx", "xxxx", "xx"), texts(chunks));
        assertTrue(chunks.get(0).first());
        assertFalse(chunks.get(1).first());
        assertFalse(chunks.get(1).last());
        assertTrue(chunks.get(2).last());
    }

    @Test
    void chunk_prefersLineBreaks() {
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("line one\nline two\nline three", 20);

        assertEquals(List.of("line one\nline two", "line three"), texts(chunks));
    }

    @Test
    void chunk_prefersParagraphOverLineBreak() {
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("intro text\n\nbody a\nbody b", 22);

        assertEquals(List.of("intro text", "body a\nbody b"), texts(chunks));
    }

    @Test
    void chunk_fallsBackToWordBoundary() {
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("alpha beta gamma delta", 12);

        assertEquals(List.of("alpha beta", "gamma delta"), texts(chunks));
    }

    @Test
    void chunk_neverSplitsSurrogatePair() {
        String emoji = "\uD83D\uDE00";
        List<MessageChunk> chunks = TelegramMethodMapper.chunk("abc" + emoji + "def", 4);

        assertEquals(List.of("abc", emoji + "de", "f"), texts(chunks));
    }

    private static List<String> texts(List<MessageChunk> chunks) {
        return chunks.stream().map(MessageChunk::text).toList();
    }

    @Test
    void toMarkup_keepsRowsAndButtonKinds() {
        InlineKeyboard keyboard = InlineKeyboard.column(
                KeyboardButton.callback("A", "a"),
                KeyboardButton.link("B", "https://b.example"));

        InlineKeyboardMarkup markup = mapper.toMarkup(keyboard);

        assertEquals(2, markup.getKeyboard().size());
        InlineKeyboardButton link = markup.getKeyboard().get(1).get(0);
        assertEquals("https://b.example", link.getUrl());
        assertNull(link.getCallbackData());
    }

    @Test
    void toAnswerInlineQuery_mapsArticles() {
        AnswerInlineQueryAction action = AnswerInlineQueryAction.builder()
                .queryId(new InlineQueryId("iq-1"))
                .results(List.of(InlineArticle.builder()
                        .id("echo")
                        .title("Echo")
                        .messageText("cats")
                        .build()))
                .cacheTimeSeconds(0)
                .personal(true)
                .build();

        AnswerInlineQuery method = mapper.toAnswerInlineQuery(action);

        assertEquals("iq-1", method.getInlineQueryId());
        assertEquals(Boolean.TRUE, method.getIsPersonal());
        InlineQueryResultArticle article = assertInstanceOf(InlineQueryResultArticle.class,
                method.getResults().get(0));
        assertEquals("echo", article.getId());
        assertEquals("Echo", article.getTitle());
    }

    @Test
    void toAnswerCallbackQuery_mapsText() {
        AnswerCallbackQuery method = mapper.toAnswerCallbackQuery(
                AnswerCallbackQueryAction.notify(new CallbackQueryId("cb-1"), "pong"));

        assertEquals("cb-1", method.getCallbackQueryId());
        assertEquals("pong", method.getText());
        assertNull(method.getShowAlert());
    }
}
