package me.golemcore.runtime.adapter.outbound.telegram;

import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.IncomingMessage;
import me.golemcore.runtime.domain.model.MessageEvent;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramUpdateMapperTest {

    private final TelegramUpdateMapper mapper = new TelegramUpdateMapper();

    @Test
    void map_textMessage() {
        Message message = mockMessage(5, 42L, "hello");
        Message replyTo = mock(Message.class);
        when(replyTo.getMessageId()).thenReturn(3);
        when(message.getReplyToMessage()).thenReturn(replyTo);
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);

        Optional<Event> event = mapper.map(77, update);

        MessageEvent messageEvent = assertInstanceOf(MessageEvent.class, event.orElseThrow());
        IncomingMessage incoming = messageEvent.message();
        assertEquals(77, messageEvent.updateId());
        assertEquals(5, incoming.id().value());
        assertEquals(42L, incoming.chat().id().value());
        assertTrue(incoming.chat().isPrivate());
        assertEquals("hello", incoming.text());
        assertEquals(Instant.ofEpochSecond(1767225600), incoming.date());
        assertEquals(3, incoming.replyToMessageId().value());
        assertEquals("Alice Smith", incoming.from().displayName());
    }

    @Test
    void map_unsupportedUpdateIsEmpty() {
        Update update = mock(Update.class);

        assertTrue(mapper.map(1, update).isEmpty());
    }

    @Test
    void map_messageWithoutChatIsRejected() {
        Message message = mock(Message.class);
        when(message.getMessageId()).thenReturn(5);
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);

        assertThrows(IllegalArgumentException.class, () -> mapper.map(1, update));
    }

    @Test
    void toUser_treatsMissingBotFlagAsHuman() {
        User user = mock(User.class);
        when(user.getId()).thenReturn(9L);
        when(user.getFirstName()).thenReturn("Bob");

        me.golemcore.runtime.domain.model.User mapped = mapper.toUser(user);

        assertFalse(mapped.bot());
        assertEquals("Bob", mapped.displayName());
    }

    private static Message mockMessage(int id, long chatId, String text) {
        Chat chat = mock(Chat.class);
        when(chat.getId()).thenReturn(chatId);
        when(chat.getType()).thenReturn("private");
        User from = mock(User.class);
        when(from.getId()).thenReturn(1001L);
        when(from.getFirstName()).thenReturn("Alice");
        when(from.getLastName()).thenReturn("Smith");

        Message message = mock(Message.class);
        when(message.getMessageId()).thenReturn(id);
        when(message.getChat()).thenReturn(chat);
        when(message.getFrom()).thenReturn(from);
        when(message.getDate()).thenReturn(1767225600);
        when(message.getText()).thenReturn(text);
        return message;
    }
}
