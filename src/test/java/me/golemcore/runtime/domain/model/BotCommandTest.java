package me.golemcore.runtime.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static me.golemcore.runtime.testsupport.TestEvents.BOT;
import static org.junit.jupiter.api.Assertions.*;

class BotCommandTest {

    @Test
    void parse_plainCommand() {
        BotCommand command = BotCommand.parse("/start").orElseThrow();

        assertEquals("start", command.name());
        assertNull(command.mention());
        assertEquals("", command.arguments());
        assertTrue(command.argumentList().isEmpty());
    }

    @Test
    void parse_commandWithMentionAndArguments() {
        BotCommand command = BotCommand.parse("/remind@golem_bot  10m   buy milk").orElseThrow();

        assertEquals("remind", command.name());
        assertEquals("golem_bot", command.mention());
        assertEquals("10m   buy milk", command.arguments());
        assertEquals(List.of("10m", "buy", "milk"), command.argumentList());
    }

    @Test
    void parse_rejectsNonCommands() {
        assertEquals(Optional.empty(), BotCommand.parse("hello"));
        assertEquals(Optional.empty(), BotCommand.parse("/"));
        assertEquals(Optional.empty(), BotCommand.parse("/@golem_bot"));
        assertEquals(Optional.empty(), BotCommand.parse(null));
    }

    @Test
    void isAddressedTo_matchesOwnUsernameCaseInsensitively() {
        assertTrue(BotCommand.parse("/help").orElseThrow().isAddressedTo(BOT));
        assertTrue(BotCommand.parse("/help@Golem_Bot").orElseThrow().isAddressedTo(BOT));
        assertFalse(BotCommand.parse("/help@other_bot").orElseThrow().isAddressedTo(BOT));
    }

    @Test
    void is_ignoresCase() {
        assertTrue(BotCommand.parse("/START").orElseThrow().is("start"));
        assertFalse(BotCommand.parse("/stop").orElseThrow().is("start"));
    }
}
