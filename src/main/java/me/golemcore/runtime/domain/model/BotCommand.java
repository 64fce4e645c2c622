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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Slash command parsed from message text, e.g. {@code /start@my_bot ref42}.
 *
 * @param name
 *            command name without the leading slash and without the mention
 * @param mention
 *            bot username the command was addressed to, {@code null} if none
 * @param arguments
 *            raw text after the command, empty if none
 */
public record BotCommand(String name, String mention, String arguments) {

    /**
     * Parses {@code text} as a bot command. Returns empty when the text does not
     * start with {@code /} or the command name is empty.
     */
    public static Optional<BotCommand> parse(String text) {
        if (text == null || !text.startsWith("/")) {
            return Optional.empty();
        }
        String[] parts = text.trim().split("\\s+", 2);
        String head = parts[0].substring(1);
        String name = head;
        String mention = null;
        int at = head.indexOf('@');
        if (at >= 0) {
            name = head.substring(0, at);
            mention = head.substring(at + 1);
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String arguments = parts.length > 1 ? parts[1].trim() : "";
        return Optional.of(new BotCommand(name, mention, arguments));
    }

    public List<String> argumentList() {
        if (arguments.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(arguments.split("\\s+"));
    }

    /**
     * Whether this command should be handled by {@code identity}. Commands without
     * a mention are addressed to every bot in the chat.
     */
    public boolean isAddressedTo(Identity identity) {
        return mention == null || mention.isEmpty() || identity.isAddressedBy(mention);
    }

    public boolean is(String commandName) {
        return name.equalsIgnoreCase(commandName);
    }
}
