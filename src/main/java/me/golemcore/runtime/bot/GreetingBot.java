package me.golemcore.runtime.bot;

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

import me.golemcore.runtime.domain.model.AnswerCallbackQueryAction;
import me.golemcore.runtime.domain.model.AnswerInlineQueryAction;
import me.golemcore.runtime.domain.model.BotCommand;
import me.golemcore.runtime.domain.model.CallbackQuery;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.model.IncomingMessage;
import me.golemcore.runtime.domain.model.InlineArticle;
import me.golemcore.runtime.domain.model.InlineKeyboard;
import me.golemcore.runtime.domain.model.InlineQuery;
import me.golemcore.runtime.domain.model.KeyboardButton;
import me.golemcore.runtime.domain.model.SendMessageAction;
import me.golemcore.runtime.domain.reducer.RoutingReducer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Fallback;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Default reducer shipped with the runtime. It is a fallback bean: any other
 * {@link me.golemcore.runtime.domain.reducer.Reducer} bean takes its place.
 * {@code bot.sample.enabled=false} removes it altogether.
 *
 * <ul>
 * <li>{@code /start} - welcome message with a ping button</li>
 * <li>{@code /help} - list of commands</li>
 * <li>other commands - hint to use /help</li>
 * <li>plain text - counted, no reply</li>
 * <li>ping button - answered with "pong"</li>
 * <li>inline query - single article echoing the query</li>
 * </ul>
 */
@Component
@Fallback
@ConditionalOnProperty(name = "bot.sample.enabled", havingValue = "true", matchIfMissing = true)
public class GreetingBot extends RoutingReducer<GreetingState> {

    static final String WELCOME_TEXT = "Welcome";
    static final String PING_DATA = "ping";
    static final String HELP_TEXT = """
            Commands:
            /start - show the welcome message
            /help - show this help""";

    @Override
    public FoldResult<GreetingState> init(Identity identity) {
        return FoldResult.unchanged(new GreetingState(identity, 0, 0));
    }

    @Override
    protected FoldResult<GreetingState> onMessage(IncomingMessage message, GreetingState state) {
        GreetingState next = state.withMessageSeen();
        Optional<BotCommand> command = message.command();
        if (command.isEmpty() || !command.get().isAddressedTo(state.identity())) {
            return FoldResult.unchanged(next);
        }

        BotCommand cmd = command.get();
        if (cmd.is("start")) {
            return FoldResult.of(next, SendMessageAction.builder()
                    .chatId(message.chat().id())
                    .text(WELCOME_TEXT)
                    .keyboard(InlineKeyboard.singleRow(KeyboardButton.callback("Ping", PING_DATA)))
                    .build());
        }
        if (cmd.is("help")) {
            return FoldResult.of(next, SendMessageAction.text(message.chat().id(), HELP_TEXT));
        }
        return FoldResult.of(next,
                SendMessageAction.reply(message, "Unknown command /" + cmd.name() + ". Try /help."));
    }

    @Override
    protected FoldResult<GreetingState> onCallbackQuery(CallbackQuery query, GreetingState state) {
        if (PING_DATA.equals(query.data())) {
            return FoldResult.of(state.withPing(), AnswerCallbackQueryAction.notify(query.id(), "pong"));
        }
        return FoldResult.of(state, AnswerCallbackQueryAction.acknowledge(query.id()));
    }

    @Override
    protected FoldResult<GreetingState> onInlineQuery(InlineQuery query, GreetingState state) {
        if (query.query().isBlank()) {
            return FoldResult.of(state, AnswerInlineQueryAction.builder()
                    .queryId(query.id())
                    .results(List.of())
                    .build());
        }
        InlineArticle echo = InlineArticle.builder()
                .id("echo")
                .title("Echo")
                .description(query.query())
                .messageText(query.query())
                .build();
        return FoldResult.of(state, AnswerInlineQueryAction.builder()
                .queryId(query.id())
                .results(List.of(echo))
                .cacheTimeSeconds(0)
                .personal(true)
                .build());
    }
}
