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

import me.golemcore.runtime.domain.model.AnswerCallbackQueryAction;
import me.golemcore.runtime.domain.model.AnswerInlineQueryAction;
import me.golemcore.runtime.domain.model.InlineArticle;
import me.golemcore.runtime.domain.model.InlineKeyboard;
import me.golemcore.runtime.domain.model.KeyboardButton;
import me.golemcore.runtime.domain.model.SendMessageAction;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.AnswerInlineQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.inlinequery.inputmessagecontent.InputTextMessageContent;
import org.telegram.telegrambots.meta.api.objects.inlinequery.result.InlineQueryResult;
import org.telegram.telegrambots.meta.api.objects.inlinequery.result.InlineQueryResultArticle;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates domain actions into telegrambots API methods.
 */
@Component
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class TelegramMethodMapper {

    static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    /** Preferred break points, strongest first. */
    private static final List<String> BREAKS = List.of("\n\n", "\n", " ");

    /**
     * One {@link SendMessage} per chunk of text (see {@link #chunk}). The reply
     * target goes on the first chunk and the keyboard on the last.
     */
    public List<SendMessage> toSendMessages(SendMessageAction action) {
        List<MessageChunk> chunks = chunk(action.text(), TELEGRAM_MAX_MESSAGE_LENGTH);
        List<SendMessage> methods = new ArrayList<>(chunks.size());
        for (MessageChunk chunk : chunks) {
            methods.add(SendMessage.builder()
                    .chatId(action.chatId().toString())
                    .text(chunk.text())
                    .parseMode(action.parseMode() != null ? action.parseMode().apiValue() : null)
                    .disableNotification(action.disableNotification() ? Boolean.TRUE : null)
                    .replyToMessageId(chunk.first() && action.replyToMessageId() != null
                            ? action.replyToMessageId().value()
                            : null)
                    .replyMarkup(chunk.last() && action.keyboard() != null ? toMarkup(action.keyboard()) : null)
                    .build());
        }
        return methods;
    }

    public AnswerInlineQuery toAnswerInlineQuery(AnswerInlineQueryAction action) {
        List<InlineQueryResult> results = new ArrayList<>(action.results().size());
        for (InlineArticle article : action.results()) {
            results.add(toArticle(article));
        }
        return AnswerInlineQuery.builder()
                .inlineQueryId(action.queryId().value())
                .results(results)
                .cacheTime(action.cacheTimeSeconds())
                .isPersonal(action.personal() ? Boolean.TRUE : null)
                .nextOffset(action.nextOffset())
                .build();
    }

    public AnswerCallbackQuery toAnswerCallbackQuery(AnswerCallbackQueryAction action) {
        return AnswerCallbackQuery.builder()
                .callbackQueryId(action.queryId().value())
                .text(action.text())
                .showAlert(action.showAlert() ? Boolean.TRUE : null)
                .url(action.url())
                .cacheTime(action.cacheTimeSeconds())
                .build();
    }

    InlineKeyboardMarkup toMarkup(InlineKeyboard keyboard) {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (List<KeyboardButton> row : keyboard.rows()) {
            InlineKeyboardButton[] buttons = new InlineKeyboardButton[row.size()];
            for (int i = 0; i < row.size(); i++) {
                buttons[i] = toButton(row.get(i));
            }
            rows.add(new InlineKeyboardRow(buttons));
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private InlineKeyboardButton toButton(KeyboardButton button) {
        if (button.url() != null) {
            return InlineKeyboardButton.builder()
                    .text(button.text())
                    .url(button.url())
                    .build();
        }
        return InlineKeyboardButton.builder()
                .text(button.text())
                .callbackData(button.callbackData())
                .build();
    }

    private InlineQueryResultArticle toArticle(InlineArticle article) {
        return InlineQueryResultArticle.builder()
                .id(article.id())
                .title(article.title())
                .description(article.description())
                .inputMessageContent(InputTextMessageContent.builder()
                        .messageText(article.messageText())
                        .parseMode(article.parseMode() != null ? article.parseMode().apiValue() : null)
                        .build())
                .build();
    }

    /**
     * Cut {@code text} into chunks of at most {@code maxLength} UTF-16 units.
     *
     * <p>
     * Each cut goes at the last paragraph break, line break or space inside the
     * window, in that order of preference, and the separator itself is dropped. A
     * break in the first quarter of the window is ignored so chunks do not get
     * tiny. Without a usable break the text is cut hard, but never between the two
     * halves of a surrogate pair.
     */
    static List<MessageChunk> chunk(String text, int maxLength) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        while (text.length() - from > maxLength) {
            Cut cut = findCut(text, from, from + maxLength);
            parts.add(text.substring(from, cut.end()));
            from = cut.resume();
        }
        parts.add(text.substring(from));

        List<MessageChunk> chunks = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            chunks.add(new MessageChunk(parts.get(i), i == 0, i == parts.size() - 1));
        }
        return chunks;
    }

    private static Cut findCut(String text, int from, int limit) {
        int minEnd = from + (limit - from) / 4;
        for (String separator : BREAKS) {
            int at = text.lastIndexOf(separator, limit);
            if (at > minEnd) {
                return new Cut(at, at + separator.length());
            }
        }
        int end = Character.isLowSurrogate(text.charAt(limit)) ? limit - 1 : limit;
        return new Cut(end, end);
    }

    /**
     * Text of one outgoing message and its position in the split.
     */
    record MessageChunk(String text, boolean first, boolean last) {
    }

    private record Cut(int end, int resume) {
    }
}
