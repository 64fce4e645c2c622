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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.AnswerCallbackQueryAction;
import me.golemcore.runtime.domain.model.AnswerInlineQueryAction;
import me.golemcore.runtime.domain.model.SendMessageAction;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import me.golemcore.runtime.port.outbound.ActionDispatchException;
import me.golemcore.runtime.port.outbound.ActionPort;
import me.golemcore.runtime.ratelimit.RateLimitResult;
import me.golemcore.runtime.ratelimit.TokenBucket;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Duration;

/**
 * Executes domain actions against the Telegram Bot API.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Outbound calls paced by a token bucket at
 * {@code bot.dispatch.messages-per-second}
 * <li>Retry on HTTP 429 honouring {@code retry_after}, capped at
 * {@code bot.dispatch.retry-after-cap-seconds}, up to
 * {@code bot.dispatch.max-retry-attempts} times
 * <li>Long messages split into several {@code sendMessage} calls
 * </ul>
 *
 * <p>
 * Any other API error is surfaced as an {@link ActionDispatchException} carrying
 * the platform's description.
 */
@Component
@Slf4j
public class TelegramActionAdapter implements ActionPort {

    private final TelegramClient telegramClient;
    private final TelegramMethodMapper methodMapper;
    private final BotProperties.DispatchProperties dispatch;
    private final TokenBucket outboundBucket;

    public TelegramActionAdapter(TelegramClient telegramClient, TelegramMethodMapper methodMapper,
            BotProperties properties) {
        this.telegramClient = telegramClient;
        this.methodMapper = methodMapper;
        this.dispatch = properties.getDispatch();
        this.outboundBucket = new TokenBucket(dispatch.getMessagesPerSecond(), Duration.ofSeconds(1));
    }

    @Override
    public void execute(Action action) {
        try {
            if (action instanceof SendMessageAction sendMessage) {
                for (SendMessage method : methodMapper.toSendMessages(sendMessage)) {
                    throttle();
                    executeWithRetry(() -> telegramClient.execute(method));
                }
            } else if (action instanceof AnswerInlineQueryAction answerInlineQuery) {
                throttle();
                executeWithRetry(() -> telegramClient.execute(methodMapper.toAnswerInlineQuery(answerInlineQuery)));
            } else if (action instanceof AnswerCallbackQueryAction answerCallbackQuery) {
                throttle();
                executeWithRetry(
                        () -> telegramClient.execute(methodMapper.toAnswerCallbackQuery(answerCallbackQuery)));
            } else {
                throw new ActionDispatchException("Unsupported action: " + action.getClass().getName(), null, null);
            }
        } catch (TelegramApiRequestException e) {
            throw new ActionDispatchException(TelegramErrors.describe(e), e.getErrorCode(), e);
        } catch (TelegramApiException e) {
            throw new ActionDispatchException(e.getMessage(), null, e);
        }
    }

    // ===== Rate-limit retry logic =====

    @FunctionalInterface
    interface TelegramApiCall<T> {
        T execute() throws TelegramApiException;
    }

    <T> T executeWithRetry(TelegramApiCall<T> call) throws TelegramApiException {
        int maxAttempts = dispatch.getMaxRetryAttempts();
        for (int attempt = 0;; attempt++) {
            try {
                return call.execute();
            } catch (TelegramApiRequestException e) {
                if (!TelegramErrors.isRateLimited(e) || attempt >= maxAttempts) {
                    throw e;
                }
                int retryAfter = TelegramErrors.retryAfterSeconds(e, dispatch.getRetryAfterCapSeconds());
                log.warn("[Telegram] Rate limited (429), waiting {}s before retry (attempt {}/{})",
                        retryAfter, attempt + 1, maxAttempts);
                sleepForRetry(retryAfter * 1000L);
            }
        }
    }

    private void throttle() {
        RateLimitResult result = outboundBucket.tryConsume();
        while (!result.allowed()) {
            log.debug("[Telegram] Outbound rate reached, waiting {}ms", result.waitTime().toMillis());
            sleepForRetry(result.waitTime().toMillis());
            result = outboundBucket.tryConsume();
        }
    }

    /**
     * Package-private for testing — allows tests to override sleep behavior.
     */
    void sleepForRetry(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionDispatchException("Interrupted while waiting to retry", null, e);
        }
    }
}
