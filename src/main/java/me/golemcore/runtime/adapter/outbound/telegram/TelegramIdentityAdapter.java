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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.model.UserId;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import me.golemcore.runtime.port.outbound.IdentityPort;
import me.golemcore.runtime.port.outbound.TransportException;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/**
 * Resolves the bot account through Telegram {@code getMe}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramIdentityAdapter implements IdentityPort {

    private final BotProperties properties;
    private final TelegramClient telegramClient;

    @Override
    public Identity fetchIdentity() throws TransportException {
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            throw new TransportException("Telegram token not configured (bot.telegram.token)");
        }

        User me;
        try {
            me = telegramClient.execute(new GetMe());
        } catch (TelegramApiRequestException e) {
            throw new TransportException("getMe rejected: " + TelegramErrors.describe(e), e.getErrorCode(), e);
        } catch (TelegramApiException e) {
            throw new TransportException("getMe failed: " + e.getMessage(), e);
        }

        if (me == null || me.getId() == null) {
            throw new TransportException("getMe returned no account");
        }
        if (!Boolean.TRUE.equals(me.getIsBot())) {
            log.warn("[Telegram] Credential belongs to a non-bot account {}", me.getId());
        }
        return new Identity(new UserId(me.getId()), me.getFirstName(), me.getLastName(), me.getUserName());
    }
}
