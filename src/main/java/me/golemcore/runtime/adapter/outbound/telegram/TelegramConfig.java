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

import me.golemcore.runtime.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/**
 * Spring configuration for the Telegram Bot API client.
 *
 * <p>
 * The client is created even without a token so that the context starts; the
 * identity lookup then fails and the runtime stays in the errored state.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TelegramConfig {

    private final BotProperties properties;

    @Bean
    public TelegramClient telegramClient(OkHttpClient okHttpClient) {
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] bot.telegram.token is not configured");
            token = "";
        }
        return new OkHttpTelegramClient(okHttpClient, token);
    }
}
