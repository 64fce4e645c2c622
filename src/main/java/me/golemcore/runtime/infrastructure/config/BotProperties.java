package me.golemcore.runtime.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - credential and update kinds to receive</li>
 * <li>{@link PollingProperties} - long-poll duration and batch size</li>
 * <li>{@link BackoffProperties} - retry delays after failed fetches</li>
 * <li>{@link DispatchProperties} - outbound worker pool, retries and pacing</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link RuntimeProperties} - loop lifecycle</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private PollingProperties polling = new PollingProperties();
    private BackoffProperties backoff = new BackoffProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private HttpProperties http = new HttpProperties();
    private RuntimeProperties runtime = new RuntimeProperties();

    @Data
    public static class TelegramProperties {
        private String token;
        private List<String> allowedUpdates = new ArrayList<>(List.of("message", "inline_query", "callback_query"));
    }

    @Data
    public static class PollingProperties {
        /** Long-poll duration passed to getUpdates. */
        private int timeoutSeconds = 30;

        /** Max updates per batch (1-100). */
        private int limit = 100;

        /**
         * Extra time on top of the long-poll duration before the HTTP call is
         * abandoned.
         */
        private int ceilingMarginSeconds = 10;

        /** Pause after an empty batch. */
        private long idlePauseMs = 0;
    }

    @Data
    public static class BackoffProperties {
        private long initialDelayMs = 500;
        private long maxDelayMs = 30000;
        private double multiplier = 2.0;
    }

    @Data
    public static class DispatchProperties {
        private int threads = 4;
        private int maxRetryAttempts = 3;
        private int retryAfterCapSeconds = 30;
        private int messagesPerSecond = 30;
        private long shutdownGraceMs = 5000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class RuntimeProperties {
        /** Start the loop as soon as the application is ready. */
        private boolean autoStart = true;

        /** Time to wait for the loop thread to finish on shutdown. */
        private long stopTimeoutMs = 10000;
    }
}
