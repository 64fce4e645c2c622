package me.golemcore.runtime.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * HTTP clients for the Bot API.
 *
 * <p>
 * Two clients share one connection pool and dispatcher:
 * <ul>
 * <li>{@code okHttpClient} (primary) carries {@code getMe} and every outbound
 * action. The pool keeps one idle connection per dispatch worker so concurrent
 * sends do not reconnect.</li>
 * <li>{@value #LONG_POLL_CLIENT} carries {@code getUpdates}. It has no read
 * timeout; each poll is bounded by its own call timeout instead.</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    public static final String LONG_POLL_CLIENT = "longPollHttpClient";

    private final BotProperties properties;

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        return telegramApiClient(properties);
    }

    @Bean(LONG_POLL_CLIENT)
    public OkHttpClient longPollHttpClient(@Qualifier("okHttpClient") OkHttpClient okHttpClient) {
        return longPollClient(okHttpClient);
    }

    static OkHttpClient telegramApiClient(BotProperties properties) {
        BotProperties.HttpProperties http = properties.getHttp();
        int workers = Math.max(1, properties.getDispatch().getThreads());

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(Math.max(dispatcher.getMaxRequestsPerHost(), workers + 1));

        int idleConnections = Math.max(http.getMaxIdleConnections(), workers + 1);
        log.debug("[HTTP] Bot API client: {} idle connection(s), {} request(s) per host",
                idleConnections, dispatcher.getMaxRequestsPerHost());

        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(idleConnections, http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .addInterceptor(new BotApiLoggingInterceptor())
                .retryOnConnectionFailure(true)
                .build();
    }

    static OkHttpClient longPollClient(OkHttpClient apiClient) {
        return apiClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * Logs each Bot API call by method name. The URL is never logged because
     * its path carries the bot token.
     */
    static final class BotApiLoggingInterceptor implements Interceptor {

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            String method = apiMethod(request);
            long startNanos = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                log.debug("[HTTP] {} -> {} in {}ms", method, response.code(), elapsedMs(startNanos));
                return response;
            } catch (IOException e) {
                log.debug("[HTTP] {} failed after {}ms: {}", method, elapsedMs(startNanos), e.getMessage());
                throw e;
            }
        }

        static String apiMethod(Request request) {
            List<String> segments = request.url().pathSegments();
            return segments.isEmpty() ? "?" : segments.get(segments.size() - 1);
        }

        private static long elapsedMs(long startNanos) {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
