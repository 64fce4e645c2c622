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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.EventBatch;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import me.golemcore.runtime.infrastructure.http.OkHttpConfig;
import me.golemcore.runtime.port.outbound.EventSourcePort;
import me.golemcore.runtime.port.outbound.TransportException;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Telegram {@code getUpdates} long-polling source.
 *
 * <p>
 * Calls the Bot API over OkHttp and decodes the response with Jackson one update
 * at a time, so a single malformed or unsupported update is dropped without
 * losing the rest of the batch. Dropped updates still count towards
 * {@link EventBatch#lastUpdateId()} so the cursor moves past them.
 *
 * <p>
 * Every call is bounded by the long-poll duration plus
 * {@code bot.polling.ceiling-margin-seconds}; a server that never answers
 * surfaces as a {@link TransportException} rather than a hung loop.
 * {@link #cancel()} aborts the poll in progress so shutdown does not wait for
 * it.
 *
 * @see me.golemcore.runtime.port.outbound.EventSourcePort
 */
@Component
@Slf4j
public class TelegramEventSource implements EventSourcePort {

    static final String API_BASE_URL = "https://api.telegram.org/bot";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_LOGGED_PAYLOAD_CHARS = 300;

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TelegramUpdateMapper updateMapper;

    private volatile Call inFlight;

    public TelegramEventSource(BotProperties properties,
            @Qualifier(OkHttpConfig.LONG_POLL_CLIENT) OkHttpClient httpClient,
            ObjectMapper objectMapper, TelegramUpdateMapper updateMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.updateMapper = updateMapper;
    }

    @Override
    public EventBatch fetch(long cursor, Duration timeout) throws TransportException {
        BotProperties.PollingProperties polling = properties.getPolling();
        String body;
        try {
            body = objectMapper.writeValueAsString(new GetUpdatesRequest(
                    cursor,
                    timeout.toSeconds(),
                    polling.getLimit(),
                    properties.getTelegram().getAllowedUpdates()));
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to encode getUpdates request", e);
        }

        Request request = new Request.Builder()
                .url(API_BASE_URL + properties.getTelegram().getToken() + "/getUpdates")
                .post(RequestBody.create(body, JSON))
                .build();

        Call call = httpClient.newCall(request);
        long ceilingMs = timeout.toMillis() + TimeUnit.SECONDS.toMillis(polling.getCeilingMarginSeconds());
        call.timeout().timeout(ceilingMs, TimeUnit.MILLISECONDS);

        inFlight = call;
        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            return parseResponse(response.code(), payload, cursor);
        } catch (IOException e) {
            if (call.isCanceled()) {
                throw new TransportException("getUpdates cancelled", e);
            }
            throw new TransportException("getUpdates failed: " + e.getMessage(), e);
        } finally {
            inFlight = null;
        }
    }

    /**
     * Abort the long poll currently blocked in {@link #fetch}, if any. The
     * blocked call fails with a {@link TransportException}.
     */
    @Override
    public void cancel() {
        Call call = inFlight;
        if (call != null) {
            log.debug("[Telegram] Cancelling in-flight getUpdates");
            call.cancel();
        }
    }

    EventBatch parseResponse(int httpCode, String payload, long cursor) throws TransportException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed getUpdates response (HTTP " + httpCode + ")", httpCode, e);
        }
        if (root == null || !root.path("ok").asBoolean(false)) {
            int errorCode = root != null ? root.path("error_code").asInt(httpCode) : httpCode;
            String description = root != null ? root.path("description").asText("HTTP " + httpCode) : "empty body";
            throw new TransportException("getUpdates rejected: [" + errorCode + "] " + description, errorCode, null);
        }
        JsonNode result = root.path("result");
        if (!result.isArray()) {
            throw new TransportException("getUpdates response has no result array", httpCode, null);
        }
        return decodeUpdates(result, cursor);
    }

    private EventBatch decodeUpdates(JsonNode updates, long cursor) {
        List<Event> events = new ArrayList<>();
        Long lastUpdateId = null;
        int skipped = 0;

        for (JsonNode node : updates) {
            JsonNode idNode = node.path("update_id");
            if (!idNode.isIntegralNumber()) {
                skipped++;
                log.warn("[Telegram] Dropping update without update_id: {}", truncate(node.toString()));
                continue;
            }
            long updateId = idNode.asLong();
            if (updateId < cursor || (lastUpdateId != null && updateId <= lastUpdateId)) {
                skipped++;
                log.warn("[Telegram] Dropping out-of-order update {} (cursor {}, last {})",
                        updateId, cursor, lastUpdateId);
                continue;
            }
            lastUpdateId = updateId;

            Optional<Event> event;
            try {
                Update update = objectMapper.treeToValue(node, Update.class);
                event = updateMapper.map(updateId, update);
            } catch (JsonProcessingException | RuntimeException e) {
                skipped++;
                log.warn("[Telegram] Dropping malformed update {}: {}", updateId, e.getMessage());
                continue;
            }
            if (event.isPresent()) {
                events.add(event.get());
            } else {
                skipped++;
                log.debug("[Telegram] Ignoring unsupported update {}", updateId);
            }
        }

        OptionalLong last = lastUpdateId != null ? OptionalLong.of(lastUpdateId) : OptionalLong.empty();
        return new EventBatch(events, last, skipped);
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_LOGGED_PAYLOAD_CHARS) {
            return text;
        }
        return text.substring(0, MAX_LOGGED_PAYLOAD_CHARS) + "...";
    }

    record GetUpdatesRequest(long offset, long timeout, int limit,
            @JsonProperty("allowed_updates") List<String> allowedUpdates) {
    }
}
