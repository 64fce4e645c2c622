package me.golemcore.runtime.adapter.outbound.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.CallbackQueryEvent;
import me.golemcore.runtime.domain.model.EventBatch;
import me.golemcore.runtime.domain.model.InlineQueryEvent;
import me.golemcore.runtime.domain.model.MessageEvent;
import me.golemcore.runtime.infrastructure.config.BotProperties;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.port.outbound.TransportException;
import me.golemcore.runtime.testsupport.http.TelegramApiMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramEventSourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private static final String START_MESSAGE = """
            {"update_id":101,"message":{"message_id":5,"date":1767225600,
             "chat":{"id":42,"type":"private","username":"alice"},
             "from":{"id":1001,"is_bot":false,"first_name":"Alice","username":"alice"},
             "text":"/start"}}""";

    private static final String INLINE_QUERY = """
            {"update_id":102,"inline_query":{"id":"iq-1","query":"cats","offset":"",
             "from":{"id":1001,"is_bot":false,"first_name":"Alice"}}}""";

    private static final String CALLBACK_QUERY = """
            {"update_id":103,"callback_query":{"id":"cb-1","chat_instance":"ci","data":"ping",
             "from":{"id":1001,"is_bot":false,"first_name":"Alice"},
             "message":{"message_id":6,"date":1767225600,"chat":{"id":42,"type":"private"}}}}""";

    private TelegramApiMockEngine api;
    private BotProperties properties;
    private ObjectMapper objectMapper;
    private TelegramEventSource eventSource;

    @BeforeEach
    void setUp() {
        api = new TelegramApiMockEngine();
        properties = new BotProperties();
        properties.getTelegram().setToken("test-token");
        objectMapper = RuntimeConfiguration.objectMapper();
        eventSource = new TelegramEventSource(properties, api.client(), objectMapper, new TelegramUpdateMapper());
    }

    @Test
    void fetch_decodesSupportedUpdatesInOrder() throws Exception {
        api.enqueueOk("[" + START_MESSAGE + "," + INLINE_QUERY + "," + CALLBACK_QUERY + "]");

        EventBatch batch = eventSource.fetch(100, TIMEOUT);

        assertEquals(3, batch.events().size());
        MessageEvent message = assertInstanceOf(MessageEvent.class, batch.events().get(0));
        assertEquals(101, message.updateId());
        assertEquals("/start", message.message().text());
        assertEquals(42, message.message().chat().id().value());
        assertEquals("alice", message.message().from().username());
        InlineQueryEvent inline = assertInstanceOf(InlineQueryEvent.class, batch.events().get(1));
        assertEquals("cats", inline.query().query());
        CallbackQueryEvent callback = assertInstanceOf(CallbackQueryEvent.class, batch.events().get(2));
        assertEquals("ping", callback.query().data());
        assertEquals(42, callback.query().chatId().value());
        assertEquals(OptionalLong.of(103), batch.lastUpdateId());
        assertEquals(0, batch.skipped());
    }

    @Test
    void fetch_sendsCursorTimeoutAndAllowedUpdates() throws Exception {
        api.enqueueOk("[]");

        eventSource.fetch(1234, TIMEOUT);

        TelegramApiMockEngine.CapturedRequest request = api.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/bottest-token/getUpdates", request.path());
        assertEquals("getUpdates", request.apiMethod());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals(1234, body.get("offset").asLong());
        assertEquals(30, body.get("timeout").asInt());
        assertEquals(100, body.get("limit").asInt());
        assertEquals("callback_query", body.get("allowed_updates").get(2).asText());
    }

    @Test
    void fetch_emptyResultIsEmptyBatch() throws Exception {
        api.enqueueOk("[]");

        EventBatch batch = eventSource.fetch(100, TIMEOUT);

        assertTrue(batch.isEmpty());
    }

    @Test
    void fetch_dropsMalformedAndUnsupportedUpdatesButCountsTheirIds() throws Exception {
        String malformed = "{\"update_id\":102,\"message\":{\"message_id\":\"not-a-number\"}}";
        String unsupported = "{\"update_id\":103}";
        api.enqueueOk("[" + START_MESSAGE + "," + malformed + "," + unsupported + "]");

        EventBatch batch = eventSource.fetch(100, TIMEOUT);

        assertEquals(1, batch.events().size());
        assertEquals(2, batch.skipped());
        assertEquals(OptionalLong.of(103), batch.lastUpdateId());
    }

    @Test
    void fetch_dropsUpdatesBelowCursorOrOutOfOrder() throws Exception {
        String stale = "{\"update_id\":50}";
        String repeated = START_MESSAGE;
        api.enqueueOk("[" + stale + "," + START_MESSAGE + "," + repeated + "]");

        EventBatch batch = eventSource.fetch(100, TIMEOUT);

        assertEquals(1, batch.events().size());
        assertEquals(2, batch.skipped());
        assertEquals(OptionalLong.of(101), batch.lastUpdateId());
    }

    @Test
    void fetch_updateWithoutIdIsSkipped() throws Exception {
        api.enqueueOk("[{\"message\":{}}]");

        EventBatch batch = eventSource.fetch(100, TIMEOUT);

        assertTrue(batch.events().isEmpty());
        assertTrue(batch.lastUpdateId().isEmpty());
        assertEquals(1, batch.skipped());
    }

    @Test
    void fetch_apiErrorBecomesTransportException() {
        api.enqueueError(401, "Unauthorized");

        TransportException e = assertThrows(TransportException.class, () -> eventSource.fetch(100, TIMEOUT));

        assertEquals(401, e.getErrorCode());
        assertTrue(e.getMessage().contains("Unauthorized"));
    }

    @Test
    void fetch_timeoutBecomesTransportException() {
        api.enqueueFailure(new SocketTimeoutException("timeout"));

        TransportException e = assertThrows(TransportException.class, () -> eventSource.fetch(100, TIMEOUT));

        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void cancel_abortsBlockedLongPoll() throws Exception {
        api.enqueueHang();
        CompletableFuture<EventBatch> poll = CompletableFuture.supplyAsync(() -> {
            try {
                return eventSource.fetch(100, TIMEOUT);
            } catch (TransportException e) {
                throw new CompletionException(e);
            }
        });
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (api.getRequestCount() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, api.getRequestCount());

        eventSource.cancel();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> poll.get(5, TimeUnit.SECONDS));
        TransportException e = assertInstanceOf(TransportException.class, failure.getCause());
        assertTrue(e.getMessage().contains("cancelled"));
    }

    @Test
    void cancel_withNothingInFlightIsHarmless() throws Exception {
        eventSource.cancel();
        api.enqueueOk("[]");

        assertTrue(eventSource.fetch(100, TIMEOUT).isEmpty());
    }

    @Test
    void parseResponse_rejectsNonJsonBody() {
        assertThrows(TransportException.class,
                () -> eventSource.parseResponse(502, "<html>Bad Gateway</html>", 100));
    }

    @Test
    void parseResponse_rejectsMissingResultArray() {
        assertThrows(TransportException.class,
                () -> eventSource.parseResponse(200, "{\"ok\":true,\"result\":{}}", 100));
    }
}
