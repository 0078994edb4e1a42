package com.qqsuccubus.chatrelay.socket.http;

import com.qqsuccubus.chatrelay.core.store.MessageStore;
import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.hub.ClientInbox;
import com.qqsuccubus.chatrelay.socket.hub.Hub;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection-level behaviour of the pumps over real sockets: frame limit, read-idle timeout,
 * keepalive pings and the close frame sent when a client's queue is completed.
 * <p>
 * Runs with a 1 s ping interval and a 2 s idle timeout so the timers fire within the test.
 * </p>
 */
class WebSocketTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_FRAME_BYTES = 512;
    private static final int PING_INTERVAL = 1;
    private static final int IDLE_TIMEOUT = 2;

    private Hub hub;
    private HttpServer httpServer;
    private MessageStore store;
    private int port;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.builder()
            .httpPort(0)
            .wsPath("/ws")
            .staticDir(null)
            .maxFrameBytes(MAX_FRAME_BYTES)
            .pingInterval(PING_INTERVAL)
            .idleTimeout(IDLE_TIMEOUT)
            .writeTimeout(10)
            .outboundQueueSize(256)
            .historyReplaySize(50)
            .defaultUsername("Anonymous")
            .build()
            .validated();

        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        store = new MessageStore();
        hub = new Hub(config, store, metricsService);
        hub.start();
        httpServer = new HttpServer(config, hub, metricsService, null);
        port = httpServer.start().port();
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
        hub.shutdown().block(TIMEOUT);
    }

    @Test
    @DisplayName("A frame above the size limit closes the connection with 1009 and unregisters the client")
    void testOversizedFrameClosesConnection() throws InterruptedException {
        String oversized = "{\"type\":\"message\",\"content\":\"" + "x".repeat(600) + "\"}";

        WebSocketCloseStatus status = HttpClient.create()
            .websocket()
            .uri(wsUri("big"))
            .handle((in, out) -> out.sendString(Mono.just(oversized))
                .then()
                .then(in.receiveCloseStatus()))
            .next()
            .block(TIMEOUT);

        assertNotNull(status);
        assertEquals(WebSocketCloseStatus.MESSAGE_TOO_BIG.code(), status.code());
        awaitClientCount(0);
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("A peer that never answers pings is disconnected after the idle timeout")
    void testReadIdleClosesSilentPeer() throws InterruptedException {
        AtomicInteger pings = new AtomicInteger();
        long startNanos = System.nanoTime();

        // handlePing(true): pings reach the handler and no pong is sent back
        HttpClient.create()
            .websocket(WebsocketClientSpec.builder().handlePing(true).build())
            .uri(wsUri("silent"))
            .handle((in, out) -> in.receiveFrames()
                .doOnNext(frame -> {
                    if (frame instanceof PingWebSocketFrame) {
                        pings.incrementAndGet();
                    }
                })
                .then())
            .then()
            .onErrorResume(err -> Mono.empty())
            .block(TIMEOUT);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        assertTrue(pings.get() >= 1, "server must ping every " + PING_INTERVAL + "s, got " + pings.get());
        assertTrue(elapsed.toMillis() >= IDLE_TIMEOUT * 1000L - 500,
            "closed too early: " + elapsed.toMillis() + " ms");
        awaitClientCount(0);
    }

    @Test
    @DisplayName("Answered pings keep an otherwise silent peer connected beyond the idle timeout")
    void testPingsKeepLivePeerConnected() {
        String frame = "{\"type\":\"message\",\"content\":\"still here\"}";

        List<String> echoes = HttpClient.create()
            .websocket()
            .uri(wsUri("alive"))
            .handle((in, out) -> {
                Mono<Void> lateSend = Mono.delay(Duration.ofSeconds(IDLE_TIMEOUT * 2L))
                    .then(out.sendString(Mono.just(frame)).then());
                Flux<String> messages = in.receive()
                    .asString()
                    .filter(text -> "message".equals(ClientInbox.parse(text).path("type").asText()))
                    .take(1);
                return messages.mergeWith(lateSend.then(Mono.<String>empty()));
            })
            .collectList()
            .block(TIMEOUT);

        assertNotNull(echoes);
        assertEquals(1, echoes.size());
        assertEquals("still here", ClientInbox.parse(echoes.get(0)).get("content").asText());
    }

    @Test
    @DisplayName("Closing the client's queue makes the writer send a normal close frame")
    void testQueueCompletionSendsNormalClose() throws InterruptedException {
        AtomicBoolean shutdownTriggered = new AtomicBoolean();

        WebSocketCloseStatus status = HttpClient.create()
            .websocket()
            .uri(wsUri("dave"))
            .handle((in, out) -> in.receive()
                .asString()
                .doOnNext(text -> {
                    // First event is the presence snapshot: the client is registered
                    if (shutdownTriggered.compareAndSet(false, true)) {
                        hub.shutdown().subscribe();
                    }
                })
                .then(in.receiveCloseStatus()))
            .next()
            .block(TIMEOUT);

        assertNotNull(status);
        assertEquals(WebSocketCloseStatus.NORMAL_CLOSURE.code(), status.code());
        awaitClientCount(0);
    }

    private String wsUri(String username) {
        return "ws://localhost:" + port + "/ws?username=" + username;
    }

    private void awaitClientCount(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (hub.getClientCount() != expected && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(expected, hub.getClientCount());
    }
}
