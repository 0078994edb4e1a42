package com.qqsuccubus.chatrelay.socket.ws;

import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.hub.Client;
import com.qqsuccubus.chatrelay.socket.hub.ClientFactory;
import com.qqsuccubus.chatrelay.socket.hub.IHub;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Accepts WebSocket upgrades and turns each one into a registered {@link Client}.
 * <p>
 * The display name comes from the {@code username} query parameter, read before the upgrade.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final SocketConfig config;
    private final WebSocketHandler wsHandler;
    private final ClientFactory clientFactory;
    private final MetricsService metricsService;
    private final WebsocketServerSpec websocketSpec;

    public WebSocketUpgradeHandler(SocketConfig config, IHub hub, MetricsService metricsService) {
        this.config = config;
        this.wsHandler = new WebSocketHandler(config, hub, metricsService);
        this.clientFactory = new ClientFactory(config);
        this.metricsService = metricsService;
        this.websocketSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxFrameBytes())
            .build();
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        String username = resolveUsername(decoder.parameters().get("username"), config.getDefaultUsername());

        log.info("WebSocket connection request from {} as {}", req.remoteAddress(), username);

        return res.sendWebsocket((inbound, outbound) -> {
                Client client = clientFactory.createClient(username);
                metricsService.recordConnection();
                log.debug("Created client {}", client);
                return wsHandler.handle(inbound, outbound, client);
            }, websocketSpec)
            .doOnError(err -> log.warn("WebSocket upgrade failed for {}: {}", req.remoteAddress(), err.getMessage()));
    }

    /**
     * First non-empty {@code username} value, or the default.
     */
    static String resolveUsername(List<String> values, String defaultUsername) {
        return Stream.ofNullable(values)
            .flatMap(Collection::stream)
            .filter(value -> !value.isEmpty())
            .findFirst()
            .orElse(defaultUsername);
    }
}
