package com.qqsuccubus.chatrelay.socket.http;

import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.hub.IHub;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import com.qqsuccubus.chatrelay.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chatrelay.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for the WebSocket endpoint, health check, metrics and static assets.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final IHub hub;
    private final MetricsService metricsService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     *
     * @return bound server; {@code port()} gives the actual port when configured with 0
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(config, hub, metricsService);

        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> {
                routes
                    // WebSocket upgrade endpoint with param extraction
                    .get(config.getWsPath(), upgradeHandler::handle)
                    .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                    // Metrics endpoint with Prometheus scraping
                    .get("/metrics", (req, res) -> {
                        if (metricsExporter == null) {
                            return res.status(404).send();
                        }
                        return res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                            .sendString(Mono.just(metricsExporter.scrape()));
                    });
                staticRoutes(routes);
            })
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}, WebSocket endpoint {}", server.port(), config.getWsPath());
        return server;
    }

    private void staticRoutes(HttpServerRoutes routes) {
        if (config.getStaticDir() == null) {
            return;
        }
        Path dir = Paths.get(config.getStaticDir()).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            log.info("Static directory {} not found, static assets disabled", dir);
            return;
        }
        Path index = dir.resolve("index.html");
        if (Files.isReadable(index)) {
            routes.get("/", (req, res) -> res.sendFile(index));
        }
        routes.directory("/", dir);
        log.info("Serving static assets from {}", dir);
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
