package com.qqsuccubus.chatrelay.socket;

import com.qqsuccubus.chatrelay.core.store.MessageStore;
import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.http.HttpServer;
import com.qqsuccubus.chatrelay.socket.hub.Hub;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import com.qqsuccubus.chatrelay.socket.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Main entry point for the chat relay.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws (query: optional username)</li>
 *   <li>Run the hub loop that owns membership and message history</li>
 *   <li>Expose /healthz and /metrics endpoints, plus static assets</li>
 *   <li>Close every client connection on shutdown</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();

        log.info("Starting chat relay on port {}", config.getHttpPort());
        log.info("  ping={}s idle={}s write={}s queue={} replay={}",
            config.getPingInterval(), config.getIdleTimeout(), config.getWriteTimeout(),
            config.getOutboundQueueSize(), config.getHistoryReplaySize());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter("chat-relay");
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());

        MessageStore store = new MessageStore(config.getHistoryMaxSize());
        Hub hub = new Hub(config, store, metricsService);
        hub.start();

        HttpServer httpServer = new HttpServer(config, hub, metricsService, metricsExporter);
        try {
            httpServer.start();
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP server", e);
            System.exit(1);
        }

        log.info("Chat relay is ready");

        handleShutdown(httpServer, hub);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(HttpServer httpServer, Hub hub) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Close client queues first so writers can send their close frames
            hub.shutdown().block(Duration.ofSeconds(10));

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
