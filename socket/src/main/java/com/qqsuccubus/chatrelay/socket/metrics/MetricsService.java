package com.qqsuccubus.chatrelay.socket.metrics;

import com.qqsuccubus.chatrelay.core.metrics.MetricsNames;
import com.qqsuccubus.chatrelay.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics service for the relay node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeClients = new AtomicInteger();

    // Counters
    private final Counter connections;
    private final Counter messages;
    private final Counter evictions;
    private final Counter dropsInvalid;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    // Timers
    private final Timer broadcastLatency;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        Gauge.builder(MetricsNames.HUB_CLIENTS, activeClients, AtomicInteger::get)
            .description("Clients currently registered with the hub")
            .register(registry);

        connections = Counter.builder(MetricsNames.CONNECTIONS_TOTAL)
            .description("WebSocket connections accepted")
            .register(registry);

        messages = Counter.builder(MetricsNames.MESSAGES_TOTAL)
            .description("Chat messages stored")
            .register(registry);

        evictions = Counter.builder(MetricsNames.EVICTIONS_TOTAL)
            .description("Clients evicted because their outbound queue was full")
            .register(registry);

        dropsInvalid = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.REASON, "invalid")
            .description("Inbound frames dropped as undecodable or invalid")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        broadcastLatency = Timer.builder(MetricsNames.BROADCAST_LATENCY)
            .description("Duration of one fan-out pass over all clients")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofNanos(100_000),
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50)
            )
            .register(registry);
    }

    public void setActiveClients(int count) {
        activeClients.set(count);
    }

    public void recordConnection() {
        connections.increment();
    }

    public void recordMessage() {
        messages.increment();
    }

    public void recordEviction() {
        evictions.increment();
    }

    public void recordDropInvalid() {
        dropsInvalid.increment();
    }

    /**
     * Records one fan-out pass.
     *
     * @param eventType  outbound event type, used as tag
     * @param startNanos {@link System#nanoTime()} at the start of the pass
     */
    public void recordBroadcast(String eventType, long startNanos) {
        broadcastLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
        registry.counter(MetricsNames.BROADCASTS_TOTAL, MetricsTags.TYPE, eventType).increment();
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

}
