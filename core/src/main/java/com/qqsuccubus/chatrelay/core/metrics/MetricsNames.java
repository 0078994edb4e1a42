package com.qqsuccubus.chatrelay.core.metrics;

/**
 * Micrometer metric names used by the relay.
 * <p>
 * <b>Naming convention:</b> {@code chat.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Clients currently registered with the hub.
     */
    public static final String HUB_CLIENTS = "chat.hub.clients";

    /**
     * Counter: WebSocket connections accepted.
     */
    public static final String CONNECTIONS_TOTAL = "chat.socket.connections.total";

    /**
     * Counter: Chat messages stored.
     */
    public static final String MESSAGES_TOTAL = "chat.hub.messages.total";

    /**
     * Counter: Fan-out passes, tagged by event type.
     * <p>
     * Tags: type (message/userList/messageEdited/messageDeleted)
     * </p>
     */
    public static final String BROADCASTS_TOTAL = "chat.hub.broadcasts.total";

    /**
     * Counter: Clients evicted because their outbound queue was full.
     */
    public static final String EVICTIONS_TOTAL = "chat.hub.evictions.total";

    /**
     * Counter: Inbound frames dropped.
     * <p>
     * Tags: reason (invalid)
     * </p>
     */
    public static final String DROPS_TOTAL = "chat.socket.drops.total";

    /**
     * Timer: Duration of one fan-out pass over all clients.
     */
    public static final String BROADCAST_LATENCY = "chat.hub.broadcast.latency";

    /**
     * Counter: Bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "chat.socket.network.inbound.ws.bytes";

    /**
     * Counter: Bytes sent to WebSocket clients.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "chat.socket.network.outbound.ws.bytes";
}
