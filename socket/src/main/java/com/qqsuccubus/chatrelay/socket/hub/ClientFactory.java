package com.qqsuccubus.chatrelay.socket.hub;

import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.UUID;

/**
 * Factory for creating Client objects.
 * <p>
 * Separated from the hub to isolate identity and queue allocation.
 * </p>
 */
public class ClientFactory {
    private final SocketConfig config;

    public ClientFactory(SocketConfig config) {
        this.config = config;
    }

    /**
     * Creates a new client with a fresh identity.
     *
     * @param username display name, already defaulted by the caller
     * @return Client instance, not yet registered
     */
    public Client createClient(String username) {
        // Bounded SPSC queue. Capacity is rounded up to a power of two, 8 at least.
        // A full queue makes tryEmitNext fail instead of blocking the hub.
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<String>get(config.getOutboundQueueSize()).get()
        );

        return new Client(UUID.randomUUID().toString(), username, outbound);
    }

}
