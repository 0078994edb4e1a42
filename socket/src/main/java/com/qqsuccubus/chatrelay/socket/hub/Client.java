package com.qqsuccubus.chatrelay.socket.hub;

import com.qqsuccubus.chatrelay.core.model.UserPresence;
import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

/**
 * Server-side representative of one WebSocket connection.
 * <p>
 * The outbound queue has exactly one producer (the hub loop) and one consumer (the writer pump).
 * Completing it is the signal for the writer to send a close frame and stop.
 * </p>
 * <p>
 * {@code typing}, {@code lastSeen} and {@code retired} are read and written on the hub loop only.
 * </p>
 */
@Getter
public class Client {
    private final String id;
    private final String username;
    private final Instant connectedAt;

    @Getter(AccessLevel.NONE)
    private final Sinks.Many<String> outbound;

    private boolean typing;
    private Instant lastSeen;
    /**
     * Set once the hub has removed (or refused) this client. A retired client is never re-registered.
     */
    private boolean retired;

    public Client(String id, String username, Sinks.Many<String> outbound) {
        this.id = id;
        this.username = username;
        this.outbound = outbound;
        this.connectedAt = Instant.now();
        this.lastSeen = connectedAt;
    }

    /**
     * Single-subscriber view of the outbound queue, consumed by the writer pump.
     */
    public Flux<String> outboundFlux() {
        return outbound.asFlux();
    }

    /**
     * Non-blocking enqueue.
     *
     * @return false if the queue is full, closed, or its consumer went away
     */
    boolean offer(String payload) {
        return outbound.tryEmitNext(payload).isSuccess();
    }

    /**
     * Marks the client as gone and completes its outbound queue. Repeated calls are no-ops.
     */
    void retire() {
        retired = true;
        outbound.tryEmitComplete();
    }

    void setTyping(boolean typing) {
        this.typing = typing;
    }

    void touch(Instant now) {
        this.lastSeen = now;
    }

    UserPresence toPresence() {
        return UserPresence.builder()
                .id(id)
                .username(username)
                .typing(typing)
                .lastSeen(lastSeen)
                .build();
    }

    @Override
    public String toString() {
        return username + " (" + id + ")";
    }
}
