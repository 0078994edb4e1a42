package com.qqsuccubus.chatrelay.socket.ws;

import com.qqsuccubus.chatrelay.socket.hub.Client;
import com.qqsuccubus.chatrelay.socket.hub.IHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle of one WebSocket connection.
 * <p>
 * {@code CONNECTING -> REGISTERED -> UNREGISTERING -> CLOSED}
 * </p>
 * <p>
 * Reader end, writer failure, transport disposal and hub eviction all call {@link #terminate(String)}.
 * Only the first call unregisters the client and disposes the transport; the rest are no-ops.
 * </p>
 */
public class ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    public enum State {
        CONNECTING,
        REGISTERED,
        UNREGISTERING,
        CLOSED
    }

    private final Client client;
    private final IHub hub;
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
    private volatile Connection transport;

    public ClientConnection(Client client, IHub hub) {
        this.client = client;
        this.hub = hub;
    }

    public void attach(Connection transport) {
        this.transport = transport;
    }

    /**
     * @return false if teardown already started before registration completed
     */
    public boolean markRegistered() {
        return state.compareAndSet(State.CONNECTING, State.REGISTERED);
    }

    public State getState() {
        return state.get();
    }

    /**
     * Unregisters the client and releases the transport, exactly once.
     *
     * @param reason what triggered the teardown, for logging
     * @return Mono completing when teardown is done, or immediately if another caller owns it
     */
    public Mono<Void> terminate(String reason) {
        return Mono.defer(() -> {
            State previous = state.getAndUpdate(current ->
                current == State.CONNECTING || current == State.REGISTERED ? State.UNREGISTERING : current
            );
            if (previous == State.UNREGISTERING || previous == State.CLOSED) {
                log.debug("Teardown of {} already in progress, ignoring trigger: {}", client, reason);
                return Mono.empty();
            }

            log.info("Closing connection for {}: {}", client, reason);
            return hub.unregister(client)
                .onErrorResume(err -> {
                    log.warn("Failed to unregister {}: {}", client, err.getMessage());
                    return Mono.just(false);
                })
                .doFinally(signal -> {
                    Connection current = transport;
                    if (current != null && !current.isDisposed()) {
                        current.dispose();
                    }
                    state.set(State.CLOSED);
                })
                .then();
        });
    }
}
