package com.qqsuccubus.chatrelay.socket.hub;

import com.qqsuccubus.chatrelay.core.model.ChatMessage;
import com.qqsuccubus.chatrelay.core.model.UserPresence;
import com.qqsuccubus.chatrelay.core.msg.ServerEvents;
import com.qqsuccubus.chatrelay.core.store.MessageStore;
import com.qqsuccubus.chatrelay.core.util.JsonUtils;
import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Single coordination point of the relay.
 * <p>
 * Owns the membership map and the {@link MessageStore}. All operations are turned into commands on
 * one unbounded multi-producer inbox and executed by a single worker on the {@code hub-loop}
 * scheduler, so none of the state below needs locking.
 * </p>
 * <p>
 * <b>Backpressure:</b> fan-out never blocks. A member whose outbound queue rejects an event is
 * collected during the pass and evicted after it (queue completed, membership removed), followed by a
 * presence announcement to the survivors.
 * </p>
 */
public class Hub implements IHub {
    private static final Logger log = LoggerFactory.getLogger(Hub.class);

    private static final Sinks.EmitFailureHandler EMIT_RETRY =
        Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1));

    private final SocketConfig config;
    private final MessageStore store;
    private final MetricsService metricsService;

    private final Sinks.Many<HubCommand<?>> inbox = Sinks.many().unicast().onBackpressureBuffer(
        Queues.<HubCommand<?>>unboundedMultiproducer().get()
    );
    private final Scheduler loop = Schedulers.newSingle("hub-loop");
    private final AtomicInteger clientCount = new AtomicInteger();
    private volatile boolean stopped;
    private Disposable subscription;

    // Hub loop only
    private final Map<String, Client> clients = new LinkedHashMap<>();

    public Hub(SocketConfig config, MessageStore store, MetricsService metricsService) {
        this.config = config;
        this.store = store;
        this.metricsService = metricsService;
    }

    /**
     * Starts consuming the inbox. Commands submitted before this call are buffered.
     */
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = inbox.asFlux()
            .publishOn(loop)
            .subscribe(
                this::execute,
                err -> log.error("Hub loop terminated unexpectedly", err),
                () -> {
                    loop.dispose();
                    log.info("Hub loop stopped");
                }
            );
        log.info("Hub started and running");
    }

    /**
     * Evicts every member, then stops the loop. Commands still queued behind the shutdown and later
     * submissions fail with {@link IllegalStateException}. Calling it again is a no-op.
     *
     * @return Mono completing once all queues are closed
     */
    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (stopped) {
                return Mono.empty();
            }
            return submit("shutdown", () -> {
                stopped = true;
                int count = clients.size();
                clients.values().forEach(Client::retire);
                clients.clear();
                updateClientCount();
                // The loop drains what is already queued, then disposes itself on completion
                inbox.emitComplete(EMIT_RETRY);
                return count;
            })
                .doOnNext(count -> log.info("Hub shut down, closed {} client queues", count))
                .then();
        });
    }

    @Override
    public Mono<Void> register(Client client) {
        return submit("register", () -> {
            if (client.isRetired()) {
                log.warn("Refusing to register client {}: already retired", client);
                return null;
            }
            if (clients.containsKey(client.getId())) {
                log.warn("Refusing to register client {}: already registered", client);
                return null;
            }
            clients.put(client.getId(), client);
            updateClientCount();
            log.info("Client {} connected. Total clients: {}", client, clients.size());

            replayHistory(client);
            // Replay and presence land in the new client's queue in this order; the queue buffers
            // them until its writer subscribes.
            announcePresence();
            return null;
        }).then();
    }

    @Override
    public Mono<Boolean> unregister(Client client) {
        return submit("unregister", () -> {
            Client removed = clients.remove(client.getId());
            client.retire();
            if (removed == null) {
                log.debug("Client {} already unregistered", client);
                return false;
            }
            updateClientCount();
            log.info("Client {} disconnected. Total clients: {}", client, clients.size());
            announcePresence();
            return true;
        });
    }

    @Override
    public Mono<Void> broadcast(String payload) {
        return submit("broadcast", () -> {
            deliverToAll(payload, "raw");
            return null;
        }).then();
    }

    @Override
    public Mono<ChatMessage> postMessage(Client author, String content) {
        return submit("postMessage", () -> {
            if (!isMember(author)) {
                return null;
            }
            Instant now = Instant.now();
            author.touch(now);

            ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .userId(author.getId())
                .username(author.getUsername())
                .content(content)
                .timestamp(now)
                .build();

            store.add(message);
            metricsService.recordMessage();
            log.debug("New message {} from {}", message.getId(), author);

            deliverToAll(JsonUtils.writeValueAsString(message), ChatMessage.TYPE);
            return message;
        });
    }

    @Override
    public Mono<Boolean> editMessage(Client requester, String messageId, String content) {
        return submit("editMessage", () -> {
            if (!isMember(requester)) {
                return false;
            }
            Instant now = Instant.now();
            requester.touch(now);

            if (!store.edit(messageId, requester.getId(), content)) {
                return false;
            }
            deliverToAll(
                JsonUtils.writeValueAsString(new ServerEvents.MessageEdited(messageId, content, now)),
                ServerEvents.MESSAGE_EDITED
            );
            return true;
        });
    }

    @Override
    public Mono<Boolean> deleteMessage(Client requester, String messageId) {
        return submit("deleteMessage", () -> {
            if (!isMember(requester)) {
                return false;
            }
            Instant now = Instant.now();
            requester.touch(now);

            if (!store.delete(messageId, requester.getId())) {
                return false;
            }
            deliverToAll(
                JsonUtils.writeValueAsString(new ServerEvents.MessageDeleted(messageId, now)),
                ServerEvents.MESSAGE_DELETED
            );
            return true;
        });
    }

    @Override
    public Mono<Void> updateTyping(Client client, boolean typing) {
        return submit("updateTyping", () -> {
            if (!isMember(client)) {
                return null;
            }
            client.touch(Instant.now());
            client.setTyping(typing);
            log.debug("{} typing status: {}", client, typing);
            announcePresence();
            return null;
        }).then();
    }

    @Override
    public int getClientCount() {
        return clientCount.get();
    }

    private <T> Mono<T> submit(String name, Supplier<T> action) {
        return Mono.defer(() -> {
            if (stopped) {
                return Mono.error(new IllegalStateException("Hub is stopped, cannot " + name));
            }
            Sinks.One<T> reply = Sinks.one();
            HubCommand<T> command = new HubCommand<>(name, action, reply);

            Sinks.EmitResult result = inbox.tryEmitNext(command);
            while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
                // Another producer is emitting right now
                Thread.onSpinWait();
                result = inbox.tryEmitNext(command);
            }
            if (result.isFailure()) {
                return Mono.error(new IllegalStateException("Hub is stopped, cannot " + name));
            }
            return reply.asMono();
        });
    }

    private <T> void execute(HubCommand<T> command) {
        if (stopped) {
            log.debug("Hub command {} rejected: hub is stopped", command.name());
            command.reply().tryEmitError(new IllegalStateException("Hub is stopped, cannot " + command.name()));
            return;
        }
        try {
            command.reply().tryEmitValue(command.action().get());
        } catch (RuntimeException e) {
            log.error("Hub command {} failed", command.name(), e);
            command.reply().tryEmitError(e);
        }
    }

    private boolean isMember(Client client) {
        if (clients.get(client.getId()) != client) {
            log.debug("Ignoring command from {}: not registered", client);
            return false;
        }
        return true;
    }

    private void replayHistory(Client client) {
        List<ChatMessage> recent = store.recent(config.getHistoryReplaySize());
        log.debug("Sending {} recent messages to {}", recent.size(), client);

        for (ChatMessage message : recent) {
            if (!client.offer(JsonUtils.writeValueAsString(message))) {
                // Not evicted here: the presence announcement that follows decides.
                log.warn("Failed to send recent message to {}, replay truncated", client);
                return;
            }
        }
    }

    private void announcePresence() {
        List<UserPresence> users = new ArrayList<>(clients.size());
        for (Client client : clients.values()) {
            users.add(client.toPresence());
        }
        log.debug("Broadcasting user list: {} users", users.size());

        ServerEvents.UserList userList = new ServerEvents.UserList(users, Instant.now());
        deliverToAll(JsonUtils.writeValueAsString(userList), ServerEvents.USER_LIST);
    }

    /**
     * One fan-out pass. Runs to completion before any other command.
     */
    private void deliverToAll(String payload, String eventType) {
        long startNanos = System.nanoTime();
        int total = clients.size();
        List<Client> failed = new ArrayList<>();

        for (Client client : clients.values()) {
            if (!client.offer(payload)) {
                log.warn("Failed to send {} to client {}, marking for removal", eventType, client);
                failed.add(client);
            }
        }

        metricsService.recordBroadcast(eventType, startNanos);
        log.debug("{} sent to {}/{} clients", eventType, total - failed.size(), total);

        if (!failed.isEmpty()) {
            evict(failed);
        }
    }

    private void evict(List<Client> failed) {
        for (Client client : failed) {
            clients.remove(client.getId());
            client.retire();
            metricsService.recordEviction();
        }
        updateClientCount();
        log.info("Evicted {} slow clients. Total clients: {}", failed.size(), clients.size());

        // Terminates: every recursive pass runs over a strictly smaller membership.
        announcePresence();
    }

    private void updateClientCount() {
        clientCount.set(clients.size());
        metricsService.setActiveClients(clients.size());
    }

    private record HubCommand<T>(String name, Supplier<T> action, Sinks.One<T> reply) {
    }
}
