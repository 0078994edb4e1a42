package com.qqsuccubus.chatrelay.socket.hub;

import com.qqsuccubus.chatrelay.core.model.ChatMessage;
import reactor.core.publisher.Mono;

/**
 * Interface for the chat hub.
 * <p>
 * Every operation is queued and executed one at a time, in arrival order, by the hub loop.
 * The returned {@link Mono} is lazy: nothing is queued until it is subscribed, and it completes
 * once the hub has processed the operation.
 * </p>
 */
public interface IHub {
    /**
     * Admits a client, replays recent history to it and announces presence to everyone.
     *
     * @param client freshly created client
     * @return Mono completing when the client is a member
     */
    Mono<Void> register(Client client);

    /**
     * Removes a client and closes its outbound queue. Safe to call more than once.
     *
     * @param client client to remove
     * @return Mono of true if this call removed the client, false if it was already gone
     */
    Mono<Boolean> unregister(Client client);

    /**
     * Fans a serialized event out to every member, evicting members whose queue is full.
     *
     * @param payload serialized outbound event
     * @return Mono completing after the fan-out pass and any evictions
     */
    Mono<Void> broadcast(String payload);

    /**
     * Stores a new chat message authored by {@code author} and broadcasts it.
     *
     * @param author  sending client
     * @param content message text
     * @return Mono of the stored message, empty if the author is not a member
     */
    Mono<ChatMessage> postMessage(Client author, String content);

    /**
     * Replaces the content of a message authored by {@code requester}; broadcasts on success.
     *
     * @return Mono of true if the message existed and belonged to the requester
     */
    Mono<Boolean> editMessage(Client requester, String messageId, String content);

    /**
     * Deletes a message authored by {@code requester}; broadcasts on success.
     *
     * @return Mono of true if the message existed and belonged to the requester
     */
    Mono<Boolean> deleteMessage(Client requester, String messageId);

    /**
     * Updates the typing flag of a member and re-announces presence.
     */
    Mono<Void> updateTyping(Client client, boolean typing);

    /**
     * Number of registered clients, readable from any thread.
     */
    int getClientCount();
}
