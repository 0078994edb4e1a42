package com.qqsuccubus.chatrelay.core.store;

import com.qqsuccubus.chatrelay.core.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Insertion-ordered log of chat messages with author-only edit and delete.
 * <p>
 * <b>Threading:</b> not synchronized. The hub loop is the only caller.
 * </p>
 * <p>
 * <b>Authorship:</b> {@link #edit} and {@link #delete} return {@code false} both when the id is
 * unknown and when the requester is not the author; callers cannot tell the two apart.
 * </p>
 */
public class MessageStore {
    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    private final List<ChatMessage> messages = new ArrayList<>();
    private final int maxSize;

    /**
     * @param maxSize retention limit; {@code 0} keeps everything
     */
    public MessageStore(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public MessageStore() {
        this(0);
    }

    public void add(ChatMessage message) {
        messages.add(message);
        if (maxSize > 0 && messages.size() > maxSize) {
            int overflow = messages.size() - maxSize;
            messages.subList(0, overflow).clear();
            log.debug("Retention dropped {} oldest messages", overflow);
        }
        log.debug("Message {} stored. Total messages: {}", message.getId(), messages.size());
    }

    /**
     * Returns the newest {@code limit} messages, oldest first.
     *
     * @param limit maximum number of messages
     * @return copy of the suffix
     */
    public List<ChatMessage> recent(int limit) {
        int from = Math.max(0, messages.size() - Math.max(0, limit));
        return List.copyOf(messages.subList(from, messages.size()));
    }

    public boolean edit(String messageId, String requesterId, String newContent) {
        for (ChatMessage message : messages) {
            if (message.getId().equals(messageId) && message.isAuthoredBy(requesterId)) {
                message.edit(newContent);
                log.debug("Message {} edited by {}", messageId, requesterId);
                return true;
            }
        }
        log.debug("Message {} not found for editing by {}", messageId, requesterId);
        return false;
    }

    public boolean delete(String messageId, String requesterId) {
        Iterator<ChatMessage> it = messages.iterator();
        while (it.hasNext()) {
            ChatMessage message = it.next();
            if (message.getId().equals(messageId) && message.isAuthoredBy(requesterId)) {
                it.remove();
                log.debug("Message {} deleted by {}", messageId, requesterId);
                return true;
            }
        }
        log.debug("Message {} not found for deletion by {}", messageId, requesterId);
        return false;
    }

    public int size() {
        return messages.size();
    }

    public List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }
}
