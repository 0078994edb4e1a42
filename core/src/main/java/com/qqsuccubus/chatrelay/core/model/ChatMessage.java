package com.qqsuccubus.chatrelay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored chat line.
 * <p>
 * Serialized as-is on the wire: {@code {id, type:"message", username, userId, content, timestamp, edited}}.
 * </p>
 * <p>
 * <b>Mutability:</b> only {@code content} and {@code edited} change after creation, and only through
 * {@link #edit(String)}. Instances are owned by the hub loop; do not share them across threads.
 * </p>
 */
@Getter
@JsonPropertyOrder({"id", "type", "username", "userId", "content", "timestamp", "edited"})
public class ChatMessage {
    public static final String TYPE = "message";

    /**
     * Unique message id, stable across edits.
     */
    private final String id;

    /**
     * Author's client id. The only identity allowed to edit or delete this message.
     */
    private final String userId;

    /**
     * Author's display name at the time of writing.
     */
    private final String username;

    private String content;

    /**
     * Creation time, never updated by edits.
     */
    private final Instant timestamp;

    /**
     * False at creation, true after the first successful edit.
     */
    private boolean edited;

    @Builder
    public ChatMessage(String id, String userId, String username, String content, Instant timestamp) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.username = username;
        this.content = content;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.edited = false;
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    public boolean isAuthoredBy(String requesterId) {
        return userId.equals(requesterId);
    }

    public void edit(String newContent) {
        this.content = newContent;
        this.edited = true;
    }
}
