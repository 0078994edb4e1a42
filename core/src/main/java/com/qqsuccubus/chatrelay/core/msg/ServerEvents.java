package com.qqsuccubus.chatrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qqsuccubus.chatrelay.core.model.UserPresence;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Events the server pushes to clients, besides the chat line itself
 * ({@link com.qqsuccubus.chatrelay.core.model.ChatMessage}).
 */
public final class ServerEvents {
    private ServerEvents() {
    }

    public static final String USER_LIST = "userList";
    public static final String MESSAGE_EDITED = "messageEdited";
    public static final String MESSAGE_DELETED = "messageDeleted";

    /**
     * Full presence snapshot of every registered client.
     */
    @Value
    @JsonPropertyOrder({"type", "users", "count", "timestamp"})
    public static class UserList {
        List<UserPresence> users;
        Instant timestamp;

        @JsonProperty("type")
        public String getType() {
            return USER_LIST;
        }

        @JsonProperty("count")
        public int getCount() {
            return users.size();
        }
    }

    /**
     * Sent after the author changed the content of a stored message.
     */
    @Value
    @JsonPropertyOrder({"type", "messageId", "content", "timestamp"})
    public static class MessageEdited {
        String messageId;
        String content;
        Instant timestamp;

        @JsonProperty("type")
        public String getType() {
            return MESSAGE_EDITED;
        }
    }

    /**
     * Sent after the author removed a stored message.
     */
    @Value
    @JsonPropertyOrder({"type", "messageId", "timestamp"})
    public static class MessageDeleted {
        String messageId;
        Instant timestamp;

        @JsonProperty("type")
        public String getType() {
            return MESSAGE_DELETED;
        }
    }
}
