package com.qqsuccubus.chatrelay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of a presence snapshot.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"id", "username", "isTyping", "lastSeen"})
public class UserPresence {
    String id;

    String username;

    @JsonProperty("isTyping")
    boolean typing;

    Instant lastSeen;
}
