package com.qqsuccubus.chatrelay.socket.ws;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WebSocketUpgradeHandlerTest {

    @Test
    void testMissingUsernameFallsBackToDefault() {
        assertEquals("Anonymous", WebSocketUpgradeHandler.resolveUsername(null, "Anonymous"));
        assertEquals("Anonymous", WebSocketUpgradeHandler.resolveUsername(List.of(), "Anonymous"));
    }

    @Test
    void testEmptyUsernameFallsBackToDefault() {
        assertEquals("Anonymous", WebSocketUpgradeHandler.resolveUsername(List.of(""), "Anonymous"));
        assertEquals("Anonymous", WebSocketUpgradeHandler.resolveUsername(Arrays.asList("", ""), "Anonymous"));
    }

    @Test
    void testFirstNonEmptyUsernameWins() {
        assertEquals("alice", WebSocketUpgradeHandler.resolveUsername(List.of("alice", "bob"), "Anonymous"));
        assertEquals("bob", WebSocketUpgradeHandler.resolveUsername(List.of("", "bob"), "Anonymous"));
    }
}
