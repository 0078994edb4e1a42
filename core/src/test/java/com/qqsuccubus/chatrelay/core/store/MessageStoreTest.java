package com.qqsuccubus.chatrelay.core.store;

import com.qqsuccubus.chatrelay.core.model.ChatMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MessageStoreTest {

    private MessageStore store;

    @BeforeEach
    void setUp() {
        store = new MessageStore();
    }

    // ========== Replay suffix ==========

    @Test
    @DisplayName("recent() returns everything, oldest first, when fewer than the limit are stored")
    void testRecentBelowLimit() {
        addMessages("alice", 3);

        List<ChatMessage> recent = store.recent(50);

        assertEquals(List.of("m0", "m1", "m2"), ids(recent));
    }

    @Test
    @DisplayName("recent() returns the newest suffix in insertion order when more than the limit are stored")
    void testRecentAboveLimit() {
        addMessages("alice", 60);

        List<ChatMessage> recent = store.recent(50);

        assertEquals(50, recent.size());
        assertEquals("m10", recent.get(0).getId());
        assertEquals("m59", recent.get(49).getId());
        assertEquals(60, store.size(), "recent() must not evict anything");
    }

    @Test
    void testRecentOnEmptyStore() {
        assertTrue(store.recent(50).isEmpty());
        assertTrue(store.recent(0).isEmpty());
    }

    // ========== Edit ==========

    @Test
    @DisplayName("Author edit changes content and sets edited, keeping id, author and position")
    void testEditByAuthor() {
        addMessages("alice", 3);

        assertTrue(store.edit("m1", "alice", "changed"));

        List<ChatMessage> all = store.snapshot();
        assertEquals(List.of("m0", "m1", "m2"), ids(all));
        ChatMessage edited = all.get(1);
        assertEquals("changed", edited.getContent());
        assertTrue(edited.isEdited());
        assertEquals("alice", edited.getUserId());
        assertFalse(all.get(0).isEdited());
    }

    @Test
    @DisplayName("Non-author edit is rejected and leaves the message untouched")
    void testEditByOtherUser() {
        addMessages("alice", 1);

        assertFalse(store.edit("m0", "bob", "hijacked"));

        ChatMessage message = store.snapshot().get(0);
        assertEquals("content-0", message.getContent());
        assertFalse(message.isEdited());
    }

    @Test
    void testEditUnknownId() {
        addMessages("alice", 1);

        assertFalse(store.edit("nope", "alice", "x"));
    }

    @Test
    @DisplayName("edited flag stays set after further edits")
    void testEditedIsNeverReset() {
        addMessages("alice", 1);

        store.edit("m0", "alice", "one");
        store.edit("m0", "alice", "two");

        ChatMessage message = store.snapshot().get(0);
        assertEquals("two", message.getContent());
        assertTrue(message.isEdited());
    }

    // ========== Delete ==========

    @Test
    @DisplayName("Author delete removes the entry and keeps survivors in order")
    void testDeleteByAuthor() {
        addMessages("alice", 4);

        assertTrue(store.delete("m1", "alice"));

        assertEquals(List.of("m0", "m2", "m3"), ids(store.snapshot()));
    }

    @Test
    void testDeleteByOtherUser() {
        addMessages("alice", 2);

        assertFalse(store.delete("m0", "bob"));

        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("Deleting twice reports not found the second time")
    void testDeleteTwice() {
        addMessages("alice", 1);

        assertTrue(store.delete("m0", "alice"));
        assertFalse(store.delete("m0", "alice"));
    }

    // ========== Retention ==========

    @Test
    @DisplayName("Retention limit drops the oldest entries")
    void testRetentionLimit() {
        store = new MessageStore(3);
        addMessages("alice", 5);

        assertEquals(List.of("m2", "m3", "m4"), ids(store.snapshot()));
    }

    @Test
    void testNegativeRetentionRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MessageStore(-1));
    }

    private void addMessages(String author, int count) {
        for (int i = 0; i < count; i++) {
            store.add(ChatMessage.builder()
                .id("m" + i)
                .userId(author)
                .username(author)
                .content("content-" + i)
                .timestamp(Instant.now())
                .build());
        }
    }

    private static List<String> ids(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::getId).collect(Collectors.toList());
    }
}
