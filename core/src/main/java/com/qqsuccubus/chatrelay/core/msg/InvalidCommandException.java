package com.qqsuccubus.chatrelay.core.msg;

/**
 * Raised when an inbound frame cannot be turned into a {@link ClientCommand}.
 * The frame is dropped; the connection stays open.
 */
public class InvalidCommandException extends RuntimeException {

    public InvalidCommandException(String message) {
        super(message);
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
