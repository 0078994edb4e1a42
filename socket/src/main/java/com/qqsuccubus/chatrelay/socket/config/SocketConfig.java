package com.qqsuccubus.chatrelay.socket.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the relay node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    int httpPort;
    String wsPath;
    /**
     * Directory served at {@code /}; skipped when it does not exist.
     */
    String staticDir;
    int maxFrameBytes;
    /**
     * Seconds between server pings. Must stay below {@link #idleTimeout}.
     */
    int pingInterval;
    /**
     * Seconds without any inbound frame (pongs included) before the connection is closed.
     */
    int idleTimeout;
    int writeTimeout;
    int outboundQueueSize;
    int historyReplaySize;
    /**
     * Retention limit of the message store, {@code 0} = unbounded.
     */
    int historyMaxSize;
    String defaultUsername;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "9090")))
                .wsPath(getEnv("WS_PATH", "/ws"))
                .staticDir(getEnv("STATIC_DIR", "./static"))
                .maxFrameBytes(Integer.parseInt(getEnv("MAX_FRAME_BYTES", "512")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "54")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .writeTimeout(Integer.parseInt(getEnv("WRITE_TIMEOUT", "10")))
                .outboundQueueSize(Integer.parseInt(getEnv("OUTBOUND_QUEUE_SIZE", "256")))
                .historyReplaySize(Integer.parseInt(getEnv("HISTORY_REPLAY_SIZE", "50")))
                .historyMaxSize(Integer.parseInt(getEnv("HISTORY_MAX_SIZE", "0")))
                .defaultUsername(getEnv("DEFAULT_USERNAME", "Anonymous"))
                .build()
                .validated();
    }

    /**
     * Rejects combinations that would make idle but healthy connections time out.
     *
     * @return this config
     */
    public SocketConfig validated() {
        if (pingInterval <= 0 || pingInterval >= idleTimeout) {
            throw new IllegalArgumentException(String.format(
                "PING_INTERVAL (%d) must be positive and shorter than IDLE_TIMEOUT (%d)", pingInterval, idleTimeout));
        }
        if (outboundQueueSize <= 0) {
            throw new IllegalArgumentException("OUTBOUND_QUEUE_SIZE must be positive, got " + outboundQueueSize);
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("MAX_FRAME_BYTES must be positive, got " + maxFrameBytes);
        }
        return this;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
