package io.relaychat.server.config;

import io.relaychat.core.codec.FrameCodec;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the relay server, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ServerConfig {

    String serverId;
    String bindHost;
    int port;
    /**
     * Port of the admin HTTP endpoint (health, metrics); disabled when not positive.
     */
    int adminPort;
    int maxFrameBytes;
    /**
     * Outbound frames a session may queue before relays to it are dropped.
     */
    int perConnBufferSize;
    Duration shutdownGrace;

    public static ServerConfig fromEnv() {
        return ServerConfig.builder()
                .serverId(getEnv("SERVER_ID", "relay-1"))
                .bindHost(getEnv("BIND_HOST", "0.0.0.0"))
                .port(Integer.parseInt(getEnv("PORT", "8080")))
                .adminPort(Integer.parseInt(getEnv("ADMIN_PORT", "9090")))
                .maxFrameBytes(parsePositive("MAX_FRAME_BYTES", getEnv("MAX_FRAME_BYTES", String.valueOf(FrameCodec.DEFAULT_MAX_FRAME_LENGTH))))
                .perConnBufferSize(parsePositive("PER_CONN_BUFFER_SIZE", getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .shutdownGrace(Duration.ofSeconds(Long.parseLong(getEnv("SHUTDOWN_GRACE_SEC", "10"))))
                .build();
    }

    /**
     * Returns a copy listening on {@code address}, given as {@code host:port}.
     *
     * @throws IllegalArgumentException if the address has no port or the port is not a number
     */
    public ServerConfig withListenAddress(String address) {
        int colon = address.lastIndexOf(':');
        if (colon < 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected host:port but got '" + address + "'");
        }
        String host = colon == 0 ? bindHost : address.substring(0, colon);
        int parsedPort;
        try {
            parsedPort = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
        }
        if (parsedPort < 0 || parsedPort > 65535) {
            throw new IllegalArgumentException("Port out of range in '" + address + "'");
        }
        return toBuilder().bindHost(host).port(parsedPort).build();
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not an integer of at least 1
     */
    static int parsePositive(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but was '" + value + "'", e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException(key + " must be at least 1 but was " + parsed);
        }
        return parsed;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
