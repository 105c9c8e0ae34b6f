package com.aetherclaw.shared.config;

import java.time.Duration;

public record TelegramConfig(
    String apiBaseUrl,
    int requestTimeoutSeconds,
    PairingConfig pairing
) {
    public static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";

    /**
     * Timers of one pairing attempt. Each phase (waiting for /start, waiting for the code)
     * gets its own deadline; {@code pollTimeoutSeconds} is how long the server may hold a
     * single getUpdates call open.
     */
    public record PairingConfig(Duration handshakeTimeout, Duration challengeTimeout,
                                Duration idleInterval, int pollTimeoutSeconds, int codeLength) {
        public static PairingConfig defaults() {
            return new PairingConfig(Duration.ofSeconds(300), Duration.ofSeconds(300),
                    Duration.ofMillis(2000), 25, 6);
        }
    }

    public static TelegramConfig defaults() {
        return new TelegramConfig(DEFAULT_API_BASE_URL, 10, PairingConfig.defaults());
    }
}
