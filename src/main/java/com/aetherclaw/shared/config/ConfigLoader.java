package com.aetherclaw.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class ConfigLoader {

    private static final Path HOME_DIR = Path.of(System.getProperty("user.home"), ".aetherclaw");
    private static final Path DEFAULT_PATH = HOME_DIR.resolve("config.yaml");

    public static AetherClawConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static AetherClawConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var telegram = (Map<String, Object>) raw.getOrDefault("telegram", Map.of());
        var envFile = RuntimeEnv.getOrDefault("AETHERCLAW_ENV_FILE",
                String.valueOf(raw.getOrDefault("env-file", HOME_DIR.resolve(".env").toString())));

        return new AetherClawConfig(Path.of(envFile), parseTelegramConfig(telegram));
    }

    @SuppressWarnings("unchecked")
    private static TelegramConfig parseTelegramConfig(Map<String, Object> telegram) {
        var pairing = (Map<String, Object>) telegram.getOrDefault("pairing", Map.of());
        var defaults = TelegramConfig.defaults();
        var pairingDef = defaults.pairing();

        var baseUrl = RuntimeEnv.getOrDefault("AETHERCLAW_TELEGRAM_API",
                String.valueOf(telegram.getOrDefault("api-base-url", defaults.apiBaseUrl())));

        var codeLength = intValue(pairing, "code-length", pairingDef.codeLength());
        if (codeLength < 4 || codeLength > 12) {
            throw new IllegalArgumentException("telegram.pairing.code-length must be between 4 and 12: " + codeLength);
        }

        return new TelegramConfig(
            baseUrl.replaceAll("/+$", ""),
            intValue(telegram, "request-timeout", defaults.requestTimeoutSeconds()),
            new TelegramConfig.PairingConfig(
                Duration.ofSeconds(intValue(pairing, "handshake-timeout",
                        (int) pairingDef.handshakeTimeout().toSeconds())),
                Duration.ofSeconds(intValue(pairing, "challenge-timeout",
                        (int) pairingDef.challengeTimeout().toSeconds())),
                Duration.ofMillis(intValue(pairing, "idle-interval-ms",
                        (int) pairingDef.idleInterval().toMillis())),
                intValue(pairing, "poll-timeout", pairingDef.pollTimeoutSeconds()),
                codeLength
            )
        );
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(String.valueOf(section.getOrDefault(key, fallback)));
    }
}
