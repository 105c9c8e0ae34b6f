package com.aetherclaw.shared.config;

import java.nio.file.Path;

public record AetherClawConfig(
    Path envFile,
    TelegramConfig telegram
) {}
