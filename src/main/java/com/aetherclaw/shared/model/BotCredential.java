package com.aetherclaw.shared.model;

import java.util.Objects;

/** A bot token the Telegram API has accepted, with the identity it resolved to. */
public record BotCredential(
    String token,
    String handle,
    String displayName
) {
    public BotCredential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(displayName, "displayName");
    }

    @Override
    public String toString() {
        return "BotCredential[handle=" + handle + ", displayName=" + displayName + "]";
    }
}
