package com.aetherclaw.auth;

import java.time.Instant;

/** A code sent to one conversation. {@code delivered} is false when the send failed. */
public record Challenge(
    String conversationId,
    String code,
    Instant expiresAt,
    boolean delivered
) {
    @Override
    public String toString() {
        return "Challenge[conversationId=" + conversationId + ", expiresAt=" + expiresAt
                + ", delivered=" + delivered + "]";
    }
}
