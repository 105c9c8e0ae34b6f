package com.aetherclaw.shared.model;

import java.util.Objects;

public record ChannelBinding(
    String token,
    String conversationId
) {
    public ChannelBinding {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(conversationId, "conversationId");
    }

    @Override
    public String toString() {
        return "ChannelBinding[conversationId=" + conversationId + "]";
    }
}
