package com.aetherclaw.auth;

import com.aetherclaw.shared.model.UpdateCursor;

public record HandshakeResult(
    Status status,
    String conversationId,
    String senderName,
    UpdateCursor cursor,
    String detail
) {
    public enum Status { STARTED, TIMED_OUT, REJECTED, INTERRUPTED }

    public boolean isStarted() {
        return status == Status.STARTED;
    }
}
