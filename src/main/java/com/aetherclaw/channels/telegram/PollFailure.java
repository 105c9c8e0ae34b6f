package com.aetherclaw.channels.telegram;

public record PollFailure(Kind kind, String detail) {

    public enum Kind {
        /** Network error, timeout, 5xx or unparseable body; the next round may succeed. */
        TRANSIENT,
        /** The service no longer accepts the token; polling again cannot succeed. */
        AUTH_REJECTED
    }

    static PollFailure from(ApiResult<?> result) {
        return new PollFailure(result.isAuthRejected() ? Kind.AUTH_REJECTED : Kind.TRANSIENT, result.error());
    }
}
