package com.aetherclaw.auth;

import com.aetherclaw.shared.model.BotCredential;
import com.aetherclaw.shared.model.ChannelBinding;

/**
 * Terminal result of a pairing attempt. {@code binding} is set for {@code PAIRED} and
 * {@code PERSIST_FAILED}; {@code detail} explains every other status.
 */
public record PairingOutcome(
    Status status,
    BotCredential credential,
    ChannelBinding binding,
    String detail
) {
    public enum Status {
        PAIRED,
        TOKEN_REJECTED,
        HANDSHAKE_TIMEOUT,
        CHALLENGE_TIMEOUT,
        CHANNEL_REJECTED,
        INTERRUPTED,
        PERSIST_FAILED
    }

    public boolean isPaired() {
        return status == Status.PAIRED;
    }
}
