package com.aetherclaw.shared.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one pairing attempt. Immutable: every transition returns a new session and
 * rejects moves to a state that is not strictly later than the current one.
 */
public record PairingSession(
    PairingState state,
    String conversationId,
    String challengeCode,
    Instant deadline
) {
    public PairingSession {
        Objects.requireNonNull(state, "state");
    }

    public static PairingSession begin(Instant deadline) {
        return new PairingSession(PairingState.WAITING_FOR_START, null, null, deadline);
    }

    public PairingSession started(String conversationId) {
        Objects.requireNonNull(conversationId, "conversationId");
        return moveTo(PairingState.STARTED, conversationId, null, deadline);
    }

    public PairingSession codeIssued(String code, Instant expiresAt) {
        Objects.requireNonNull(code, "code");
        return moveTo(PairingState.CODE_ISSUED, conversationId, code, expiresAt);
    }

    public PairingSession paired() {
        return moveTo(PairingState.PAIRED, conversationId, challengeCode, deadline);
    }

    public PairingSession failed() {
        return moveTo(PairingState.FAILED, conversationId, challengeCode, deadline);
    }

    public Optional<String> boundConversation() {
        return Optional.ofNullable(conversationId);
    }

    private PairingSession moveTo(PairingState next, String conv, String code, Instant until) {
        if (state.isTerminal() || next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Illegal pairing transition " + state + " -> " + next);
        }
        return new PairingSession(next, conv, code, until);
    }

    @Override
    public String toString() {
        return "PairingSession[state=" + state + ", conversationId=" + conversationId
                + ", deadline=" + deadline + "]";
    }
}
