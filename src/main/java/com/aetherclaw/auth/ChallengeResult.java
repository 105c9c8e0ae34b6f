package com.aetherclaw.auth;

import com.aetherclaw.shared.model.UpdateCursor;

public record ChallengeResult(Status status, UpdateCursor cursor, String detail) {

    public enum Status { VERIFIED, TIMED_OUT, REJECTED, INTERRUPTED }

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }
}
