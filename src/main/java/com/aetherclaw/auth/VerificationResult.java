package com.aetherclaw.auth;

import com.aetherclaw.shared.model.BotCredential;

public record VerificationResult(BotCredential credential, String failure) {

    public static VerificationResult verified(BotCredential credential) {
        return new VerificationResult(credential, null);
    }

    public static VerificationResult failed(String reason) {
        return new VerificationResult(null, reason);
    }

    public boolean isVerified() {
        return credential != null;
    }
}
