package com.aetherclaw.auth;

final class Secrets {

    private static final int VISIBLE = 6;

    private Secrets() {}

    /** Keeps a short prefix so operators can tell tokens apart in logs. */
    static String mask(String secret) {
        if (secret == null || secret.isEmpty()) return "<empty>";
        if (secret.length() <= VISIBLE) return "***";
        return secret.substring(0, VISIBLE) + "***";
    }
}
