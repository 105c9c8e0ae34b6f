package com.aetherclaw.shared.model;

/** Declared in transition order; a session only ever moves to a later constant. */
public enum PairingState {
    WAITING_FOR_START,
    STARTED,
    CODE_ISSUED,
    PAIRED,
    FAILED;

    public boolean isTerminal() {
        return this == PAIRED || this == FAILED;
    }
}
