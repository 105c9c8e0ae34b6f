package com.aetherclaw.auth;

import com.aetherclaw.shared.model.BotCredential;
import com.aetherclaw.shared.model.ChannelBinding;

/** Progress callbacks of a {@link PairingFlow}; all optional. */
public interface PairingListener {

    PairingListener NONE = new PairingListener() {};

    default void onVerified(BotCredential credential) {}

    default void onStarted(String conversationId, String senderName) {}

    default void onCodeIssued(Challenge challenge) {}

    default void onPaired(ChannelBinding binding) {}
}
