package com.aetherclaw.auth;

import com.aetherclaw.channels.telegram.BotApiFactory;
import com.aetherclaw.channels.telegram.EventPoller;
import com.aetherclaw.channels.telegram.PollingLoop;
import com.aetherclaw.channels.telegram.Sleeper;
import com.aetherclaw.shared.config.TelegramConfig.PairingConfig;
import com.aetherclaw.shared.model.BotCredential;
import com.aetherclaw.shared.model.ChannelBinding;
import com.aetherclaw.shared.model.PairingSession;
import com.aetherclaw.shared.model.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Binds a bot token to one Telegram chat: verify the token, wait for /start, send a
 * one-time code to that chat, wait for the code to come back, then persist the binding.
 * Each step blocks until it finishes; a failed step ends the attempt. Callers must not
 * run two attempts for the same bot at once, they would share its update stream.
 */
public class PairingFlow {

    private static final Logger log = LoggerFactory.getLogger(PairingFlow.class);

    private final BotApiFactory apiFactory;
    private final CredentialStore store;
    private final PairingConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PairingCodeGenerator codes;

    public PairingFlow(BotApiFactory apiFactory, CredentialStore store, PairingConfig config) {
        this(apiFactory, store, config, Clock.systemUTC(), Sleeper.SYSTEM,
                new PairingCodeGenerator(config.codeLength()));
    }

    public PairingFlow(BotApiFactory apiFactory, CredentialStore store, PairingConfig config,
                       Clock clock, Sleeper sleeper, PairingCodeGenerator codes) {
        this.apiFactory = apiFactory;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.codes = codes;
    }

    public PairingOutcome run(String token, PairingListener listener) {
        var verification = new CredentialVerifier(apiFactory).verify(token);
        if (!verification.isVerified()) {
            return new PairingOutcome(PairingOutcome.Status.TOKEN_REJECTED, null, null, verification.failure());
        }
        listener.onVerified(verification.credential());
        return pair(verification.credential(), listener);
    }

    /** Runs the handshake for a token that has already been verified. */
    public PairingOutcome pair(BotCredential credential, PairingListener listener) {
        var api = apiFactory.open(credential.token());
        var loop = new PollingLoop(new EventPoller(api), clock, sleeper,
                config.idleInterval(), config.pollTimeoutSeconds());
        var session = PairingSession.begin(clock.instant().plus(config.handshakeTimeout()));

        var handshake = new HandshakeListener(loop, clock, config.handshakeTimeout())
                .await(UpdateCursor.initial(), session.deadline());
        if (!handshake.isStarted()) {
            switch (handshake.status()) {
                case REJECTED:
                    return fail(session, credential, PairingOutcome.Status.CHANNEL_REJECTED, handshake.detail());
                case INTERRUPTED:
                    return fail(session, credential, PairingOutcome.Status.INTERRUPTED, handshake.detail());
                default:
                    return fail(session, credential, PairingOutcome.Status.HANDSHAKE_TIMEOUT,
                            "Did not receive " + HandshakeListener.START_COMMAND + " within "
                                    + config.handshakeTimeout().toSeconds() + "s");
            }
        }
        session = session.started(handshake.conversationId());
        listener.onStarted(handshake.conversationId(), handshake.senderName());

        var coordinator = new ChallengeCoordinator(api, loop, codes, clock, config.challengeTimeout());
        var challenge = coordinator.issue(handshake.conversationId());
        session = session.codeIssued(challenge.code(), challenge.expiresAt());
        listener.onCodeIssued(challenge);

        // continue from where the handshake stopped reading
        var echo = coordinator.awaitEcho(challenge, handshake.cursor());
        if (!echo.isVerified()) {
            switch (echo.status()) {
                case REJECTED:
                    return fail(session, credential, PairingOutcome.Status.CHANNEL_REJECTED, echo.detail());
                case INTERRUPTED:
                    return fail(session, credential, PairingOutcome.Status.INTERRUPTED, echo.detail());
                default:
                    return fail(session, credential, PairingOutcome.Status.CHALLENGE_TIMEOUT,
                            "Pairing code not received or expired");
            }
        }
        session = session.paired();
        coordinator.confirm(handshake.conversationId());

        var binding = new ChannelBinding(credential.token(), session.boundConversation().orElseThrow());
        try {
            store.save(binding);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save Telegram binding to {}", store.envFile(), e);
            return new PairingOutcome(PairingOutcome.Status.PERSIST_FAILED, credential, binding,
                    manualInstructions(binding, e));
        }
        listener.onPaired(binding);
        return new PairingOutcome(PairingOutcome.Status.PAIRED, credential, binding, null);
    }

    private static PairingOutcome fail(PairingSession session, BotCredential credential,
                                       PairingOutcome.Status status, String detail) {
        log.info("Pairing attempt ended in {} ({})", status, session.failed());
        return new PairingOutcome(status, credential, null, detail);
    }

    /** The one place the raw token is shown: the operator needs it to finish by hand. */
    static String manualInstructions(ChannelBinding binding, Exception cause) {
        return "Error saving credentials: " + cause.getMessage() + "\n"
                + "Set these manually:\n"
                + "  export " + CredentialStore.TOKEN_KEY + "='" + binding.token() + "'\n"
                + "  export " + CredentialStore.CHAT_ID_KEY + "='" + binding.conversationId() + "'";
    }
}
