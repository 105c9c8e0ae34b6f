package com.aetherclaw.auth;

import com.aetherclaw.channels.telegram.BotApi;
import com.aetherclaw.channels.telegram.PollingLoop;
import com.aetherclaw.shared.model.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Proves control of a conversation: sends it a one-time code and waits for the same
 * conversation to send the code back verbatim.
 */
public class ChallengeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ChallengeCoordinator.class);
    static final String COMMAND_MARKER = "/";
    static final String CONFIRMATION_MESSAGE = "Pairing successful!\n\n"
            + "I'm now connected to your Aether-Claw instance. "
            + "You can chat with me here, and I'll respond as your AI assistant.";

    private final BotApi api;
    private final PollingLoop loop;
    private final PairingCodeGenerator codes;
    private final Clock clock;
    private final Duration validity;

    public ChallengeCoordinator(BotApi api, PollingLoop loop, PairingCodeGenerator codes,
                                Clock clock, Duration validity) {
        this.api = api;
        this.loop = loop;
        this.codes = codes;
        this.clock = clock;
        this.validity = validity;
    }

    public Challenge issue(String conversationId) {
        var code = codes.next();
        var expiresAt = clock.instant().plus(validity);
        var sent = api.sendMessage(conversationId, pairingMessage(code, validity));
        if (!sent.isOk()) {
            log.warn("Could not send pairing code to chat {}: {}", conversationId, sent.error());
        }
        return new Challenge(conversationId, code, expiresAt, sent.isOk());
    }

    public ChallengeResult awaitEcho(Challenge challenge, UpdateCursor cursor) {
        var bound = challenge.conversationId();
        var code = challenge.code();

        var result = loop.run(cursor, challenge.expiresAt(), event -> {
            if (!bound.equals(event.conversationId())) return false;
            if (event.text().startsWith(COMMAND_MARKER)) return false;
            if (code.equals(event.text())) return true;
            log.debug("Non-matching reply in chat {}", bound);
            return false;
        });

        switch (result.status()) {
            case MATCHED:
                log.info("Pairing code confirmed by chat {}", bound);
                return new ChallengeResult(ChallengeResult.Status.VERIFIED, result.cursor(), null);
            case REJECTED:
                return new ChallengeResult(ChallengeResult.Status.REJECTED, result.cursor(), result.detail());
            case INTERRUPTED:
                return new ChallengeResult(ChallengeResult.Status.INTERRUPTED, result.cursor(), result.detail());
            default:
                log.info("Pairing code not received from chat {} before it expired", bound);
                return new ChallengeResult(ChallengeResult.Status.TIMED_OUT, result.cursor(), null);
        }
    }

    /** Best effort; pairing has already succeeded when this is sent. */
    public boolean confirm(String conversationId) {
        var sent = api.sendMessage(conversationId, CONFIRMATION_MESSAGE);
        if (!sent.isOk()) {
            log.warn("Could not send pairing confirmation to chat {}: {}", conversationId, sent.error());
        }
        return sent.isOk();
    }

    static String pairingMessage(String code, Duration validity) {
        long minutes = Math.max(1, validity.toMinutes());
        return "Hello! I'm Aether-Claw.\n\n"
                + "To complete pairing, send me this code:\n\n"
                + "`" + code + "`\n\n"
                + "This code will expire in " + minutes + (minutes == 1 ? " minute." : " minutes.");
    }
}
