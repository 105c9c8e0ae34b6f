package com.aetherclaw.auth;

import com.aetherclaw.channels.telegram.PollingLoop;
import com.aetherclaw.shared.model.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Waits for {@code /start} from any conversation and reports which one sent it. */
public class HandshakeListener {

    private static final Logger log = LoggerFactory.getLogger(HandshakeListener.class);
    public static final String START_COMMAND = "/start";

    private final PollingLoop loop;
    private final Clock clock;
    private final Duration timeout;

    public HandshakeListener(PollingLoop loop, Clock clock, Duration timeout) {
        this.loop = loop;
        this.clock = clock;
        this.timeout = timeout;
    }

    public HandshakeResult await(UpdateCursor cursor) {
        return await(cursor, clock.instant().plus(timeout));
    }

    /** Waits until {@code deadline}, which the caller already fixed for this attempt. */
    public HandshakeResult await(UpdateCursor cursor, Instant deadline) {
        var window = Duration.between(clock.instant(), deadline);
        log.info("Waiting for {} (timeout {}s)", START_COMMAND, window.toSeconds());

        var result = loop.run(cursor, deadline, event -> START_COMMAND.equals(event.text()));
        switch (result.status()) {
            case MATCHED:
                var event = result.event();
                log.info("Received {} from {} in chat {}", START_COMMAND, event.senderName(), event.conversationId());
                return new HandshakeResult(HandshakeResult.Status.STARTED, event.conversationId(),
                        event.senderName(), result.cursor(), null);
            case REJECTED:
                return new HandshakeResult(HandshakeResult.Status.REJECTED, null, null,
                        result.cursor(), result.detail());
            case INTERRUPTED:
                return new HandshakeResult(HandshakeResult.Status.INTERRUPTED, null, null,
                        result.cursor(), result.detail());
            default:
                log.info("No {} received within {}s", START_COMMAND, window.toSeconds());
                return new HandshakeResult(HandshakeResult.Status.TIMED_OUT, null, null,
                        result.cursor(), null);
        }
    }
}
