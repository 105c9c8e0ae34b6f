package com.aetherclaw.channels.telegram;

import com.aetherclaw.shared.model.InboundEvent;
import com.aetherclaw.shared.model.UpdateCursor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Polls until an event satisfies a predicate or a deadline passes, pausing between rounds.
 * Transient poll failures only cost a round; an auth rejection ends the loop.
 */
public class PollingLoop {

    public enum Status { MATCHED, TIMED_OUT, REJECTED, INTERRUPTED }

    public record Result(Status status, InboundEvent event, UpdateCursor cursor, String detail) {}

    private final EventPoller poller;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration idleInterval;
    private final int pollTimeoutSeconds;

    public PollingLoop(EventPoller poller, Clock clock, Sleeper sleeper,
                       Duration idleInterval, int pollTimeoutSeconds) {
        this.poller = poller;
        this.clock = clock;
        this.sleeper = sleeper;
        this.idleInterval = idleInterval;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
    }

    public Result run(UpdateCursor cursor, Instant deadline, Predicate<InboundEvent> match) {
        var current = cursor;
        while (clock.instant().isBefore(deadline)) {
            var batch = poller.poll(current, longPollSeconds(deadline));
            current = batch.cursor();

            if (batch.isFailed() && batch.failure().kind() == PollFailure.Kind.AUTH_REJECTED) {
                return new Result(Status.REJECTED, null, current, batch.failure().detail());
            }
            for (var event : batch.events()) {
                if (match.test(event)) {
                    return new Result(Status.MATCHED, event, current, null);
                }
            }

            if (!clock.instant().isBefore(deadline)) break;
            try {
                sleeper.pause(idleInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Result(Status.INTERRUPTED, null, current, "interrupted while waiting");
            }
            if (Thread.currentThread().isInterrupted()) {
                return new Result(Status.INTERRUPTED, null, current, "interrupted while polling");
            }
        }
        return new Result(Status.TIMED_OUT, null, current, null);
    }

    /** Long-poll hold time, capped so a round never runs far past the deadline. */
    private int longPollSeconds(Instant deadline) {
        long remaining = Duration.between(clock.instant(), deadline).toSeconds();
        return (int) Math.max(0, Math.min(pollTimeoutSeconds, remaining));
    }
}
