package com.aetherclaw.channels.telegram;

import com.aetherclaw.shared.model.InboundEvent;
import com.aetherclaw.shared.model.UpdateCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.ArrayList;
import java.util.Comparator;

/**
 * Reads new updates with one long-poll call per {@link #poll}. The cursor is passed in and
 * returned rather than held, so the caller owns it for the length of a pairing attempt.
 */
public class EventPoller {

    private static final Logger log = LoggerFactory.getLogger(EventPoller.class);
    private static final String DEFAULT_SENDER = "User";

    private final BotApi api;

    public EventPoller(BotApi api) {
        this.api = api;
    }

    public PollBatch poll(UpdateCursor cursor, int timeoutSeconds) {
        var result = api.getUpdates(cursor.nextOffset(), timeoutSeconds);
        if (!result.isOk()) {
            var failure = PollFailure.from(result);
            if (failure.kind() == PollFailure.Kind.AUTH_REJECTED) {
                log.warn("Telegram rejected the bot token while polling: {}", failure.detail());
            } else {
                log.debug("Poll failed, no progress this round: {}", failure.detail());
            }
            return PollBatch.failed(cursor, failure);
        }

        var updates = new ArrayList<>(result.value());
        updates.sort(Comparator.comparingLong(Update::getUpdateId));

        var next = cursor;
        var events = new ArrayList<InboundEvent>();
        for (var update : updates) {
            // already consumed in an earlier round
            long id = update.getUpdateId();
            if (id < cursor.nextOffset()) continue;
            next = next.advancePast(id);
            if (!update.hasMessage()) continue;
            var msg = update.getMessage();
            var sender = msg.getFrom() != null && msg.getFrom().getFirstName() != null
                    ? msg.getFrom().getFirstName() : DEFAULT_SENDER;
            events.add(new InboundEvent(id, String.valueOf(msg.getChatId()),
                    msg.getText() != null ? msg.getText() : "", sender));
        }
        return PollBatch.of(events, next);
    }
}
