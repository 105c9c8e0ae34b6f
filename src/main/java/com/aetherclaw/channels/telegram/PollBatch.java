package com.aetherclaw.channels.telegram;

import com.aetherclaw.shared.model.InboundEvent;
import com.aetherclaw.shared.model.UpdateCursor;

import java.util.List;

/** Result of one poll round: events in ascending id order and the cursor to poll with next. */
public record PollBatch(
    List<InboundEvent> events,
    UpdateCursor cursor,
    PollFailure failure
) {
    public static PollBatch of(List<InboundEvent> events, UpdateCursor cursor) {
        return new PollBatch(List.copyOf(events), cursor, null);
    }

    /** A failed round makes no progress: no events, same cursor. */
    public static PollBatch failed(UpdateCursor cursor, PollFailure failure) {
        return new PollBatch(List.of(), cursor, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
