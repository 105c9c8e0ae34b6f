package com.aetherclaw.shared.model;

/**
 * Position in the bot's update stream. {@code nextOffset} is the lowest update id not yet
 * consumed; 0 means nothing has been consumed and no offset is sent.
 */
public record UpdateCursor(long nextOffset) {

    public UpdateCursor {
        if (nextOffset < 0) {
            throw new IllegalArgumentException("nextOffset must be >= 0: " + nextOffset);
        }
    }

    public static UpdateCursor initial() {
        return new UpdateCursor(0);
    }

    /** Returns a cursor past {@code updateId}; never moves backwards. */
    public UpdateCursor advancePast(long updateId) {
        return updateId + 1 > nextOffset ? new UpdateCursor(updateId + 1) : this;
    }

    public boolean isInitial() {
        return nextOffset == 0;
    }
}
