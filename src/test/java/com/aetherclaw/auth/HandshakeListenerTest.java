package com.aetherclaw.auth;

import com.aetherclaw.channels.telegram.EventPoller;
import com.aetherclaw.channels.telegram.ManualClock;
import com.aetherclaw.channels.telegram.PollingLoop;
import com.aetherclaw.channels.telegram.ScriptedBotApi;
import com.aetherclaw.shared.model.UpdateCursor;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.aetherclaw.channels.telegram.ScriptedBotApi.message;
import static com.aetherclaw.channels.telegram.ScriptedBotApi.nonMessage;
import static org.junit.jupiter.api.Assertions.*;

class HandshakeListenerTest {

    private final ManualClock clock = new ManualClock();

    private HandshakeListener listener(ScriptedBotApi api, Duration timeout) {
        var loop = new PollingLoop(new EventPoller(api), clock, clock.sleeper(), Duration.ofSeconds(2), 25);
        return new HandshakeListener(loop, clock, timeout);
    }

    @Test
    void startFromAnyConversationIsAccepted() {
        var api = new ScriptedBotApi()
                .thenUpdates(message(1, "555", "hi there"))
                .thenUpdates(nonMessage(2), message(3, "777", "/start", "Alice"));

        var result = listener(api, Duration.ofSeconds(300)).await(UpdateCursor.initial());

        assertTrue(result.isStarted());
        assertEquals("777", result.conversationId());
        assertEquals("Alice", result.senderName());
        assertEquals(4, result.cursor().nextOffset());
    }

    @Test
    void onlyTheExactStartCommandMatches() {
        var api = new ScriptedBotApi()
                .thenUpdates(
                        message(1, "111", "/start "),
                        message(2, "222", " /start"),
                        message(3, "333", "/startx"),
                        message(4, "444", "/START"),
                        message(5, "555", "/help"))
                .thenUpdates(message(6, "666", "/start"));

        var result = listener(api, Duration.ofSeconds(300)).await(UpdateCursor.initial());

        assertEquals(HandshakeResult.Status.STARTED, result.status());
        assertEquals("666", result.conversationId());
    }

    @Test
    void timesOutWithoutStartAndStopsPolling() {
        var api = new ScriptedBotApi().thenUpdates(message(1, "777", "hello"));

        var result = listener(api, Duration.ofSeconds(6)).await(UpdateCursor.initial());

        assertEquals(HandshakeResult.Status.TIMED_OUT, result.status());
        assertNull(result.conversationId());
        assertEquals(2, result.cursor().nextOffset());
        int polls = api.polls.size();
        assertEquals(3, polls);
    }

    @Test
    void revokedTokenIsReportedInsteadOfWaitingOut() {
        var api = new ScriptedBotApi().thenFailure(401, "getUpdates: Unauthorized");

        var result = listener(api, Duration.ofSeconds(300)).await(UpdateCursor.initial());

        assertEquals(HandshakeResult.Status.REJECTED, result.status());
        assertEquals(1, api.polls.size());
    }

    @Test
    void resumesFromGivenCursor() {
        var api = new ScriptedBotApi().thenUpdates(message(9, "777", "/start"));

        listener(api, Duration.ofSeconds(10)).await(new UpdateCursor(9));

        assertEquals(9, api.polls.get(0).offset());
    }

    @Test
    void givenDeadlineTakesPrecedenceOverConfiguredTimeout() {
        var api = new ScriptedBotApi().thenUpdates(message(1, "777", "hello"));

        var result = listener(api, Duration.ofSeconds(300))
                .await(UpdateCursor.initial(), clock.instant().plusSeconds(6));

        assertEquals(HandshakeResult.Status.TIMED_OUT, result.status());
        assertEquals(3, api.polls.size());
    }
}
