package com.aetherclaw.channels.telegram;

import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * In-memory {@link BotApi}. getUpdates answers from a queue of scripted responses and
 * returns an empty batch once the queue runs dry.
 */
public class ScriptedBotApi implements BotApi {

    public record Poll(long offset, int timeoutSeconds) {}

    public record Sent(String chatId, String text) {}

    private final Deque<ApiResult<List<Update>>> responses = new ArrayDeque<>();
    public final List<Poll> polls = new ArrayList<>();
    public final List<Sent> sent = new ArrayList<>();
    private ApiResult<User> me = ApiResult.ok(user("demo_bot", "Demo"));
    private ApiResult<Boolean> sendResult = ApiResult.ok(Boolean.TRUE);
    private Runnable onPoll = () -> {};

    public static User user(String handle, String firstName) {
        var user = mock(User.class);
        when(user.getUserName()).thenReturn(handle);
        when(user.getFirstName()).thenReturn(firstName);
        return user;
    }

    public static Update message(long id, String chatId, String text, String sender) {
        var from = sender != null ? user(null, sender) : null;
        var msg = mock(Message.class);
        when(msg.getChatId()).thenReturn(Long.valueOf(chatId));
        when(msg.getText()).thenReturn(text);
        when(msg.getFrom()).thenReturn(from);
        var update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(Math.toIntExact(id));
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(msg);
        return update;
    }

    public static Update message(long id, String chatId, String text) {
        return message(id, chatId, text, "Alice");
    }

    public static Update nonMessage(long id) {
        var update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(Math.toIntExact(id));
        return update;
    }

    public ScriptedBotApi thenUpdates(Update... updates) {
        responses.add(ApiResult.ok(List.of(updates)));
        return this;
    }

    public ScriptedBotApi thenFailure(int statusCode, String error) {
        responses.add(ApiResult.failure(statusCode, error));
        return this;
    }

    public ScriptedBotApi withMe(ApiResult<User> me) {
        this.me = me;
        return this;
    }

    public ScriptedBotApi withSendResult(ApiResult<Boolean> sendResult) {
        this.sendResult = sendResult;
        return this;
    }

    /** Runs before every getUpdates call, e.g. to move a {@link ManualClock}. */
    public ScriptedBotApi onPoll(Runnable onPoll) {
        this.onPoll = onPoll;
        return this;
    }

    public List<String> sentTo(String chatId) {
        return sent.stream().filter(s -> s.chatId().equals(chatId)).map(Sent::text).toList();
    }

    @Override
    public ApiResult<User> getMe() {
        return me;
    }

    @Override
    public ApiResult<List<Update>> getUpdates(long offset, int timeoutSeconds) {
        polls.add(new Poll(offset, timeoutSeconds));
        onPoll.run();
        var next = responses.poll();
        return next != null ? next : ApiResult.ok(List.of());
    }

    @Override
    public ApiResult<Boolean> sendMessage(String chatId, String text) {
        sent.add(new Sent(chatId, text));
        return sendResult;
    }
}
