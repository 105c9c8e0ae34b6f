package com.aetherclaw.channels.telegram;

import com.aetherclaw.shared.config.TelegramConfig;
import okhttp3.OkHttpClient;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.TelegramUrl;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * {@link BotApi} on a telegrambots {@link TelegramClient}. No call throws, every failure
 * comes back as an {@link ApiResult}.
 */
public class TelegramBotClient implements BotApi {

    static final String PARSE_MODE = ParseMode.MARKDOWN;

    private final TelegramClient client;

    public TelegramBotClient(TelegramClient client) {
        this.client = client;
    }

    public static BotApiFactory factory(TelegramConfig config) {
        var url = telegramUrl(config.apiBaseUrl());
        // getUpdates holds the connection open for up to the long-poll timeout
        var http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(config.requestTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(config.requestTimeoutSeconds()
                        + config.pairing().pollTimeoutSeconds()))
                .build();
        return token -> new TelegramBotClient(new OkHttpTelegramClient(http, token, url));
    }

    static TelegramUrl telegramUrl(String baseUrl) {
        var uri = URI.create(baseUrl);
        var schema = uri.getScheme() != null ? uri.getScheme() : "https";
        var port = uri.getPort() != -1 ? uri.getPort() : ("http".equals(schema) ? 80 : 443);
        return TelegramUrl.builder().schema(schema).host(uri.getHost()).port(port).build();
    }

    @Override
    public ApiResult<User> getMe() {
        try {
            var me = client.execute(GetMe.builder().build());
            if (me == null) return ApiResult.failure(0, "getMe: response has no result");
            return ApiResult.ok(me);
        } catch (TelegramApiException | RuntimeException e) {
            return failure("getMe", e);
        }
    }

    @Override
    public ApiResult<List<Update>> getUpdates(long offset, int timeoutSeconds) {
        try {
            var request = GetUpdates.builder().timeout(Math.max(timeoutSeconds, 0));
            if (offset > 0) request.offset(Math.toIntExact(offset));
            List<Update> updates = client.execute(request.build());
            return ApiResult.ok(updates != null ? updates : List.of());
        } catch (TelegramApiException | RuntimeException e) {
            return failure("getUpdates", e);
        }
    }

    @Override
    public ApiResult<Boolean> sendMessage(String chatId, String text) {
        try {
            client.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .build());
            return ApiResult.ok(Boolean.TRUE);
        } catch (TelegramApiException | RuntimeException e) {
            return failure("sendMessage", e);
        }
    }

    /**
     * Request errors carry Telegram's own code and description. Anything else is reported
     * by exception type only: messages from the HTTP layer can embed the request URL, and
     * with it the token.
     */
    private static <T> ApiResult<T> failure(String method, Exception e) {
        if (e instanceof TelegramApiRequestException) {
            var rejected = (TelegramApiRequestException) e;
            var code = rejected.getErrorCode() != null ? rejected.getErrorCode() : 0;
            var description = rejected.getApiResponse() != null ? rejected.getApiResponse() : "malformed response";
            return ApiResult.failure(code, method + ": " + description);
        }
        var cause = e.getCause() != null ? e.getCause() : e;
        return ApiResult.failure(0, method + ": " + cause.getClass().getSimpleName());
    }
}
