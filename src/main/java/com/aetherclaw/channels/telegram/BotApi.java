package com.aetherclaw.channels.telegram;

import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.util.List;

/** The three Bot API calls the pairing flow needs, bound to one bot token. */
public interface BotApi {

    ApiResult<User> getMe();

    /**
     * @param offset         first update id to return; 0 sends no offset
     * @param timeoutSeconds how long the server may hold the request open waiting for updates
     */
    ApiResult<List<Update>> getUpdates(long offset, int timeoutSeconds);

    ApiResult<Boolean> sendMessage(String chatId, String text);
}
