package com.aetherclaw.channels.telegram;

@FunctionalInterface
public interface BotApiFactory {
    BotApi open(String token);
}
