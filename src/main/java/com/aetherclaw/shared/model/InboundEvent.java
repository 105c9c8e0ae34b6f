package com.aetherclaw.shared.model;

public record InboundEvent(
    long id,
    String conversationId,
    String text,
    String senderName
) {}
