package com.studiobooking.orchestrator.dialogue;

/** A text message normalized away from any channel's wire format. */
public record InboundMessage(String channel, String chatId, String messageId, String text) {}
