package com.pbpreminder.bot.telegram;

public record ChoiceTap(String callbackId, long senderId, long chatId, int messageId, String data) {
}
