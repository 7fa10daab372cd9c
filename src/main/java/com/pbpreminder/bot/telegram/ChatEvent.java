package com.pbpreminder.bot.telegram;

import java.time.Instant;

public record ChatEvent(
        long chatId,
        Long threadId,
        long senderId,
        String firstName,
        String lastName,
        String username,
        boolean fromBot,
        String text,
        Instant sentAt
) {
}
