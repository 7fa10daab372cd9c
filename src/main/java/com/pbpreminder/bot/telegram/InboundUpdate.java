package com.pbpreminder.bot.telegram;

import java.util.Optional;

public record InboundUpdate(long updateId, ChatEvent message, ChoiceTap tap) {

    public static InboundUpdate message(long updateId, ChatEvent e) {
        return new InboundUpdate(updateId, e, null);
    }

    public static InboundUpdate tap(long updateId, ChoiceTap t) {
        return new InboundUpdate(updateId, null, t);
    }

    public static InboundUpdate ignored(long updateId) {
        return new InboundUpdate(updateId, null, null);
    }

    public Optional<ChatEvent> chatEvent() {
        return Optional.ofNullable(message);
    }

    public Optional<ChoiceTap> choiceTap() {
        return Optional.ofNullable(tap);
    }
}
