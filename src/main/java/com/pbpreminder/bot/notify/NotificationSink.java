package com.pbpreminder.bot.notify;

import java.util.List;
import java.util.Optional;

public interface NotificationSink {

    boolean send(long chatId, long threadId, String html);

    /** Sends a message with one row of buttons and returns its message id on success. */
    Optional<Integer> sendWithChoices(long chatId, long threadId, String html, List<ChoiceButton> buttons);

    /** Replaces the text of a sent message and drops its buttons. */
    boolean edit(long chatId, int messageId, String html);

    void acknowledge(String callbackId, String text);
}
