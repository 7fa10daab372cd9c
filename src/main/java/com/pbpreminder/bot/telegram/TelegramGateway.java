package com.pbpreminder.bot.telegram;

import com.pbpreminder.bot.config.Config;
import com.pbpreminder.bot.notify.ChoiceButton;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.util.TextChunker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bot API access for a single batch run: pulls updates with getUpdates instead of a long-polling
 * session, and sends everything in HTML parse mode.
 */
public final class TelegramGateway extends DefaultAbsSender implements NotificationSink, UpdateSource {
    private static final Logger log = LoggerFactory.getLogger(TelegramGateway.class);

    private final Config cfg;

    public TelegramGateway(Config cfg) {
        super(new DefaultBotOptions(), cfg.botToken());
        this.cfg = cfg;
    }

    @Override
    public List<InboundUpdate> fetch(long offset) {
        GetUpdates req = new GetUpdates();
        req.setOffset((int) offset);
        req.setLimit(cfg.fetchLimit());
        req.setTimeout(5);
        req.setAllowedUpdates(List.of("message", "callback_query"));
        List<Update> raw;
        try {
            raw = execute(req);
        } catch (TelegramApiException e) {
            log.error("getUpdates failed at offset {}: {}", offset, e.getMessage());
            return List.of();
        }
        List<InboundUpdate> out = new ArrayList<>();
        for (Update u : raw) out.add(toInbound(u));
        return out;
    }

    static InboundUpdate toInbound(Update u) {
        long id = u.getUpdateId();
        if (u.hasCallbackQuery()) {
            CallbackQuery cb = u.getCallbackQuery();
            Message m = cb.getMessage();
            if (cb.getFrom() == null || m == null) return InboundUpdate.ignored(id);
            return InboundUpdate.tap(id, new ChoiceTap(
                    cb.getId(), cb.getFrom().getId(), m.getChatId(), m.getMessageId(), cb.getData()));
        }
        if (u.hasMessage()) {
            Message m = u.getMessage();
            User from = m.getFrom();
            if (from == null) return InboundUpdate.ignored(id);
            Integer thread = m.getMessageThreadId();
            Instant sentAt = m.getDate() == null ? null : Instant.ofEpochSecond(m.getDate());
            return InboundUpdate.message(id, new ChatEvent(
                    m.getChatId(),
                    thread == null ? null : thread.longValue(),
                    from.getId(),
                    nvl(from.getFirstName()),
                    nvl(from.getLastName()),
                    nvl(from.getUserName()),
                    Boolean.TRUE.equals(from.getIsBot()),
                    m.getText(),
                    sentAt));
        }
        return InboundUpdate.ignored(id);
    }

    /**
     * Long texts go out as several messages. Delivery counts once the first part is accepted: a
     * later failure is logged and the remaining parts are dropped, so a retry never repeats the
     * parts already posted.
     */
    @Override
    public boolean send(long chatId, long threadId, String html) {
        List<String> chunks = TextChunker.splitByLines(html, cfg.maxMessageLen());
        if (chunks.isEmpty()) return false;
        if (sendHtml(chatId, threadId, chunks.get(0), null).isEmpty()) return false;
        for (int i = 1; i < chunks.size(); i++) {
            if (sendHtml(chatId, threadId, chunks.get(i), null).isEmpty()) {
                log.warn("Dropped {} of {} parts to {}/{} after a failed send",
                        chunks.size() - i, chunks.size(), chatId, threadId);
                break;
            }
        }
        return true;
    }

    @Override
    public Optional<Integer> sendWithChoices(long chatId, long threadId, String html, List<ChoiceButton> buttons) {
        return sendHtml(chatId, threadId, limit(html), Keyboards.singleRow(buttons));
    }

    @Override
    public boolean edit(long chatId, int messageId, String html) {
        EditMessageText em = new EditMessageText();
        em.setChatId(chatId);
        em.setMessageId(messageId);
        em.setText(limit(html));
        em.setParseMode(ParseMode.HTML);
        try {
            execute(em);
            return true;
        } catch (TelegramApiException e) {
            log.warn("Edit of message {} in {} failed: {}", messageId, chatId, e.getMessage());
            return false;
        }
    }

    @Override
    public void acknowledge(String callbackId, String text) {
        AnswerCallbackQuery a = new AnswerCallbackQuery();
        a.setCallbackQueryId(callbackId);
        a.setText(text);
        a.setShowAlert(false);
        try {
            execute(a);
        } catch (TelegramApiException e) {
            log.warn("answerCallbackQuery failed: {}", e.getMessage());
        }
    }

    Optional<Integer> sendHtml(long chatId, long threadId, String text, InlineKeyboardMarkup kb) {
        SendMessage m = new SendMessage();
        m.setChatId(chatId);
        m.setMessageThreadId((int) threadId);
        m.setText(text);
        m.setParseMode(ParseMode.HTML);
        m.setDisableWebPagePreview(true);
        if (kb != null) m.setReplyMarkup(kb);
        try {
            Message sent = execute(m);
            return Optional.ofNullable(sent).map(Message::getMessageId);
        } catch (TelegramApiException e) {
            log.warn("Send to {}/{} failed: {}", chatId, threadId, e.getMessage());
            return Optional.empty();
        }
    }

    private String limit(String text) {
        if (text == null) return "";
        if (text.length() <= cfg.maxMessageLen()) return text;
        return text.substring(0, cfg.maxMessageLen() - 3) + "...";
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }
}
