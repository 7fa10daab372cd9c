package com.pbpreminder.bot.telegram;

import com.pbpreminder.bot.notify.ChoiceButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.ArrayList;
import java.util.List;

public final class Keyboards {

    private Keyboards() {}

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardMarkup rows(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }

    public static InlineKeyboardMarkup singleRow(List<ChoiceButton> choices) {
        List<InlineKeyboardButton> row = new ArrayList<>();
        for (ChoiceButton c : choices) row.add(btn(c.label(), c.data()));
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        rows.add(row);
        return rows(rows);
    }
}
