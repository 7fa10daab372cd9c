package com.pbpreminder.bot.check;

import com.pbpreminder.bot.util.Html;

import java.util.List;

public final class AwardMessages {

    public static final String CHOSEN = "Chosen boon";
    public static final String AUTO_SELECTED = "Boon (auto-selected)";

    private AwardMessages() {}

    public static String options(List<String> options) {
        StringBuilder sb = new StringBuilder("\n\nChoose your boon:\n");
        for (int i = 0; i < options.size(); i++) {
            sb.append("\n").append(i + 1).append(". ").append(Html.esc(options.get(i))).append("\n");
        }
        return sb.toString();
    }

    public static String result(List<String> options, int chosen, String baseMessage, String label) {
        StringBuilder sb = new StringBuilder(baseMessage).append("\n\n").append(label).append(":");
        for (int i = 0; i < options.size(); i++) {
            String line = (i + 1) + ". " + Html.esc(options.get(i));
            if (i == chosen) {
                sb.append("\n").append(line).append(" ✓\n");
            } else {
                sb.append("\n").append(Html.strike(line)).append("\n");
            }
        }
        return sb.toString();
    }
}
