package com.pbpreminder.bot.util;

public final class Html {
    private Html() {}

    public static String esc(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    public static String strike(String s) {
        return "<s>" + s + "</s>";
    }
}
