package com.pbpreminder.bot.ranking;

public final class Ranks {
    private static final String[] MEDALS = {"🥇", "🥈", "🥉"};

    private Ranks() {}

    // Medal for the first three places (index 0..2), then "4.", "5." and so on.
    public static String icon(int index) {
        return index < MEDALS.length ? MEDALS[index] : (index + 1) + ".";
    }
}
