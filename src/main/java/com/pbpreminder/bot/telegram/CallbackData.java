package com.pbpreminder.bot.telegram;

import java.util.Optional;

public final class CallbackData {
    private CallbackData() {}

    // Award boon choice: award:<campaignId>:<optionIndex>
    public static final String AWARD_PREFIX = "award:";

    public static String award(long campaignId, int optionIndex) {
        return AWARD_PREFIX + campaignId + ":" + optionIndex;
    }

    public static Optional<AwardChoice> parseAward(String data) {
        if (data == null || !data.startsWith(AWARD_PREFIX)) return Optional.empty();
        String[] parts = data.split(":");
        if (parts.length != 3) return Optional.empty();
        try {
            return Optional.of(new AwardChoice(Long.parseLong(parts[1]), Integer.parseInt(parts[2])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public record AwardChoice(long campaignId, int optionIndex) {}
}
