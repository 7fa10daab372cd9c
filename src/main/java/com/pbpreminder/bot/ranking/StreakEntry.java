package com.pbpreminder.bot.ranking;

public record StreakEntry(long userId, String fullName, int streak, String campaign) {
}
