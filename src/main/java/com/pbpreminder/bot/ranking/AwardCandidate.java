package com.pbpreminder.bot.ranking;

public record AwardCandidate(long userId, int sessions, double avgGapHours) {
}
