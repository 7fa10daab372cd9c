package com.pbpreminder.bot.model;

public enum LedgerFamily {
    TOPIC_ALERT,
    ROSTER,
    AWARD,
    PACE,
    LEADERBOARD,
    DIGEST,
    RECRUITMENT,
    PACE_DROP,
    STREAK,
    MESSAGE_MILESTONE,
    ANNIVERSARY,
    SILENCE
}
