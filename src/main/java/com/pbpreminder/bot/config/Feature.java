package com.pbpreminder.bot.config;

import java.util.Locale;
import java.util.Optional;

public enum Feature {
    ALERTS,
    WARNINGS,
    ROSTER,
    POTW,
    PACE,
    ANNIVERSARY,
    COMBAT,
    RECRUITMENT,
    STREAKS,
    MILESTONES,
    PACE_DROP,
    SILENCE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Feature> byKey(String key) {
        for (Feature f : values()) {
            if (f.key().equals(key)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
