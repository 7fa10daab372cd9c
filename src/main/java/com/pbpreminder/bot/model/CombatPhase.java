package com.pbpreminder.bot.model;

import java.util.Locale;
import java.util.Optional;

public enum CombatPhase {
    PLAYERS("Players"),
    ENEMIES("Enemies");

    public final String label;

    CombatPhase(String label) {
        this.label = label;
    }

    public static Optional<CombatPhase> parse(String s) {
        if (s == null) return Optional.empty();
        switch (s.toLowerCase(Locale.ROOT)) {
            case "players":
                return Optional.of(PLAYERS);
            case "enemies":
                return Optional.of(ENEMIES);
            default:
                return Optional.empty();
        }
    }
}
