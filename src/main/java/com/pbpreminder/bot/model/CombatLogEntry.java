package com.pbpreminder.bot.model;

import java.time.Instant;

public final class CombatLogEntry {
    public int round;
    public String text;
    public Instant at;

    public static CombatLogEntry of(int round, String text, Instant at) {
        CombatLogEntry e = new CombatLogEntry();
        e.round = round;
        e.text = text;
        e.at = at;
        return e;
    }
}
