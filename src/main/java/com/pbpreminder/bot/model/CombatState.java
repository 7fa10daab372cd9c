package com.pbpreminder.bot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class CombatState {
    public boolean active = true;
    public String campaignName;

    public int round = 1;
    public CombatPhase phase = CombatPhase.PLAYERS;
    public Instant phaseStartedAt;
    public Instant startedAt;

    // User ids that posted during the current players phase.
    public Set<Long> actedUserIds = new LinkedHashSet<>();
    public Instant lastPingAt;
    public boolean allActedNotified;

    public List<String> enemies = new ArrayList<>();
    public List<CombatLogEntry> log = new ArrayList<>();

    void backfill() {
        if (actedUserIds == null) actedUserIds = new LinkedHashSet<>();
        if (enemies == null) enemies = new ArrayList<>();
        if (log == null) log = new ArrayList<>();
        if (phase == null) phase = CombatPhase.PLAYERS;
    }
}
