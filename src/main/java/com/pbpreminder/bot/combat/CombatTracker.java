package com.pbpreminder.bot.combat;

import com.pbpreminder.bot.model.CombatLogEntry;
import com.pbpreminder.bot.model.CombatPhase;
import com.pbpreminder.bot.model.CombatState;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

public final class CombatTracker {

    private final Map<Long, CombatState> combats;

    public CombatTracker(Map<Long, CombatState> combats) {
        this.combats = combats;
    }

    public Optional<CombatState> get(long campaignId) {
        CombatState c = combats.get(campaignId);
        return c != null && c.active ? Optional.of(c) : Optional.empty();
    }

    /**
     * Starts combat at round 1 in the players phase. Returns empty when combat is already running
     * in this campaign; the running one is left untouched.
     */
    public Optional<CombatState> start(long campaignId, String campaignName, List<String> enemies, Instant now) {
        if (get(campaignId).isPresent()) return Optional.empty();
        CombatState c = fresh(campaignName, 1, CombatPhase.PLAYERS, now);
        c.enemies.addAll(enemies);
        combats.put(campaignId, c);
        return Optional.of(c);
    }

    // Moves to an explicit round and phase, creating the combat if there is none.
    public CombatState advance(long campaignId, String campaignName, int round, CombatPhase phase, Instant now) {
        if (round < 1) throw new IllegalArgumentException("Round must be positive: " + round);
        CombatState c = combats.get(campaignId);
        if (c == null || !c.active) {
            c = fresh(campaignName, round, phase, now);
            combats.put(campaignId, c);
            return c;
        }
        transition(c, round, phase, now);
        return c;
    }

    // Players to enemies in the same round; enemies to players of the next round.
    public Optional<CombatState> next(long campaignId, Instant now) {
        Optional<CombatState> c = get(campaignId);
        c.ifPresent(s -> {
            if (s.phase == CombatPhase.PLAYERS) {
                transition(s, s.round, CombatPhase.ENEMIES, now);
            } else {
                transition(s, s.round + 1, CombatPhase.PLAYERS, now);
            }
        });
        return c;
    }

    public boolean log(long campaignId, String text, Instant now) {
        Optional<CombatState> c = get(campaignId);
        if (c.isEmpty() || text == null || text.isBlank()) return false;
        c.get().log.add(CombatLogEntry.of(c.get().round, text.trim(), now));
        return true;
    }

    public Optional<CombatState> end(long campaignId) {
        return Optional.ofNullable(combats.remove(campaignId));
    }

    /**
     * Marks a non-GM poster as having acted. Only counts during the players phase.
     *
     * @return true if the user was not in the acted set before
     */
    public static boolean recordAction(CombatState c, long userId) {
        if (!c.active || c.phase != CombatPhase.PLAYERS) return false;
        return c.actedUserIds.add(userId);
    }

    public static List<PlayerRecord> missing(CombatState c, List<PlayerRecord> known) {
        List<PlayerRecord> out = new ArrayList<>();
        for (PlayerRecord p : known) {
            if (!c.actedUserIds.contains(p.userId)) out.add(p);
        }
        return out;
    }

    public static boolean allActed(CombatState c, List<PlayerRecord> known) {
        return c.phase == CombatPhase.PLAYERS && !known.isEmpty() && missing(c, known).isEmpty();
    }

    /**
     * True when the players phase has lasted at least {@code after} and the previous ping, if
     * any, is at least that old.
     */
    public static boolean pingDue(CombatState c, Duration after, Instant now) {
        if (!c.active || c.phase != CombatPhase.PLAYERS || c.phaseStartedAt == null) return false;
        if (!TimeUtil.elapsed(c.phaseStartedAt, after, now)) return false;
        return TimeUtil.elapsed(c.lastPingAt, after, now);
    }

    static void transition(CombatState c, int round, CombatPhase phase, Instant now) {
        boolean changed = c.round != round || c.phase != phase;
        if (phase == CombatPhase.PLAYERS && (c.phase != CombatPhase.PLAYERS || c.round != round)) {
            c.actedUserIds.clear();
        }
        c.round = round;
        c.phase = phase;
        if (changed) {
            c.phaseStartedAt = now;
            c.lastPingAt = null;
            c.allActedNotified = false;
        }
    }

    private static CombatState fresh(String campaignName, int round, CombatPhase phase, Instant now) {
        CombatState c = new CombatState();
        c.campaignName = campaignName;
        c.round = round;
        c.phase = phase;
        c.phaseStartedAt = now;
        c.startedAt = now;
        return c;
    }

    // --- messages ---

    public static String phaseMessage(CombatState c) {
        return "⚔️ Round " + c.round + ". " + c.phase.label + "' turn.";
    }

    public static String startMessage(CombatState c) {
        StringBuilder sb = new StringBuilder("⚔️ Combat started in ").append(Html.esc(c.campaignName))
                .append("! Round 1. Players' turn.");
        if (!c.enemies.isEmpty()) {
            sb.append("\nEnemies: ").append(Html.esc(String.join(", ", c.enemies)));
        }
        return sb.toString();
    }

    public static String summary(CombatState c, Instant now) {
        StringBuilder sb = new StringBuilder("🏁 Combat ended in ").append(Html.esc(c.campaignName))
                .append(" after ").append(c.round == 1 ? "1 round" : c.round + " rounds");
        if (c.startedAt != null) {
            sb.append(" (").append(TimeUtil.fmtElapsed(TimeUtil.hoursSince(now, c.startedAt))).append(")");
        }
        sb.append(".");
        if (!c.log.isEmpty()) {
            sb.append("\n\n<b>Combat log:</b>");
            for (CombatLogEntry e : c.log) {
                sb.append("\nR").append(e.round).append(": ").append(Html.esc(e.text));
            }
        }
        return sb.toString();
    }

    public static String whosTurn(CombatState c, List<PlayerRecord> known, Instant now) {
        StringBuilder sb = new StringBuilder("⚔️ Round ").append(c.round).append(", ")
                .append(c.phase.label).append("' turn");
        if (c.phaseStartedAt != null) {
            sb.append(" (").append(TimeUtil.fmtElapsed(TimeUtil.hoursSince(now, c.phaseStartedAt))).append(" so far)");
        }
        if (c.phase == CombatPhase.PLAYERS) {
            List<String> acted = new ArrayList<>();
            List<String> waiting = new ArrayList<>();
            for (PlayerRecord p : known) {
                (c.actedUserIds.contains(p.userId) ? acted : waiting).add(Html.esc(p.fullName()));
            }
            sb.append("\nActed: ").append(acted.isEmpty() ? "nobody yet" : String.join(", ", acted));
            sb.append("\nWaiting on: ").append(waiting.isEmpty() ? "nobody" : String.join(", ", waiting));
        }
        if (!c.enemies.isEmpty()) {
            sb.append("\nEnemies: ").append(Html.esc(String.join(", ", c.enemies)));
        }
        return sb.toString();
    }

    public static String pingMessage(CombatState c, List<PlayerRecord> missing, Instant now, ZoneId zone) {
        List<String> names = new ArrayList<>();
        for (PlayerRecord p : missing) names.add(Html.esc(p.mention()));
        int hours = (int) TimeUtil.hoursSince(now, c.phaseStartedAt);
        return "⏳ Round " + c.round + " - waiting on: " + String.join(", ", names)
                + "\n(" + hours + "h since players' phase started on "
                + TimeUtil.fmtDate(c.phaseStartedAt, zone) + ")";
    }

    public static String allActedMessage(CombatState c) {
        return "✅ All players have posted for round " + c.round + ". Over to the GM!";
    }
}
