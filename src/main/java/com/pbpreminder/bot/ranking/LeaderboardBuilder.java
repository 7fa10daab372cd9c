package com.pbpreminder.bot.ranking;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.activity.Trend;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.config.TopicMaps;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

public final class LeaderboardBuilder {

    static final String RULE = "━━━━━━━━━━━━━━━━";
    static final int STREAK_TOP = 5;

    private static final Comparator<PlayerTally> BY_SESSIONS = Comparator
            .comparingInt(PlayerTally::sessions).reversed()
            .thenComparingLong(PlayerTally::userId);

    private LeaderboardBuilder() {}

    public static List<CampaignStats> gather(ActivitySnapshot snap, CampaignConfig cfg, TopicMaps maps, Instant now) {
        Settings s = cfg.settings();
        Duration burst = s.burstWindow();
        Instant sevenAgo = now.minus(Duration.ofDays(7));
        Instant sixAgo = now.minus(Duration.ofDays(6));
        Instant threeAgo = now.minus(Duration.ofDays(3));

        List<CampaignStats> out = new ArrayList<>();
        for (Map.Entry<Long, String> c : maps.names().entrySet()) {
            long cid = c.getKey();
            Set<Long> gmIds = cfg.gmIdsFor(cid);
            Map<Long, List<Instant>> byUser = snap.timestamps(cid);

            int gm = 0, players = 0, recent = 0, previous = 0;
            List<Instant> allSessions = new ArrayList<>();
            List<Instant> playerSessions = new ArrayList<>();
            List<PlayerTally> tallies = new ArrayList<>();

            for (Map.Entry<Long, List<Instant>> e : byUser.entrySet()) {
                long uid = e.getKey();
                List<Instant> sessions = ActivityMetrics.sessionsIn(e.getValue(), sevenAgo, null, burst);
                recent += ActivityMetrics.countIn(e.getValue(), threeAgo, null);
                previous += ActivityMetrics.countIn(e.getValue(), sixAgo, threeAgo);
                allSessions.addAll(sessions);
                if (gmIds.contains(uid)) {
                    gm += sessions.size();
                } else {
                    players += sessions.size();
                    playerSessions.addAll(sessions);
                    if (!sessions.isEmpty()) {
                        Optional<PlayerRecord> p = snap.player(PlayerKey.of(cid, uid));
                        tallies.add(new PlayerTally(uid,
                                p.map(PlayerRecord::fullName).orElse("Unknown"),
                                p.map(r -> r.username).orElse(""),
                                sessions.size(), 1));
                    }
                }
            }
            allSessions.sort(null);
            playerSessions.sort(null);
            tallies.sort(BY_SESSIONS);

            out.add(new CampaignStats(
                    cid, c.getValue(), gm, players,
                    Trend.classify(recent, previous),
                    ActivityMetrics.avgGapHours(allSessions),
                    ActivityMetrics.avgGapHours(playerSessions),
                    ActivityMetrics.latest(byUser.values()).orElse(null),
                    tallies));
        }
        return out;
    }

    public static List<PlayerTally> globalTallies(List<CampaignStats> stats) {
        Map<Long, PlayerTally> acc = new LinkedHashMap<>();
        for (CampaignStats c : stats) {
            for (PlayerTally t : c.topPlayers()) acc.merge(t.userId(), t, PlayerTally::plus);
        }
        List<PlayerTally> out = new ArrayList<>(acc.values());
        out.sort(BY_SESSIONS);
        return out;
    }

    public static List<StreakEntry> streaks(ActivitySnapshot snap, CampaignConfig cfg, TopicMaps maps, Instant now) {
        ZoneId zone = cfg.settings().zone();
        List<StreakEntry> out = new ArrayList<>();
        for (Map.Entry<Long, String> c : maps.names().entrySet()) {
            for (PlayerRecord p : snap.playersIn(c.getKey())) {
                int streak = ActivityMetrics.streak(snap, p.key(), now, zone);
                if (streak >= 2) out.add(new StreakEntry(p.userId, p.fullName(), streak, c.getValue()));
            }
        }
        out.sort(Comparator.comparingInt(StreakEntry::streak).reversed().thenComparingLong(StreakEntry::userId));
        return out.size() > STREAK_TOP ? new ArrayList<>(out.subList(0, STREAK_TOP)) : out;
    }

    public static String format(List<CampaignStats> stats, List<PlayerTally> global, List<StreakEntry> streaks,
                                Instant now, ZoneId zone) {
        List<CampaignStats> sorted = new ArrayList<>(stats);
        sorted.sort(Comparator.comparingInt(CampaignStats::playerSessions).reversed());
        List<CampaignStats> active = new ArrayList<>();
        List<CampaignStats> dead = new ArrayList<>();
        for (CampaignStats c : sorted) (c.isDead() ? dead : active).add(c);

        int total = 0, players = 0;
        for (CampaignStats c : stats) {
            total += c.totalSessions();
            players += c.playerSessions();
        }

        StringBuilder sb = new StringBuilder();
        sb.append("📊 <b>Weekly Campaign Leaderboard</b>, Week ").append(TimeUtil.isoWeek(now, zone))
                .append(" (").append(TimeUtil.fmtDate(now.minus(Duration.ofDays(7)), zone))
                .append(" to ").append(TimeUtil.fmtDate(now, zone)).append(")\n");
        sb.append(ActivityMetrics.posts(total)).append(" across ")
                .append(ActivityMetrics.plural(active.size(), "active campaign"))
                .append(", ").append(players).append(" from players.\n");

        for (int i = 0; i < active.size(); i++) {
            CampaignStats c = active.get(i);
            sb.append("\n").append(RULE).append("\n\n");
            sb.append("[").append(Ranks.icon(i)).append(" ").append(Html.esc(c.name())).append(" ")
                    .append(c.trend().icon()).append("]\n");
            sb.append("- ").append(c.playerSessions()).append(" player posts.\n");
            sb.append("- ").append(ActivityMetrics.posts(c.totalSessions())).append(" total.\n");
            sb.append("- ").append(c.gmSessions()).append(" GM posts.\n");
            sb.append("- Avg gap: ").append(ActivityMetrics.fmtGapShort(c.avgGapHours())).append(".\n");
            sb.append("- Last post: ").append(ActivityMetrics.fmtBriefRelative(now, c.lastPost())).append(".\n");
            List<PlayerTally> top = c.topPlayers();
            for (int j = 0; j < top.size(); j++) {
                PlayerTally p = top.get(j);
                sb.append("\n").append(Ranks.icon(j)).append(" ").append(Html.esc(p.fullName()));
                if (!p.username().isBlank()) sb.append(" (@").append(Html.esc(p.username())).append(")");
                sb.append(": ").append(ActivityMetrics.posts(p.sessions()));
            }
            if (!top.isEmpty()) sb.append("\n");
        }

        if (!dead.isEmpty()) {
            sb.append("\n⚠️ Dead campaigns (0 posts in 7 days):\n");
            for (CampaignStats c : dead) {
                sb.append("💀 [").append(Html.esc(c.name())).append("] (last post: ")
                        .append(ActivityMetrics.fmtBriefRelative(now, c.lastPost())).append(")\n");
            }
        }

        List<CampaignStats> byGap = new ArrayList<>();
        for (CampaignStats c : stats) if (c.playerAvgGapHours().isPresent()) byGap.add(c);
        if (!byGap.isEmpty()) {
            byGap.sort(Comparator.comparingDouble(c -> c.playerAvgGapHours().getAsDouble()));
            sb.append("\n").append(RULE).append("\n\n⏱ Fastest player response gaps:\n");
            for (int i = 0; i < byGap.size(); i++) {
                CampaignStats c = byGap.get(i);
                sb.append(Ranks.icon(i)).append(" ").append(Html.esc(c.name())).append(": ")
                        .append(ActivityMetrics.fmtGapShort(c.playerAvgGapHours())).append("\n");
            }
        }

        if (!streaks.isEmpty()) {
            sb.append("\n").append(RULE).append("\n\n🔥 Longest Active Streaks:\n");
            for (int i = 0; i < streaks.size(); i++) {
                StreakEntry e = streaks.get(i);
                sb.append(Ranks.icon(i)).append(" ").append(Html.esc(e.fullName())).append(": ")
                        .append(e.streak()).append(" days (").append(Html.esc(e.campaign())).append(")\n");
            }
        }

        if (!global.isEmpty()) {
            PlayerTally mvp = global.get(0);
            sb.append("\n").append(RULE).append("\n\n");
            sb.append("🏆 <b>MVP of the Week</b>: ").append(Html.esc(mvp.fullName()))
                    .append(" with ").append(ActivityMetrics.posts(mvp.sessions()))
                    .append(". Prize: 1 Hero Point!\n");
            sb.append("\n⭐ Top Players of the Week:\n");
            for (int i = 0; i < global.size(); i++) {
                PlayerTally p = global.get(i);
                sb.append("\n").append(Ranks.icon(i)).append(" ").append(Html.esc(p.fullName()));
                if (!p.username().isBlank()) sb.append(" (@").append(Html.esc(p.username())).append(")");
                sb.append(": ").append(ActivityMetrics.posts(p.sessions())).append(" across ")
                        .append(ActivityMetrics.plural(p.campaigns(), "campaign"));
            }
        }
        return sb.toString().trim();
    }
}
