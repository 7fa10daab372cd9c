package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.activity.SessionNormalizer;
import com.pbpreminder.bot.config.CampaignDef;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.model.PostDayRun;
import com.pbpreminder.bot.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public final class RosterCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(RosterCheck.class);

    @Override
    public String label() {
        return "Roster summary";
    }

    @Override
    public void run(CheckContext ctx) {
        Settings s = ctx.settings();
        Duration interval = Duration.ofDays(s.rosterIntervalDays());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.ROSTER).entrySet()) {
            long cid = e.getKey();
            if (!ctx.ledger().intervalElapsed(LedgerFamily.ROSTER, cid, interval, ctx.now())) continue;

            String name = ctx.maps().nameOf(cid);
            List<PlayerRecord> players = ctx.players(cid);
            Map<Long, Long> counts = ctx.snapshot().messageCounts(cid);
            Map<Long, List<Instant>> timestamps = ctx.snapshot().timestamps(cid);
            Optional<CampaignDef> def = ctx.config().campaign(cid);
            if (players.isEmpty() && counts.isEmpty()) continue;

            List<String> blocks = new ArrayList<>();
            for (long gm : ctx.config().gmIdsFor(cid)) {
                long count = counts.getOrDefault(gm, 0L);
                List<Instant> ts = timestamps.getOrDefault(gm, List.of());
                if (count > 0 && !ts.isEmpty()) {
                    blocks.add(block("GM", "", null, count, ts,
                            ctx.snapshot().postRun(PlayerKey.of(cid, gm)).orElse(null), ctx));
                }
            }

            players.sort(Comparator.comparingLong((PlayerRecord p) -> counts.getOrDefault(p.userId, 0L)).reversed());
            for (PlayerRecord p : players) {
                List<Instant> ts = timestamps.getOrDefault(p.userId, List.of());
                if (ts.isEmpty()) continue;
                String character = def.flatMap(d -> d.characterOf(p.userId)).orElse(null);
                blocks.add(block(p.fullName(), p.username, character, counts.getOrDefault(p.userId, 0L), ts,
                        ctx.snapshot().postRun(p.key()).orElse(null), ctx));
            }
            if (blocks.isEmpty()) continue;

            int size = players.size();
            StringBuilder footer = new StringBuilder("\nParty size: ").append(size).append("/")
                    .append(s.requiredPlayers()).append(".");
            if (size < s.requiredPlayers()) {
                int needed = s.requiredPlayers() - size;
                footer.append("\n").append(Html.esc(name)).append(" needs ")
                        .append(ActivityMetrics.plural(needed, "more player")).append("!");
            }

            String message = "👥 <b>Party roster for " + Html.esc(name) + ":</b>\n\n"
                    + String.join("\n\n", blocks) + "\n" + footer;

            log.info("Posting roster for {}", name);
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().markFired(LedgerFamily.ROSTER, cid, ctx.now());
            }
        }
    }

    static String block(String label, String username, String character, long total, List<Instant> ts,
                        PostDayRun run, CheckContext ctx) {
        Settings s = ctx.settings();
        Instant now = ctx.now();
        List<Instant> sessions = SessionNormalizer.sessions(ts, s.burstWindow());
        int week = ActivityMetrics.sessionsIn(ts, now.minus(Duration.ofDays(7)), null, s.burstWindow()).size();
        int streak = ActivityMetrics.streak(ts, run, now, s.zone());

        StringBuilder sb = new StringBuilder("<b>").append(Html.esc(label)).append("</b>\n");
        if (username != null && !username.isBlank()) sb.append("- @").append(Html.esc(username)).append(".\n");
        if (character != null) sb.append("- Playing ").append(Html.esc(character)).append(".\n");
        sb.append("- ").append(ActivityMetrics.posts(total)).append(" total.\n");
        sb.append("- ").append(ActivityMetrics.plural(sessions.size(), "posting session")).append(".\n");
        sb.append("- ").append(ActivityMetrics.posts(week)).append(" in the last week.\n");
        sb.append("- Average gap between posting: ")
                .append(ActivityMetrics.fmtGap(ActivityMetrics.avgGapHours(sessions))).append(".\n");
        if (streak >= 2) sb.append("- 🔥 ").append(streak).append("-day streak.\n");
        sb.append("- Last post: ").append(ActivityMetrics.fmtRelativeDate(now, ts.get(ts.size() - 1), s.zone()))
                .append(".");
        return sb.toString();
    }
}
