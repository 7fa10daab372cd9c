package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.activity.PaceSplit;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

public final class PaceDropCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(PaceDropCheck.class);

    @Override
    public String label() {
        return "Pace drop";
    }

    @Override
    public void run(CheckContext ctx) {
        Settings s = ctx.settings();
        Duration interval = Duration.ofDays(s.paceDropIntervalDays());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.PACE_DROP).entrySet()) {
            long cid = e.getKey();
            if (!ctx.ledger().intervalElapsed(LedgerFamily.PACE_DROP, cid, interval, ctx.now())) continue;

            PaceSplit split = ActivityMetrics.paceSplit(ctx.snapshot().timestamps(cid),
                    ctx.config().gmIdsFor(cid), ctx.now(), s.burstWindow());
            if (!isDrop(split, s)) continue;

            String name = ctx.maps().nameOf(cid);
            int drop = (int) Math.round(100.0 * (split.lastWeek() - split.thisWeek()) / split.lastWeek());
            String message = "📉 <b>" + Html.esc(name) + "</b> has slowed down: "
                    + ActivityMetrics.posts(split.thisWeek()) + " this week vs "
                    + split.lastWeek() + " last week (" + drop + "% drop). Anything the table needs?";

            log.info("Pace drop in {}: {} vs {}", name, split.thisWeek(), split.lastWeek());
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().markFired(LedgerFamily.PACE_DROP, cid, ctx.now());
            }
        }
    }

    static boolean isDrop(PaceSplit split, Settings s) {
        if (split.lastWeek() < s.paceDropMinSessions()) return false;
        return split.thisWeek() < split.lastWeek() * s.paceDropRatio();
    }
}
