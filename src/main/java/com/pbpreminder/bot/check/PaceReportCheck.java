package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.activity.PaceSplit;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

public final class PaceReportCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(PaceReportCheck.class);

    @Override
    public String label() {
        return "Pace report";
    }

    @Override
    public void run(CheckContext ctx) {
        Duration interval = Duration.ofDays(ctx.settings().paceIntervalDays());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.PACE).entrySet()) {
            long cid = e.getKey();
            if (!ctx.ledger().intervalElapsed(LedgerFamily.PACE, cid, interval, ctx.now())) continue;

            String name = ctx.maps().nameOf(cid);
            PaceSplit split = ActivityMetrics.paceSplit(ctx.snapshot().timestamps(cid),
                    ctx.config().gmIdsFor(cid), ctx.now(), ctx.settings().burstWindow());
            if (split.isEmpty()) {
                log.debug("No pace data for {}", name);
                continue;
            }

            String icon = split.trend().icon();
            String message = icon + " <b>Weekly pace for " + Html.esc(name) + ":</b>\n\n"
                    + format(split, ctx.now(), ctx.zone())
                    + "\nTrend: " + icon;

            log.info("Pace report for {}: {} vs {} ({})", name, split.thisWeek(), split.lastWeek(), split.trend());
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().markFired(LedgerFamily.PACE, cid, ctx.now());
            }
        }
    }

    static String format(PaceSplit s, Instant now, ZoneId zone) {
        Instant weekAgo = now.minus(Duration.ofDays(7));
        Instant twoWeeksAgo = now.minus(Duration.ofDays(14));
        return "This week (" + TimeUtil.fmtDate(weekAgo, zone) + " to " + TimeUtil.fmtDate(now, zone) + "):\n"
                + lines(s.gmThisWeek(), s.playersThisWeek())
                + "\nLast week (" + TimeUtil.fmtDate(twoWeeksAgo, zone) + " to " + TimeUtil.fmtDate(weekAgo, zone) + "):\n"
                + lines(s.gmLastWeek(), s.playersLastWeek());
    }

    private static String lines(int gm, int players) {
        return "  GM: " + perDay(gm) + "\n"
                + "  Players: " + perDay(players) + "\n"
                + "  Total: " + perDay(gm + players) + "\n";
    }

    private static String perDay(int n) {
        return ActivityMetrics.posts(n) + String.format(Locale.ROOT, " (%.1f/day)", n / 7.0);
    }
}
