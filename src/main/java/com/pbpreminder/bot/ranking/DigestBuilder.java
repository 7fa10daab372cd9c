package com.pbpreminder.bot.ranking;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class DigestBuilder {

    private DigestBuilder() {}

    public static String healthIcon(int weekSessions) {
        if (weekSessions >= 20) return "🟢";
        if (weekSessions >= 10) return "🟡";
        if (weekSessions >= 5) return "🟠";
        return "🔴";
    }

    public static String format(List<CampaignStats> stats, Instant now, ZoneId zone) {
        List<CampaignStats> sorted = new ArrayList<>(stats);
        sorted.sort(Comparator.comparingInt(CampaignStats::totalSessions).reversed()
                .thenComparing(CampaignStats::name));

        int total = 0;
        StringBuilder body = new StringBuilder();
        for (CampaignStats c : sorted) {
            total += c.totalSessions();
            body.append("\n").append(healthIcon(c.totalSessions())).append(" <b>")
                    .append(Html.esc(c.name())).append("</b>: ")
                    .append(ActivityMetrics.posts(c.totalSessions()));
            if (!c.topPlayers().isEmpty()) {
                PlayerTally mvp = c.topPlayers().get(0);
                body.append(". MVP: ").append(Html.esc(mvp.fullName()))
                        .append(" (").append(mvp.sessions()).append(")");
            }
        }

        return "📰 <b>Weekly Digest</b> (" + TimeUtil.fmtDate(now.minus(Duration.ofDays(7)), zone)
                + " to " + TimeUtil.fmtDate(now, zone) + ")\n"
                + body
                + "\n\nTotal: " + ActivityMetrics.posts(total) + " across "
                + ActivityMetrics.plural(stats.size(), "campaign") + ".";
    }
}
