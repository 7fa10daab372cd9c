package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class RecruitmentCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(RecruitmentCheck.class);

    @Override
    public String label() {
        return "Recruitment";
    }

    @Override
    public void run(CheckContext ctx) {
        int required = ctx.settings().requiredPlayers();
        Duration interval = Duration.ofDays(ctx.settings().recruitmentIntervalDays());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.RECRUITMENT).entrySet()) {
            long cid = e.getKey();
            if (!ctx.ledger().intervalElapsed(LedgerFamily.RECRUITMENT, cid, interval, ctx.now())) continue;

            String name = ctx.maps().nameOf(cid);
            List<PlayerRecord> players = ctx.players(cid);
            int needed = required - players.size();
            if (needed <= 0) {
                ctx.ledger().markFired(LedgerFamily.RECRUITMENT, cid, ctx.now());
                continue;
            }

            StringBuilder roster = new StringBuilder();
            if (players.isEmpty()) {
                roster.append("Current roster: 0/").append(required).append(" (no active players)");
            } else {
                roster.append("Current roster (").append(players.size()).append("/").append(required).append("):");
                for (PlayerRecord p : players) roster.append("\n- ").append(Html.esc(p.mention()));
            }

            String message = "📢 <b>" + Html.esc(name) + "</b> needs " + ActivityMetrics.plural(needed, "more player")
                    + "!\n\n" + roster
                    + "\n\nKnow anyone who'd like to join? Send them to the recruitment topic!";

            log.info("Recruitment notice for {}: {}/{}", name, players.size(), required);
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().markFired(LedgerFamily.RECRUITMENT, cid, ctx.now());
            }
        }
    }
}
