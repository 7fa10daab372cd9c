package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;

public final class StreakMilestoneCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(StreakMilestoneCheck.class);

    @Override
    public String label() {
        return "Streak milestones";
    }

    @Override
    public void run(CheckContext ctx) {
        List<Integer> milestones = ctx.settings().streakMilestones();
        DebounceLedger ledger = ctx.ledger();

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.STREAKS).entrySet()) {
            long cid = e.getKey();
            for (PlayerRecord p : ctx.players(cid)) {
                int streak = ActivityMetrics.streak(ctx.snapshot(), p.key(), ctx.now(), ctx.zone());

                OptionalLong recorded = ledger.highestCrossed(LedgerFamily.STREAK, cid, p.userId);
                if (recorded.isPresent() && streak < recorded.getAsLong()) {
                    ledger.clearCrossed(LedgerFamily.STREAK, cid, p.userId);
                    recorded = OptionalLong.empty();
                }

                OptionalInt reached = highestReached(milestones, streak);
                if (reached.isEmpty()) continue;
                if (recorded.isPresent() && reached.getAsInt() <= recorded.getAsLong()) continue;

                String message = "🔥 " + Html.esc(p.mention()) + " has posted in "
                        + Html.esc(ctx.maps().nameOf(cid)) + " " + streak + " days in a row! "
                        + reached.getAsInt() + "-day streak reached.";

                log.info("Streak milestone {} for {} in {}", reached.getAsInt(), p.fullName(), p.campaignName);
                if (ctx.send(e.getValue(), message)) {
                    ledger.recordCrossed(LedgerFamily.STREAK, cid, p.userId, reached.getAsInt());
                }
            }
        }
    }

    static OptionalInt highestReached(List<Integer> milestones, int streak) {
        int best = -1;
        for (int m : milestones) {
            if (m <= streak && m > best) best = m;
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }
}
