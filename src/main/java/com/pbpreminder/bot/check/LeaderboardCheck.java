package com.pbpreminder.bot.check;

import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.ranking.CampaignStats;
import com.pbpreminder.bot.ranking.LeaderboardBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public final class LeaderboardCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(LeaderboardCheck.class);

    @Override
    public String label() {
        return "Leaderboard";
    }

    @Override
    public void run(CheckContext ctx) {
        Optional<Long> topic = ctx.config().leaderboardTopicId();
        if (topic.isEmpty()) return;
        Duration interval = Duration.ofDays(ctx.settings().leaderboardIntervalDays());
        if (!ctx.ledger().intervalElapsed(LedgerFamily.LEADERBOARD, DebounceLedger.GLOBAL, interval, ctx.now())) {
            return;
        }

        List<CampaignStats> stats = LeaderboardBuilder.gather(ctx.snapshot(), ctx.config(), ctx.maps(), ctx.now());
        if (stats.isEmpty()) {
            log.info("No campaign data for leaderboard");
            return;
        }
        String message = LeaderboardBuilder.format(
                stats,
                LeaderboardBuilder.globalTallies(stats),
                LeaderboardBuilder.streaks(ctx.snapshot(), ctx.config(), ctx.maps(), ctx.now()),
                ctx.now(), ctx.zone());

        log.info("Posting campaign leaderboard ({} campaigns)", stats.size());
        if (ctx.send(topic.get(), message)) {
            ctx.ledger().markFired(LedgerFamily.LEADERBOARD, DebounceLedger.GLOBAL, ctx.now());
        }
    }
}
