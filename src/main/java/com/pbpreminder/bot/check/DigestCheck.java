package com.pbpreminder.bot.check;

import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.ranking.CampaignStats;
import com.pbpreminder.bot.ranking.DigestBuilder;
import com.pbpreminder.bot.ranking.LeaderboardBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public final class DigestCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(DigestCheck.class);

    @Override
    public String label() {
        return "Weekly digest";
    }

    @Override
    public void run(CheckContext ctx) {
        Optional<Long> topic = ctx.config().leaderboardTopicId();
        if (topic.isEmpty()) return;
        Duration interval = Duration.ofDays(ctx.settings().digestIntervalDays());
        if (!ctx.ledger().intervalElapsed(LedgerFamily.DIGEST, DebounceLedger.GLOBAL, interval, ctx.now())) return;

        List<CampaignStats> stats = LeaderboardBuilder.gather(ctx.snapshot(), ctx.config(), ctx.maps(), ctx.now());
        if (stats.isEmpty()) return;

        log.info("Posting weekly digest");
        if (ctx.send(topic.get(), DigestBuilder.format(stats, ctx.now(), ctx.zone()))) {
            ctx.ledger().markFired(LedgerFamily.DIGEST, DebounceLedger.GLOBAL, ctx.now());
        }
    }
}
