package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

public final class MessageMilestoneCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(MessageMilestoneCheck.class);

    @Override
    public String label() {
        return "Message milestones";
    }

    @Override
    public void run(CheckContext ctx) {
        long campaignStep = ctx.settings().campaignMessageStep();
        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.MILESTONES).entrySet()) {
            long cid = e.getKey();
            long total = total(ctx, cid);
            long crossed = crossedStep(total, campaignStep);
            if (!isNew(ctx.ledger(), cid, crossed)) continue;

            String message = "🎉 <b>" + Html.esc(ctx.maps().nameOf(cid)) + "</b> just passed "
                    + fmt(crossed) + " messages! Thanks for keeping the story going.";
            log.info("Message milestone {} in {}", crossed, ctx.maps().nameOf(cid));
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().recordCrossed(LedgerFamily.MESSAGE_MILESTONE, cid, 0L, crossed);
            }
        }

        Optional<Long> board = ctx.config().leaderboardTopicId();
        if (board.isEmpty()) return;
        long all = 0;
        for (long cid : ctx.maps().chatTopics().keySet()) all += total(ctx, cid);
        long crossed = crossedStep(all, ctx.settings().globalMessageStep());
        if (!isNew(ctx.ledger(), DebounceLedger.GLOBAL, crossed)) return;

        String message = "🌟 The whole group just passed " + fmt(crossed) + " PBP messages across "
                + ctx.maps().chatTopics().size() + " campaigns!";
        log.info("Global message milestone {}", crossed);
        if (ctx.send(board.get(), message)) {
            ctx.ledger().recordCrossed(LedgerFamily.MESSAGE_MILESTONE, DebounceLedger.GLOBAL, 0L, crossed);
        }
    }

    private static long total(CheckContext ctx, long cid) {
        long sum = 0;
        for (long n : ctx.snapshot().messageCounts(cid).values()) sum += n;
        return sum;
    }

    static long crossedStep(long total, long step) {
        if (step <= 0) return 0;
        return (total / step) * step;
    }

    private static boolean isNew(DebounceLedger ledger, long campaignId, long crossed) {
        if (crossed <= 0) return false;
        OptionalLong recorded = ledger.highestCrossed(LedgerFamily.MESSAGE_MILESTONE, campaignId, 0L);
        return recorded.isEmpty() || crossed > recorded.getAsLong();
    }

    private static String fmt(long n) {
        return String.format(Locale.US, "%,d", n);
    }
}
