package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PendingAward;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.notify.ChoiceButton;
import com.pbpreminder.bot.ranking.AwardCandidate;
import com.pbpreminder.bot.ranking.AwardSelector;
import com.pbpreminder.bot.telegram.CallbackData;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public final class AwardCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(AwardCheck.class);

    private final Random random;
    private final BoonCatalog boons;

    public AwardCheck(Random random, BoonCatalog boons) {
        this.random = random;
        this.boons = boons;
    }

    @Override
    public String label() {
        return "Player of the Week";
    }

    @Override
    public void run(CheckContext ctx) {
        Settings s = ctx.settings();
        Duration interval = Duration.ofDays(s.awardIntervalDays());
        Instant weekAgo = ctx.now().minus(Duration.ofDays(7));

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.POTW).entrySet()) {
            long cid = e.getKey();
            if (!ctx.ledger().intervalElapsed(LedgerFamily.AWARD, cid, interval, ctx.now())) continue;

            String name = ctx.maps().nameOf(cid);
            Optional<AwardCandidate> winner = AwardSelector.select(
                    ctx.snapshot().timestamps(cid), ctx.config().gmIdsFor(cid), ctx.now(), s);
            if (winner.isEmpty()) {
                log.info("No Player of the Week candidates for {} (need {}+ posts)", name, s.awardMinSessions());
                continue;
            }

            AwardCandidate w = winner.get();
            String mention = ctx.snapshot().player(PlayerKey.of(cid, w.userId()))
                    .map(PlayerRecord::mention).orElse("Unknown");
            String gap = String.format(Locale.ROOT, "%.1fh", w.avgGapHours());

            String base = "🏆 <b>Player of the Week for " + Html.esc(name) + "</b>: " + Html.esc(mention) + "!\n"
                    + "(" + TimeUtil.fmtDate(weekAgo, ctx.zone()) + " to " + TimeUtil.fmtDate(ctx.now(), ctx.zone())
                    + ")\n\n"
                    + ActivityMetrics.posts(w.sessions()) + " this week with an average gap of " + gap
                    + " between posts. The most consistent driver of the story.";

            List<String> options = boons.pick(random);
            List<ChoiceButton> buttons = new ArrayList<>();
            for (int i = 0; i < options.size(); i++) {
                buttons.add(new ChoiceButton("Boon #" + (i + 1), CallbackData.award(cid, i)));
            }

            log.info("Player of the Week for {}: user {} (avg gap {})", name, w.userId(), gap);
            Optional<Integer> messageId = ctx.sink().sendWithChoices(
                    ctx.config().groupId(), e.getValue(), base + AwardMessages.options(options), buttons);
            if (messageId.isEmpty()) continue;

            ctx.ledger().markFired(LedgerFamily.AWARD, cid, ctx.now());
            PendingAward pending = new PendingAward();
            pending.messageId = messageId.get();
            pending.winnerUserId = w.userId();
            pending.options = new ArrayList<>(options);
            pending.baseMessage = base;
            pending.postedAt = ctx.now();
            ctx.snapshot().pendingAwards.put(cid, pending);
        }
    }
}
