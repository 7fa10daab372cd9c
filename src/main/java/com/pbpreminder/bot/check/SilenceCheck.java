package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.DebounceLedger;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.TopicState;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalLong;

public final class SilenceCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(SilenceCheck.class);

    @Override
    public String label() {
        return "Silence";
    }

    @Override
    public void run(CheckContext ctx) {
        int silenceHours = ctx.settings().silenceHours();
        DebounceLedger ledger = ctx.ledger();

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.SILENCE).entrySet()) {
            long cid = e.getKey();
            TopicState topic = ctx.snapshot().topics.get(cid);
            if (topic == null || topic.lastMessageTime == null) continue;

            double hours = TimeUtil.hoursSince(ctx.now(), topic.lastMessageTime);
            if (hours < silenceHours) {
                ledger.clearCrossed(LedgerFamily.SILENCE, cid, 0L);
                continue;
            }
            long episode = topic.lastMessageTime.getEpochSecond();
            OptionalLong alerted = ledger.highestCrossed(LedgerFamily.SILENCE, cid, 0L);
            if (alerted.isPresent() && alerted.getAsLong() == episode) continue;

            String name = ctx.maps().nameOf(cid);
            String message = "🔇 <b>" + Html.esc(name) + "</b> has been completely silent for "
                    + TimeUtil.fmtElapsed(hours) + ". Last post: "
                    + TimeUtil.fmtDate(topic.lastMessageTime, ctx.zone()) + ". Is the game still on?";

            log.info("Silence alert for {} ({}h)", name, (int) hours);
            if (ctx.send(e.getValue(), message)) {
                ledger.recordCrossed(LedgerFamily.SILENCE, cid, 0L, episode);
            }
        }
    }
}
