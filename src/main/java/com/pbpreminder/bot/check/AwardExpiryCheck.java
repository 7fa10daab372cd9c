package com.pbpreminder.bot.check;

import com.pbpreminder.bot.model.PendingAward;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;

public final class AwardExpiryCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(AwardExpiryCheck.class);

    @Override
    public String label() {
        return "Boon expiry";
    }

    @Override
    public void run(CheckContext ctx) {
        Duration window = Duration.ofHours(ctx.settings().awardChoiceHours());
        Map<Long, PendingAward> pending = ctx.snapshot().pendingAwards;

        for (Map.Entry<Long, PendingAward> e : new ArrayList<>(pending.entrySet())) {
            PendingAward p = e.getValue();
            if (p.postedAt != null && !TimeUtil.elapsed(p.postedAt, window, ctx.now())) continue;

            String text = AwardMessages.result(p.options, 0, p.baseMessage, AwardMessages.AUTO_SELECTED);
            if (ctx.sink().edit(ctx.config().groupId(), p.messageId, text)) {
                pending.remove(e.getKey());
                log.info("Boon auto-selected for campaign {}", e.getKey());
            } else if (p.postedAt == null || TimeUtil.elapsed(p.postedAt, window.multipliedBy(2), ctx.now())) {
                // message is most likely gone; stop retrying after a second window
                pending.remove(e.getKey());
                log.warn("Dropping boon choice for campaign {}: message {} could not be edited",
                        e.getKey(), p.messageId);
            }
        }
    }
}
