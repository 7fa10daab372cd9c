package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.CampaignDef;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalLong;

public final class AnniversaryCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(AnniversaryCheck.class);

    @Override
    public String label() {
        return "Anniversaries";
    }

    @Override
    public void run(CheckContext ctx) {
        LocalDate today = ctx.now().atZone(ctx.zone()).toLocalDate();

        for (CampaignDef c : ctx.config().campaigns()) {
            long cid = c.canonicalId();
            if (!c.enabled(Feature.ANNIVERSARY)) continue;
            Optional<LocalDate> created = c.createdDate();
            if (created.isEmpty()) continue;

            LocalDate d = created.get();
            if (today.getMonthValue() != d.getMonthValue() || today.getDayOfMonth() != d.getDayOfMonth()) continue;
            int years = today.getYear() - d.getYear();
            if (years < 1) continue;

            OptionalLong done = ctx.ledger().highestCrossed(LedgerFamily.ANNIVERSARY, cid, 0L);
            if (done.isPresent() && done.getAsLong() >= years) continue;

            String message = "🎂 <b>" + Html.esc(c.name()) + "</b> is " + (years == 1 ? "1 year" : years + " years")
                    + " old today!\n\nCampaign started " + TimeUtil.fmtLong(d) + ". Here's to more adventures ahead.";

            log.info("Anniversary for {}: {} years", c.name(), years);
            if (ctx.send(c.chatTopicId(), message)) {
                ctx.ledger().recordCrossed(LedgerFamily.ANNIVERSARY, cid, 0L, years);
            }
        }
    }
}
