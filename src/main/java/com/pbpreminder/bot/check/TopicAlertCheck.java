package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.TopicState;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

public final class TopicAlertCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(TopicAlertCheck.class);

    @Override
    public String label() {
        return "Topic alerts";
    }

    @Override
    public void run(CheckContext ctx) {
        int alertHours = ctx.settings().alertAfterHours();
        Duration interval = Duration.ofHours(alertHours);

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.ALERTS).entrySet()) {
            long cid = e.getKey();
            String name = ctx.maps().nameOf(cid);
            TopicState topic = ctx.snapshot().topics.get(cid);
            if (topic == null || topic.lastMessageTime == null) {
                log.debug("No messages tracked yet for {}, skipping", name);
                continue;
            }
            double elapsed = TimeUtil.hoursSince(ctx.now(), topic.lastMessageTime);
            if (elapsed < alertHours) continue;
            if (!ctx.ledger().intervalElapsed(LedgerFamily.TOPIC_ALERT, cid, interval, ctx.now())) {
                log.debug("{}: already alerted within {}h", name, alertHours);
                continue;
            }

            int hours = (int) elapsed;
            String time = hours >= 24 ? (hours / 24) + "d " + (hours % 24) + "h" : hours + "h";
            long count = ctx.snapshot().messageCount(PlayerKey.of(cid, topic.lastUserId));
            String countStr = count > 0 ? " (" + count + " total posts)" : "";
            String lastUser = topic.lastUser == null ? "someone" : topic.lastUser;

            String message = "No new posts in <b>" + Html.esc(name) + "</b> PBP for " + time + ".\n"
                    + "Last post was from " + Html.esc(lastUser) + countStr + " on "
                    + TimeUtil.fmtDate(topic.lastMessageTime, ctx.zone()) + ".";

            log.info("Sending alert for {}: {} inactive", name, time);
            if (ctx.send(e.getValue(), message)) {
                ctx.ledger().markFired(LedgerFamily.TOPIC_ALERT, cid, ctx.now());
            }
        }
    }
}
