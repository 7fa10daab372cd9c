package com.pbpreminder.bot.check;

import com.pbpreminder.bot.combat.CombatTracker;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.model.CombatState;
import com.pbpreminder.bot.model.PlayerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public final class CombatPingCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(CombatPingCheck.class);

    @Override
    public String label() {
        return "Combat pings";
    }

    @Override
    public void run(CheckContext ctx) {
        Duration after = Duration.ofHours(ctx.settings().combatPingHours());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.COMBAT).entrySet()) {
            long cid = e.getKey();
            CombatState c = ctx.snapshot().combat.get(cid);
            if (c == null || !c.active) continue;

            List<PlayerRecord> known = ctx.players(cid);
            if (CombatTracker.allActed(c, known)) {
                if (!c.allActedNotified && ctx.send(e.getValue(), CombatTracker.allActedMessage(c))) {
                    c.allActedNotified = true;
                }
                continue;
            }
            if (!CombatTracker.pingDue(c, after, ctx.now())) continue;

            List<PlayerRecord> missing = CombatTracker.missing(c, known);
            if (missing.isEmpty()) continue;

            log.info("Combat ping in {}: waiting on {} players", c.campaignName, missing.size());
            if (ctx.send(e.getValue(), CombatTracker.pingMessage(c, missing, ctx.now(), ctx.zone()))) {
                c.lastPingAt = ctx.now();
            }
        }
    }
}
