package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.model.CombatState;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.model.RemovedPlayer;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

public final class PlayerActivityCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(PlayerActivityCheck.class);

    @Override
    public String label() {
        return "Player activity";
    }

    @Override
    public void run(CheckContext ctx) {
        Settings s = ctx.settings();
        List<Integer> ladder = s.warningLadder();
        Duration spacing = Duration.ofDays(s.warnSpacingDays());

        for (Map.Entry<Long, Long> e : ctx.campaigns(Feature.WARNINGS).entrySet()) {
            long cid = e.getKey();
            for (PlayerRecord p : ctx.players(cid)) {
                if (p.lastPostTime == null) continue;
                OptionalInt rung = nextRung(ladder, p.lastWarnedWeek);
                if (rung.isEmpty()) continue;

                double days = TimeUtil.daysSince(ctx.now(), p.lastPostTime);
                int weeks = (int) (days / 7);
                if (weeks < rung.getAsInt()) continue;
                if (!TimeUtil.elapsed(p.lastWarnedAt, spacing, ctx.now())) continue;

                if (rung.getAsInt() >= s.removeWeeks()) {
                    remove(ctx, e.getValue(), p, (int) days);
                } else {
                    warn(ctx, e.getValue(), p, rung.getAsInt(), (int) days);
                }
            }
        }
    }

    static OptionalInt nextRung(List<Integer> ladder, int lastWarnedWeek) {
        for (int rung : ladder) {
            if (rung > lastWarnedWeek) return OptionalInt.of(rung);
        }
        return OptionalInt.empty();
    }

    private void warn(CheckContext ctx, long threadId, PlayerRecord p, int rung, int days) {
        Settings s = ctx.settings();
        String mention = Html.esc(p.mention());
        String campaign = Html.esc(p.campaignName);
        String date = TimeUtil.fmtDate(p.lastPostTime, ctx.zone());
        int index = s.warnWeeks().indexOf(rung);

        String message;
        if (index == 0) {
            message = mention + " hasn't posted in " + campaign + " PBP for " + days
                    + " days (last: " + date + "). Everything okay?";
        } else if (index < s.warnWeeks().size() - 1) {
            message = mention + " still no post in " + campaign + " PBP. It's been " + days
                    + " days now (last: " + date + ").";
        } else {
            int left = s.removeWeeks() - rung;
            message = mention + " it's been " + days + " days without a post in " + campaign
                    + " PBP (last: " + date + "). " + (left == 1 ? "1 week" : left + " weeks")
                    + " until auto-removal from the campaign.";
        }

        log.info("Warning {} in {}: week {}", p.fullName(), p.campaignName, rung);
        if (ctx.send(threadId, message)) {
            p.lastWarnedWeek = rung;
            p.lastWarnedAt = ctx.now();
        }
    }

    private void remove(CheckContext ctx, long threadId, PlayerRecord p, int days) {
        String message = Html.esc(p.mention()) + " has not posted in " + Html.esc(p.campaignName) + " PBP for "
                + days + " days (last: " + TimeUtil.fmtDate(p.lastPostTime, ctx.zone())
                + "). They are no longer tracked as an active player in this campaign.";

        log.info("Removing {} from {} ({}d)", p.fullName(), p.campaignName, days);
        if (!ctx.send(threadId, message)) return;

        ctx.snapshot().removePlayer(p.key());
        RemovedPlayer r = new RemovedPlayer();
        r.removedAt = ctx.now();
        r.firstName = p.firstName;
        r.username = p.username;
        r.campaignName = p.campaignName;
        ctx.snapshot().markRemoved(p.key(), r);

        CombatState combat = ctx.snapshot().combat.get(p.campaignId);
        if (combat != null) combat.actedUserIds.remove(p.userId);
    }
}
