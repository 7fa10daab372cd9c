package com.pbpreminder.bot.check;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.store.ArchiveRepository;
import com.pbpreminder.bot.store.WeeklyArchiveRow;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.*;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

public final class WeeklyArchiveCheck implements Check {
    private static final Logger log = LoggerFactory.getLogger(WeeklyArchiveCheck.class);

    static final int TOP_PLAYERS = 5;

    private final ArchiveRepository archive;

    public WeeklyArchiveCheck(ArchiveRepository archive) {
        this.archive = archive;
    }

    @Override
    public String label() {
        return "Archive";
    }

    @Override
    public void run(CheckContext ctx) {
        ZoneId zone = ctx.zone();
        LocalDate lastWeekDay = ctx.now().minus(Duration.ofDays(7)).atZone(zone).toLocalDate();
        String weekKey = TimeUtil.isoWeekKey(lastWeekDay);
        if (weekKey.equals(ctx.snapshot().lastArchivedWeek)) return;
        if (!archive.listWeek(weekKey).isEmpty()) {
            // written by a run whose snapshot was lost; a fresh snapshot would overwrite it with zeros
            ctx.snapshot().lastArchivedWeek = weekKey;
            return;
        }

        LocalDate monday = lastWeekDay.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        Instant start = monday.atStartOfDay(zone).toInstant();
        Instant end = monday.plusWeeks(1).atStartOfDay(zone).toInstant();

        List<WeeklyArchiveRow> rows = rows(ctx, weekKey, start, end);
        archive.saveWeek(rows, ctx.now());
        ctx.snapshot().lastArchivedWeek = weekKey;
        log.info("Archived weekly data for {} ({} campaigns)", weekKey, rows.size());
    }

    static List<WeeklyArchiveRow> rows(CheckContext ctx, String weekKey, Instant start, Instant end) {
        Duration burst = ctx.settings().burstWindow();
        List<WeeklyArchiveRow> rows = new ArrayList<>();
        for (Map.Entry<Long, String> c : ctx.maps().names().entrySet()) {
            long cid = c.getKey();
            Set<Long> gmIds = ctx.config().gmIdsFor(cid);
            int gm = 0, players = 0;
            List<Instant> playerSessions = new ArrayList<>();
            Map<String, Integer> counts = new HashMap<>();

            for (Map.Entry<Long, List<Instant>> e : ctx.snapshot().timestamps(cid).entrySet()) {
                List<Instant> sessions = ActivityMetrics.sessionsIn(e.getValue(), start, end, burst);
                if (gmIds.contains(e.getKey())) {
                    gm += sessions.size();
                    continue;
                }
                players += sessions.size();
                playerSessions.addAll(sessions);
                if (!sessions.isEmpty()) {
                    String name = ctx.snapshot().player(PlayerKey.of(cid, e.getKey()))
                            .map(PlayerRecord::mention).orElse("Unknown");
                    counts.merge(name, sessions.size(), Integer::sum);
                }
            }
            playerSessions.sort(null);

            List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
            sorted.sort(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));
            Map<String, Integer> top = new LinkedHashMap<>();
            for (Map.Entry<String, Integer> t : sorted.subList(0, Math.min(TOP_PLAYERS, sorted.size()))) {
                top.put(t.getKey(), t.getValue());
            }

            OptionalDouble gap = ActivityMetrics.avgGapHours(playerSessions);
            if (gap.isPresent()) gap = OptionalDouble.of(Math.round(gap.getAsDouble() * 10) / 10.0);

            rows.add(new WeeklyArchiveRow(cid, weekKey, c.getValue(), gm, players, gap,
                    ctx.players(cid).size(), top));
        }
        return rows;
    }
}
