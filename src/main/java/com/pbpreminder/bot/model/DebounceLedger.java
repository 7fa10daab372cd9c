package com.pbpreminder.bot.model;

import com.pbpreminder.bot.util.TimeUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Persisted "last fired" markers. Interval checks record a time per campaign; threshold checks
 * record the highest value already announced per (campaign, subject). Cross-campaign records
 * use {@link #GLOBAL} as the campaign id.
 */
public final class DebounceLedger {

    public static final long GLOBAL = 0L;

    public Map<LedgerFamily, Map<Long, Instant>> lastFired = new HashMap<>();
    public Map<LedgerFamily, Map<Long, Map<Long, Long>>> crossed = new HashMap<>();

    public Instant lastFired(LedgerFamily family, long campaignId) {
        Map<Long, Instant> m = lastFired.get(family);
        return m == null ? null : m.get(campaignId);
    }

    public boolean intervalElapsed(LedgerFamily family, long campaignId, Duration interval, Instant now) {
        return TimeUtil.elapsed(lastFired(family, campaignId), interval, now);
    }

    public void markFired(LedgerFamily family, long campaignId, Instant now) {
        lastFired.computeIfAbsent(family, k -> new HashMap<>()).put(campaignId, now);
    }

    public OptionalLong highestCrossed(LedgerFamily family, long campaignId, long subjectId) {
        Map<Long, Map<Long, Long>> byCampaign = crossed.get(family);
        if (byCampaign == null) return OptionalLong.empty();
        Map<Long, Long> bySubject = byCampaign.get(campaignId);
        if (bySubject == null || !bySubject.containsKey(subjectId)) return OptionalLong.empty();
        return OptionalLong.of(bySubject.get(subjectId));
    }

    public void recordCrossed(LedgerFamily family, long campaignId, long subjectId, long value) {
        crossed.computeIfAbsent(family, k -> new HashMap<>())
                .computeIfAbsent(campaignId, k -> new HashMap<>())
                .put(subjectId, value);
    }

    public void clearCrossed(LedgerFamily family, long campaignId, long subjectId) {
        Map<Long, Map<Long, Long>> byCampaign = crossed.get(family);
        if (byCampaign == null) return;
        Map<Long, Long> bySubject = byCampaign.get(campaignId);
        if (bySubject == null) return;
        bySubject.remove(subjectId);
        if (bySubject.isEmpty()) byCampaign.remove(campaignId);
    }

    void backfill() {
        if (lastFired == null) lastFired = new HashMap<>();
        if (crossed == null) crossed = new HashMap<>();
    }
}
