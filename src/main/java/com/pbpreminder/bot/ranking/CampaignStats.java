package com.pbpreminder.bot.ranking;

import com.pbpreminder.bot.activity.Trend;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

public record CampaignStats(
        long campaignId,
        String name,
        int gmSessions,
        int playerSessions,
        Trend trend,
        OptionalDouble avgGapHours,
        OptionalDouble playerAvgGapHours,
        Instant lastPost,
        List<PlayerTally> topPlayers
) {

    public int totalSessions() {
        return gmSessions + playerSessions;
    }

    public boolean isDead() {
        return totalSessions() == 0;
    }
}
