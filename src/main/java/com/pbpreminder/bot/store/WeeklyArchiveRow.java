package com.pbpreminder.bot.store;

import java.util.Map;
import java.util.OptionalDouble;

public record WeeklyArchiveRow(
        long campaignId,
        String week,
        String campaign,
        int gmPosts,
        int playerPosts,
        OptionalDouble playerAvgGapHours,
        int activePlayers,
        Map<String, Integer> topPlayers
) {

    public int totalPosts() {
        return gmPosts + playerPosts;
    }
}
