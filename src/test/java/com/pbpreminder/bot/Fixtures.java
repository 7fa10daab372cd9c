package com.pbpreminder.bot;

import com.pbpreminder.bot.check.CheckContext;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.TopicMaps;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.PlayerRecord;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.util.JsonUtils;

import java.time.Duration;
import java.time.Instant;

public final class Fixtures {

    public static final long GROUP = -1001L;
    public static final long GM = 1L;
    public static final long BOARD = 900L;

    public static final long VAULTS = 201L;
    public static final long VAULTS_SPLIT = 202L;
    public static final long VAULTS_CHAT = 101L;
    public static final long KINGMAKER = 203L;
    public static final long KINGMAKER_CHAT = 102L;

    // a Wednesday
    public static final Instant NOW = Instant.parse("2026-02-11T12:00:00Z");

    private Fixtures() {}

    public static CampaignConfig config() {
        return config("{}");
    }

    public static CampaignConfig config(String settingsJson) {
        return CampaignConfig.parse(JsonUtils.parseObj("{"
                + "\"group_id\": " + GROUP + ","
                + "\"gm_user_ids\": [" + GM + "],"
                + "\"leaderboard_topic_id\": " + BOARD + ","
                + "\"topic_pairs\": ["
                + "  {\"name\": \"Vaults\", \"chat_topic_id\": " + VAULTS_CHAT + ","
                + "   \"pbp_topic_ids\": [" + VAULTS + ", " + VAULTS_SPLIT + "], \"created\": \"2024-03-15\"},"
                + "  {\"name\": \"Kingmaker\", \"chat_topic_id\": " + KINGMAKER_CHAT + ","
                + "   \"pbp_topic_ids\": [" + KINGMAKER + "]}"
                + "],"
                + "\"settings\": " + settingsJson
                + "}"));
    }

    public static CheckContext context(ActivitySnapshot snap, CampaignConfig cfg, Instant now, NotificationSink sink) {
        return new CheckContext(snap, cfg, TopicMaps.build(cfg), now, sink);
    }

    public static PlayerRecord player(long campaignId, long userId, String firstName, Instant lastPost) {
        PlayerRecord p = new PlayerRecord();
        p.userId = userId;
        p.campaignId = campaignId;
        p.campaignName = campaignId == VAULTS ? "Vaults" : "Kingmaker";
        p.firstName = firstName;
        p.username = firstName.toLowerCase();
        p.lastPostTime = lastPost;
        return p;
    }

    public static Instant hoursAgo(double hours) {
        return NOW.minus(Duration.ofMinutes(Math.round(hours * 60)));
    }

    public static Instant daysAgo(double days) {
        return hoursAgo(days * 24);
    }
}
