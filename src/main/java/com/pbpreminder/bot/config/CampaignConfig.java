package com.pbpreminder.bot.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.pbpreminder.bot.util.JsonUtils;
import com.pbpreminder.bot.util.TimeUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

public final class CampaignConfig {

    private static final AtomicLong VERSIONS = new AtomicLong();

    private final long version;
    private final long groupId;
    private final Set<Long> gmUserIds;
    private final Long leaderboardTopicId;
    private final List<CampaignDef> campaigns;
    private final Settings settings;

    public CampaignConfig(long groupId, Set<Long> gmUserIds, Long leaderboardTopicId,
                          List<CampaignDef> campaigns, Settings settings) {
        this.version = VERSIONS.incrementAndGet();
        this.groupId = groupId;
        this.gmUserIds = Set.copyOf(gmUserIds);
        this.leaderboardTopicId = leaderboardTopicId;
        this.campaigns = List.copyOf(campaigns);
        this.settings = Objects.requireNonNull(settings);
    }

    public static CampaignConfig load(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        return parse(JsonUtils.parseObj(json));
    }

    public static CampaignConfig parse(JsonObject root) {
        long groupId = root.has("group_id") ? root.get("group_id").getAsLong() : 0L;
        Set<Long> gms = new LinkedHashSet<>(JsonUtils.getLongList(root, "gm_user_ids"));
        Long leaderboard = JsonUtils.getLong(root, "leaderboard_topic_id");

        List<CampaignDef> defs = new ArrayList<>();
        if (root.has("topic_pairs")) {
            for (JsonElement e : root.getAsJsonArray("topic_pairs")) {
                defs.add(parseCampaign(e.getAsJsonObject()));
            }
        }

        JsonObject settingsObj = root.has("settings") ? root.getAsJsonObject("settings") : new JsonObject();
        // alert_after_hours historically lived at the top level
        if (root.has("alert_after_hours") && !settingsObj.has("alert_after_hours")) {
            settingsObj = settingsObj.deepCopy();
            settingsObj.add("alert_after_hours", root.get("alert_after_hours"));
        }
        return new CampaignConfig(groupId, gms, leaderboard, defs, Settings.fromJson(settingsObj));
    }

    private static CampaignDef parseCampaign(JsonObject o) {
        Set<String> disabled = new LinkedHashSet<>();
        if (o.has("disabled_features")) {
            for (JsonElement f : o.getAsJsonArray("disabled_features")) disabled.add(f.getAsString());
        }
        Map<Long, String> characters = new LinkedHashMap<>();
        if (o.has("characters")) {
            for (Map.Entry<String, JsonElement> c : o.getAsJsonObject("characters").entrySet()) {
                characters.put(Long.parseLong(c.getKey()), c.getValue().getAsString());
            }
        }
        return new CampaignDef(
                JsonUtils.getString(o, "name", "Unknown"),
                o.get("chat_topic_id").getAsLong(),
                JsonUtils.getLongList(o, "pbp_topic_ids"),
                JsonUtils.getString(o, "created", null),
                disabled,
                characters,
                new LinkedHashSet<>(JsonUtils.getLongList(o, "gm_user_ids"))
        );
    }

    public CampaignConfig withSettings(Settings other) {
        return new CampaignConfig(groupId, gmUserIds, leaderboardTopicId, campaigns, other);
    }

    public List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (groupId >= 0) {
            issues.add("ERROR: group_id " + groupId + " should be a negative supergroup id");
        }
        if (campaigns.isEmpty()) {
            issues.add("ERROR: topic_pairs is empty");
        }
        Map<Long, String> seen = new HashMap<>();
        for (CampaignDef c : campaigns) {
            for (Long tid : c.pbpTopicIds()) {
                String prev = seen.putIfAbsent(tid, c.name());
                if (prev != null) {
                    issues.add("ERROR: pbp topic " + tid + " is listed by both " + prev + " and " + c.name());
                }
            }
            for (String f : c.disabledFeatures()) {
                if (Feature.byKey(f).isEmpty()) {
                    issues.add("WARN: " + c.name() + " disables unknown feature '" + f + "'");
                }
            }
            if (c.created() != null && !c.created().isBlank()) {
                try {
                    TimeUtil.parseDate(c.created());
                } catch (DateTimeParseException e) {
                    issues.add("ERROR: " + c.name() + " created date '" + c.created() + "' must be YYYY-MM-DD");
                }
            }
        }
        if (gmUserIds.isEmpty()) {
            issues.add("WARN: gm_user_ids is empty, every poster will be tracked as a player");
        }
        return issues;
    }

    public long version() { return version; }
    public long groupId() { return groupId; }
    public Set<Long> gmUserIds() { return gmUserIds; }
    public Optional<Long> leaderboardTopicId() { return Optional.ofNullable(leaderboardTopicId); }
    public List<CampaignDef> campaigns() { return campaigns; }
    public Settings settings() { return settings; }

    public Optional<CampaignDef> campaign(long canonicalId) {
        for (CampaignDef c : campaigns) {
            if (c.canonicalId() == canonicalId) return Optional.of(c);
        }
        return Optional.empty();
    }

    public Set<Long> gmIdsFor(long canonicalId) {
        return campaign(canonicalId)
                .filter(c -> !c.gmUserIds().isEmpty())
                .map(CampaignDef::gmUserIds)
                .orElse(gmUserIds);
    }

    public boolean isGm(long canonicalId, long userId) {
        return gmIdsFor(canonicalId).contains(userId);
    }

    public boolean featureEnabled(long canonicalId, Feature feature) {
        return campaign(canonicalId).map(c -> c.enabled(feature)).orElse(true);
    }
}
