package com.pbpreminder.bot.config;

import com.google.gson.JsonObject;
import com.pbpreminder.bot.util.JsonUtils;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for one run. Defaults are overridden key by key from the {@code settings} block of the
 * campaigns file.
 */
public record Settings(
        int burstWindowMinutes,
        List<Integer> warnWeeks,
        int removeWeeks,
        int warnSpacingDays,
        int alertAfterHours,
        int rosterIntervalDays,
        int awardIntervalDays,
        int awardMinSessions,
        int awardChoiceHours,
        int paceIntervalDays,
        int leaderboardIntervalDays,
        int digestIntervalDays,
        int combatPingHours,
        int recruitmentIntervalDays,
        int requiredPlayers,
        int paceDropIntervalDays,
        int paceDropMinSessions,
        double paceDropRatio,
        int silenceHours,
        List<Integer> streakMilestones,
        int campaignMessageStep,
        int globalMessageStep,
        int retentionDays,
        ZoneId zone
) {

    public Settings {
        warnWeeks = List.copyOf(warnWeeks);
        streakMilestones = List.copyOf(streakMilestones);
    }

    public static Settings defaults() {
        return new Settings(
                10,
                List.of(1, 2, 3),
                4,
                7,
                4,
                3,
                7,
                5,
                48,
                7,
                3,
                7,
                4,
                14,
                6,
                7,
                5,
                0.5,
                48,
                List.of(7, 14, 30, 60, 100),
                500,
                5000,
                15,
                ZoneOffset.UTC
        );
    }

    public static Settings fromJson(JsonObject s) {
        Settings d = defaults();
        if (s == null) return d;
        return new Settings(
                JsonUtils.getInt(s, "post_session_minutes", d.burstWindowMinutes()),
                JsonUtils.getIntList(s, "player_warn_weeks", d.warnWeeks()),
                JsonUtils.getInt(s, "player_remove_weeks", d.removeWeeks()),
                JsonUtils.getInt(s, "warn_spacing_days", d.warnSpacingDays()),
                JsonUtils.getInt(s, "alert_after_hours", d.alertAfterHours()),
                JsonUtils.getInt(s, "roster_interval_days", d.rosterIntervalDays()),
                JsonUtils.getInt(s, "potw_interval_days", d.awardIntervalDays()),
                JsonUtils.getInt(s, "potw_min_posts", d.awardMinSessions()),
                JsonUtils.getInt(s, "potw_choice_hours", d.awardChoiceHours()),
                JsonUtils.getInt(s, "pace_interval_days", d.paceIntervalDays()),
                JsonUtils.getInt(s, "leaderboard_interval_days", d.leaderboardIntervalDays()),
                JsonUtils.getInt(s, "digest_interval_days", d.digestIntervalDays()),
                JsonUtils.getInt(s, "combat_ping_hours", d.combatPingHours()),
                JsonUtils.getInt(s, "recruitment_interval_days", d.recruitmentIntervalDays()),
                JsonUtils.getInt(s, "required_players", d.requiredPlayers()),
                JsonUtils.getInt(s, "pace_drop_interval_days", d.paceDropIntervalDays()),
                JsonUtils.getInt(s, "pace_drop_min_posts", d.paceDropMinSessions()),
                JsonUtils.getDouble(s, "pace_drop_ratio", d.paceDropRatio()),
                JsonUtils.getInt(s, "silence_hours", d.silenceHours()),
                JsonUtils.getIntList(s, "streak_milestones", d.streakMilestones()),
                JsonUtils.getInt(s, "campaign_message_step", d.campaignMessageStep()),
                JsonUtils.getInt(s, "global_message_step", d.globalMessageStep()),
                JsonUtils.getInt(s, "timestamp_retention_days", d.retentionDays()),
                ZoneId.of(JsonUtils.getString(s, "timezone", d.zone().getId()))
        );
    }

    public Settings withZone(ZoneId z) {
        return new Settings(burstWindowMinutes, warnWeeks, removeWeeks, warnSpacingDays, alertAfterHours,
                rosterIntervalDays, awardIntervalDays, awardMinSessions, awardChoiceHours, paceIntervalDays,
                leaderboardIntervalDays, digestIntervalDays, combatPingHours, recruitmentIntervalDays,
                requiredPlayers, paceDropIntervalDays, paceDropMinSessions, paceDropRatio, silenceHours,
                streakMilestones, campaignMessageStep, globalMessageStep, retentionDays, z);
    }

    public Duration burstWindow() {
        return Duration.ofMinutes(burstWindowMinutes);
    }

    public List<Integer> warningLadder() {
        List<Integer> ladder = new ArrayList<>(warnWeeks);
        ladder.add(removeWeeks);
        ladder.sort(null);
        return ladder;
    }
}
