package com.pbpreminder.bot.config;

import com.pbpreminder.bot.util.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.pbpreminder.bot.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CampaignConfigTest {

    @Test
    void settingsOverrideDefaultsKeyByKey() {
        CampaignConfig cfg = config("{\"post_session_minutes\": 15, \"player_warn_weeks\": [2, 3],"
                + " \"timezone\": \"Europe/Berlin\"}");
        Settings s = cfg.settings();
        assertEquals(Duration.ofMinutes(15), s.burstWindow());
        assertEquals(List.of(2, 3), s.warnWeeks());
        assertEquals(List.of(2, 3, 4), s.warningLadder());
        assertEquals(ZoneId.of("Europe/Berlin"), s.zone());
        assertEquals(Settings.defaults().awardMinSessions(), s.awardMinSessions());
    }

    @Test
    void topLevelAlertHoursStillHonoured() {
        CampaignConfig cfg = CampaignConfig.parse(JsonUtils.parseObj("{\"group_id\": -5, \"alert_after_hours\": 8,"
                + " \"topic_pairs\": [{\"name\": \"X\", \"chat_topic_id\": 1, \"pbp_topic_ids\": [2]}]}"));
        assertEquals(8, cfg.settings().alertAfterHours());
        assertTrue(cfg.validate().stream().anyMatch(i -> i.startsWith("WARN: gm_user_ids")));
    }

    @Test
    void validConfigHasNoErrors() {
        assertTrue(config().validate().stream().noneMatch(i -> i.startsWith("ERROR:")));
    }

    @Test
    void validationFindsBrokenLayouts() {
        CampaignConfig cfg = CampaignConfig.parse(JsonUtils.parseObj("{\"group_id\": 5, \"gm_user_ids\": [1],"
                + " \"topic_pairs\": ["
                + "{\"name\": \"A\", \"chat_topic_id\": 1, \"pbp_topic_ids\": [2], \"created\": \"March 2024\"},"
                + "{\"name\": \"B\", \"chat_topic_id\": 3, \"pbp_topic_ids\": [2], \"disabled_features\": [\"dragons\"]}"
                + "]}"));
        List<String> issues = cfg.validate();
        assertTrue(issues.contains("ERROR: group_id 5 should be a negative supergroup id"));
        assertTrue(issues.contains("ERROR: pbp topic 2 is listed by both A and B"));
        assertTrue(issues.contains("ERROR: A created date 'March 2024' must be YYYY-MM-DD"));
        assertTrue(issues.contains("WARN: B disables unknown feature 'dragons'"));
    }

    @Test
    void campaignGmListOverridesGroupList() {
        CampaignConfig cfg = CampaignConfig.parse(JsonUtils.parseObj("{\"group_id\": -5, \"gm_user_ids\": [1],"
                + " \"topic_pairs\": ["
                + "{\"name\": \"A\", \"chat_topic_id\": 1, \"pbp_topic_ids\": [2], \"gm_user_ids\": [7]},"
                + "{\"name\": \"B\", \"chat_topic_id\": 3, \"pbp_topic_ids\": [4], \"disabled_features\": [\"combat\"]}"
                + "]}"));
        assertEquals(Set.of(7L), cfg.gmIdsFor(2));
        assertTrue(cfg.isGm(4, 1));
        assertFalse(cfg.isGm(2, 1));
        assertFalse(cfg.featureEnabled(4, Feature.COMBAT));
        assertTrue(cfg.featureEnabled(2, Feature.COMBAT));
    }

    @Test
    void campaignDefinitionDetails() {
        CampaignDef vaults = config().campaign(VAULTS).orElseThrow();
        assertEquals(VAULTS, vaults.canonicalId());
        assertEquals("2024-03-15", vaults.createdDate().orElseThrow().toString());
        assertEquals(Optional.empty(), config().campaign(KINGMAKER).orElseThrow().createdDate());
        assertThrows(IllegalArgumentException.class,
                () -> new CampaignDef("Empty", 1, List.of(), null, null, null, null));
    }

    @Test
    void topicMapsMergeSplitThreads() {
        TopicMaps maps = TopicMaps.build(config());
        assertEquals(Optional.of(VAULTS), maps.canonicalOf(VAULTS_SPLIT));
        assertEquals(VAULTS_CHAT, maps.chatTopics().get(VAULTS));
        assertEquals(Optional.of(KINGMAKER), maps.canonicalOf(KINGMAKER));
        assertTrue(maps.canonicalOf(VAULTS_CHAT).isEmpty());
        assertEquals("Unknown", maps.nameOf(12345));
    }

    @Test
    void topicMapCacheRebuildsOnNewVersion() {
        CampaignConfig cfg = config();
        TopicMapCache cache = new TopicMapCache();
        TopicMaps first = cache.get(cfg);
        assertSame(first, cache.get(cfg));

        CampaignConfig shifted = cfg.withSettings(cfg.settings().withZone(ZoneId.of("Asia/Tokyo")));
        assertNotEquals(cfg.version(), shifted.version());
        assertNotSame(first, cache.get(shifted));
        assertEquals(ZoneId.of("Asia/Tokyo"), shifted.settings().zone());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"group_id\": -7, \"topic_pairs\": "
                + "[{\"name\": \"Ünïcode\", \"chat_topic_id\": 1, \"pbp_topic_ids\": [2]}]}", StandardCharsets.UTF_8);
        CampaignConfig cfg = CampaignConfig.load(file);
        assertEquals(-7, cfg.groupId());
        assertEquals("Ünïcode", cfg.campaigns().get(0).name());
    }
}
