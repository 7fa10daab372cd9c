package com.pbpreminder.bot.check;

import com.pbpreminder.bot.combat.CombatTracker;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.CombatState;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.pbpreminder.bot.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GroupChecksTest {

    private final CampaignConfig cfg = config();
    private NotificationSink sink;
    private ActivitySnapshot snap;

    @BeforeEach
    void setUp() {
        sink = mock(NotificationSink.class);
        when(sink.send(anyLong(), anyLong(), anyString())).thenReturn(true);
        snap = new ActivitySnapshot();
    }

    private void posts(long cid, long userId, Instant... at) {
        for (Instant t : at) {
            snap.appendTimestamp(PlayerKey.of(cid, userId), t);
            snap.incrementCount(PlayerKey.of(cid, userId));
        }
    }

    @Test
    void recruitmentNoticeForSmallParty() {
        snap.putPlayer(player(VAULTS, 10L, "Ann", NOW));
        snap.putPlayer(player(KINGMAKER, 11L, "Bob", NOW));

        new RecruitmentCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(eq(GROUP), eq(VAULTS_CHAT), contains("<b>Vaults</b> needs 5 more players!"));
        verify(sink).send(eq(GROUP), eq(KINGMAKER_CHAT), contains("Current roster (1/6):\n- Bob (@bob)"));
        assertNotNull(snap.ledger.lastFired(LedgerFamily.RECRUITMENT, VAULTS));
    }

    @Test
    void fullPartyRestartsRecruitmentTimerWithoutPosting() {
        for (long id = 10; id < 16; id++) snap.putPlayer(player(VAULTS, id, "P" + id, NOW));
        CampaignConfig vaultsOnly = config("{\"required_players\": 6}");

        new RecruitmentCheck().run(context(snap, vaultsOnly, NOW, sink));

        verify(sink, never()).send(anyLong(), eq(VAULTS_CHAT), anyString());
        assertEquals(NOW, snap.ledger.lastFired(LedgerFamily.RECRUITMENT, VAULTS));
    }

    @Test
    void combatPingNamesMissingPlayers() {
        snap.putPlayer(player(VAULTS, 10L, "Ann", NOW));
        snap.putPlayer(player(VAULTS, 11L, "Bob", NOW));
        CombatState c = new CombatTracker(snap.combat).start(VAULTS, "Vaults", List.of(), hoursAgo(5)).orElseThrow();
        CombatTracker.recordAction(c, 10L);

        CombatPingCheck check = new CombatPingCheck();
        check.run(context(snap, cfg, NOW, sink));
        check.run(context(snap, cfg, NOW.plus(Duration.ofHours(1)), sink));

        verify(sink, times(1)).send(eq(GROUP), eq(VAULTS_CHAT), contains("waiting on: Bob (@bob)"));
        assertEquals(NOW, c.lastPingAt);
    }

    @Test
    void combatPingRetriesAllActedNotice() {
        snap.putPlayer(player(VAULTS, 10L, "Ann", NOW));
        CombatState c = new CombatTracker(snap.combat).start(VAULTS, "Vaults", List.of(), hoursAgo(1)).orElseThrow();
        CombatTracker.recordAction(c, 10L);

        new CombatPingCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(GROUP, VAULTS_CHAT, "✅ All players have posted for round 1. Over to the GM!");
        assertTrue(c.allActedNotified);
    }

    @Test
    void paceDropNeedsEnoughHistory() {
        // 6 sessions last week, 1 this week
        posts(VAULTS, 10L, daysAgo(8), daysAgo(9), daysAgo(10), daysAgo(11), daysAgo(12), daysAgo(13), daysAgo(1));
        posts(KINGMAKER, 11L, daysAgo(8), daysAgo(9), daysAgo(1));

        new PaceDropCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(eq(GROUP), eq(VAULTS_CHAT), contains("1 post this week vs 6 last week (83% drop)"));
        verify(sink, never()).send(anyLong(), eq(KINGMAKER_CHAT), anyString());
    }

    @Test
    void paceReportSplitsGmAndPlayers() {
        posts(VAULTS, GM, daysAgo(1), daysAgo(2));
        posts(VAULTS, 10L, daysAgo(3), daysAgo(9));

        new PaceReportCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(eq(GROUP), eq(VAULTS_CHAT), contains("  GM: 2 posts (0.3/day)\n  Players: 1 post (0.1/day)"));
        assertNull(snap.ledger.lastFired(LedgerFamily.PACE, KINGMAKER));
    }

    @Test
    void rosterListsGmThenPlayersByCount() {
        snap.putPlayer(player(VAULTS, 10L, "Ann", daysAgo(1)));
        snap.putPlayer(player(VAULTS, 11L, "Bob", daysAgo(2)));
        posts(VAULTS, GM, daysAgo(1));
        posts(VAULTS, 10L, daysAgo(1));
        posts(VAULTS, 11L, daysAgo(3), daysAgo(2));

        new RosterCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(eq(GROUP), eq(VAULTS_CHAT), argThat(text ->
                text.indexOf("<b>GM</b>") < text.indexOf("<b>Bob</b>")
                        && text.indexOf("<b>Bob</b>") < text.indexOf("<b>Ann</b>")
                        && text.contains("Party size: 2/6.")
                        && text.contains("Vaults needs 4 more players!")));
        verify(sink, never()).send(anyLong(), eq(KINGMAKER_CHAT), anyString());
    }

    @Test
    void leaderboardAndDigestGoToLeaderboardTopic() {
        snap.putPlayer(player(VAULTS, 10L, "Ann", daysAgo(1)));
        posts(VAULTS, 10L, daysAgo(1), daysAgo(2));

        new LeaderboardCheck().run(context(snap, cfg, NOW, sink));
        new DigestCheck().run(context(snap, cfg, NOW, sink));

        verify(sink).send(eq(GROUP), eq(BOARD), contains("Weekly Campaign Leaderboard"));
        verify(sink).send(eq(GROUP), eq(BOARD), contains("Weekly Digest"));
        assertEquals(NOW, snap.ledger.lastFired(LedgerFamily.LEADERBOARD, 0L));
        assertEquals(NOW, snap.ledger.lastFired(LedgerFamily.DIGEST, 0L));
    }

    @Test
    void noLeaderboardTopicMeansNoLeaderboard() {
        CampaignConfig noBoard = CampaignConfig.parse(JsonUtils.parseObj(
                "{\"group_id\": -5, \"topic_pairs\": [{\"name\": \"X\", \"chat_topic_id\": 1, \"pbp_topic_ids\": [2]}]}"));
        new LeaderboardCheck().run(context(snap, noBoard, NOW, sink));
        verifyNoInteractions(sink);
        assertTrue(snap.ledger.lastFired.isEmpty());
    }
}
