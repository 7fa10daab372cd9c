package com.pbpreminder.bot.combat;

import com.pbpreminder.bot.model.CombatPhase;
import com.pbpreminder.bot.model.CombatState;
import com.pbpreminder.bot.model.PlayerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.pbpreminder.bot.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CombatTrackerTest {

    private Map<Long, CombatState> combats;
    private CombatTracker tracker;

    @BeforeEach
    void setUp() {
        combats = new HashMap<>();
        tracker = new CombatTracker(combats);
    }

    @Test
    void startBeginsRoundOneWithPlayers() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of("Goblin", "Wolf"), NOW).orElseThrow();
        assertEquals(1, c.round);
        assertEquals(CombatPhase.PLAYERS, c.phase);
        assertEquals(NOW, c.phaseStartedAt);
        assertEquals(List.of("Goblin", "Wolf"), c.enemies);
        assertTrue(CombatTracker.startMessage(c).contains("Enemies: Goblin, Wolf"));
    }

    @Test
    void secondStartLeavesRunningCombatAlone() {
        tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(3));
        tracker.next(VAULTS, hoursAgo(2));
        assertTrue(tracker.start(VAULTS, "Vaults", List.of(), NOW).isEmpty());
        assertEquals(CombatPhase.ENEMIES, combats.get(VAULTS).phase);
    }

    @Test
    void enemiesPhaseKeepsActedSetAndNextRoundClearsIt() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(5)).orElseThrow();
        assertTrue(CombatTracker.recordAction(c, 10L));

        tracker.next(VAULTS, hoursAgo(4));
        assertEquals(CombatPhase.ENEMIES, c.phase);
        assertEquals(1, c.round);
        assertTrue(c.actedUserIds.contains(10L));

        tracker.next(VAULTS, hoursAgo(3));
        assertEquals(CombatPhase.PLAYERS, c.phase);
        assertEquals(2, c.round);
        assertTrue(c.actedUserIds.isEmpty());
        assertEquals(hoursAgo(3), c.phaseStartedAt);
    }

    @Test
    void repeatingCurrentPlayersPhaseKeepsActedSet() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(5)).orElseThrow();
        CombatTracker.recordAction(c, 10L);

        tracker.advance(VAULTS, "Vaults", 1, CombatPhase.PLAYERS, NOW);
        assertTrue(c.actedUserIds.contains(10L));
        assertEquals(hoursAgo(5), c.phaseStartedAt);
    }

    @Test
    void jumpingToAnotherRoundClearsActedSet() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(5)).orElseThrow();
        CombatTracker.recordAction(c, 10L);
        c.lastPingAt = hoursAgo(1);

        tracker.advance(VAULTS, "Vaults", 4, CombatPhase.PLAYERS, NOW);
        assertEquals(4, c.round);
        assertTrue(c.actedUserIds.isEmpty());
        assertNull(c.lastPingAt);
    }

    @Test
    void advanceWithoutCombatCreatesItAtRequestedRound() {
        CombatState c = tracker.advance(KINGMAKER, "Kingmaker", 3, CombatPhase.ENEMIES, NOW);
        assertSame(c, combats.get(KINGMAKER));
        assertEquals(3, c.round);
        assertEquals(CombatPhase.ENEMIES, c.phase);
    }

    @Test
    void roundMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> tracker.advance(VAULTS, "Vaults", 0, CombatPhase.PLAYERS, NOW));
    }

    @Test
    void actionsOnlyCountDuringPlayersPhase() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), NOW).orElseThrow();
        tracker.next(VAULTS, NOW);
        assertFalse(CombatTracker.recordAction(c, 10L));
        assertTrue(c.actedUserIds.isEmpty());
    }

    @Test
    void allActedNeedsKnownPlayers() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), NOW).orElseThrow();
        assertFalse(CombatTracker.allActed(c, List.of()));

        PlayerRecord ann = player(VAULTS, 10L, "Ann", NOW);
        PlayerRecord bob = player(VAULTS, 11L, "Bob", NOW);
        CombatTracker.recordAction(c, 10L);
        assertFalse(CombatTracker.allActed(c, List.of(ann, bob)));
        assertEquals(List.of(bob), CombatTracker.missing(c, List.of(ann, bob)));

        CombatTracker.recordAction(c, 11L);
        assertTrue(CombatTracker.allActed(c, List.of(ann, bob)));
    }

    @Test
    void pingDueAfterThresholdAndNotAgainTooSoon() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(5)).orElseThrow();
        Duration after = Duration.ofHours(4);
        assertTrue(CombatTracker.pingDue(c, after, NOW));

        c.lastPingAt = hoursAgo(1);
        assertFalse(CombatTracker.pingDue(c, after, NOW));

        c.lastPingAt = null;
        assertFalse(CombatTracker.pingDue(c, after, hoursAgo(2)));
    }

    @Test
    void logAndEndProduceSummary() {
        tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(26));
        assertTrue(tracker.log(VAULTS, "Ann <crits> the goblin", hoursAgo(25)));
        assertFalse(tracker.log(VAULTS, "  ", NOW));
        assertFalse(tracker.log(KINGMAKER, "nothing running", NOW));

        Optional<CombatState> ended = tracker.end(VAULTS);
        assertTrue(ended.isPresent());
        assertFalse(combats.containsKey(VAULTS));

        String summary = CombatTracker.summary(ended.get(), NOW);
        assertTrue(summary.contains("after 1 round (1d 2h)"));
        assertTrue(summary.contains("R1: Ann &lt;crits&gt; the goblin"));
    }

    @Test
    void whosTurnListsActedAndWaiting() {
        CombatState c = tracker.start(VAULTS, "Vaults", List.of(), hoursAgo(3)).orElseThrow();
        CombatTracker.recordAction(c, 10L);
        String text = CombatTracker.whosTurn(c,
                List.of(player(VAULTS, 10L, "Ann", NOW), player(VAULTS, 11L, "Bob", NOW)), NOW);
        assertTrue(text.startsWith("⚔️ Round 1, Players' turn (3h so far)"));
        assertTrue(text.contains("Acted: Ann"));
        assertTrue(text.contains("Waiting on: Bob"));
    }
}
