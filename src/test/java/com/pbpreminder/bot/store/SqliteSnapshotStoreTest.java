package com.pbpreminder.bot.store;

import com.pbpreminder.bot.combat.CombatTracker;
import com.pbpreminder.bot.db.Database;
import com.pbpreminder.bot.db.Schema;
import com.pbpreminder.bot.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static com.pbpreminder.bot.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SqliteSnapshotStoreTest {

    @TempDir
    Path dir;

    private Database db;
    private SqliteSnapshotStore store;

    @BeforeEach
    void setUp() throws Exception {
        db = new Database(dir.resolve("nested/state.db"));
        Schema.migrate(db);
        store = new SqliteSnapshotStore(db, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void emptyDatabaseGivesFreshSnapshot() {
        ActivitySnapshot s = store.load();
        assertEquals(0, s.offset);
        assertTrue(s.players.isEmpty());
        assertNotNull(s.ledger);
    }

    @Test
    void savedStateSurvivesReload() {
        ActivitySnapshot s = new ActivitySnapshot();
        s.offset = 1234;
        PlayerRecord p = player(VAULTS, 10L, "Ann", hoursAgo(3));
        p.lastWarnedWeek = 2;
        p.lastWarnedAt = daysAgo(1);
        s.putPlayer(p);
        s.appendTimestamp(p.key(), hoursAgo(3));
        s.incrementCount(p.key());
        s.markRemoved(PlayerKey.of(KINGMAKER, 11L), new RemovedPlayer());
        CombatState c = new CombatTracker(s.combat).start(VAULTS, "Vaults", List.of("Goblin"), hoursAgo(2)).orElseThrow();
        CombatTracker.recordAction(c, 10L);
        s.ledger.markFired(LedgerFamily.ROSTER, VAULTS, hoursAgo(5));
        s.ledger.recordCrossed(LedgerFamily.STREAK, VAULTS, 10L, 7);
        s.lastArchivedWeek = "2026-W06";
        s.putPostRun(p.key(), PostDayRun.of(LocalDate.of(2025, 12, 20), LocalDate.of(2026, 2, 11)));

        store.save(s);
        store.save(s);
        ActivitySnapshot back = store.load();

        assertEquals(1234, back.offset);
        PlayerRecord q = back.player(PlayerKey.of(VAULTS, 10L)).orElseThrow();
        assertEquals("Ann", q.firstName);
        assertEquals(2, q.lastWarnedWeek);
        assertEquals(daysAgo(1), q.lastWarnedAt);
        assertEquals(List.of(hoursAgo(3)), back.timestamps(PlayerKey.of(VAULTS, 10L)));
        assertEquals(1, back.messageCount(PlayerKey.of(VAULTS, 10L)));
        assertTrue(back.isRemoved(PlayerKey.of(KINGMAKER, 11L)));
        assertEquals(CombatPhase.PLAYERS, back.combat.get(VAULTS).phase);
        assertTrue(back.combat.get(VAULTS).actedUserIds.contains(10L));
        assertEquals(hoursAgo(5), back.ledger.lastFired(LedgerFamily.ROSTER, VAULTS));
        assertEquals(OptionalLong.of(7), back.ledger.highestCrossed(LedgerFamily.STREAK, VAULTS, 10L));
        assertEquals("2026-W06", back.lastArchivedWeek);
        assertEquals(LocalDate.of(2025, 12, 20), back.postRun(p.key()).orElseThrow().first());
    }

    @Test
    void olderDocumentsAreBackfilled() throws Exception {
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            st.execute("INSERT INTO snapshot(id, json, saved_at) VALUES(1, "
                    + "'{\"offset\": 5, \"topics\": null, \"ledger\": {\"lastFired\": null}}', 'x')");
        }
        ActivitySnapshot s = store.load();
        assertEquals(5, s.offset);
        assertNotNull(s.topics);
        assertNotNull(s.pendingAwards);
        assertTrue(s.postRuns.isEmpty());
        assertNull(s.ledger.lastFired(LedgerFamily.DIGEST, 0L));
    }

    @Test
    void corruptDocumentFailsLoudly() throws Exception {
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            st.execute("INSERT INTO snapshot(id, json, saved_at) VALUES(1, '{not json', 'x')");
        }
        assertThrows(IllegalStateException.class, store::load);
    }
}
