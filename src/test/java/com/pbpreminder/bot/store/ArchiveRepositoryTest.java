package com.pbpreminder.bot.store;

import com.pbpreminder.bot.db.Database;
import com.pbpreminder.bot.db.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.pbpreminder.bot.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ArchiveRepositoryTest {

    @TempDir
    Path dir;

    private ArchiveRepository repo;

    @BeforeEach
    void setUp() throws Exception {
        Database db = new Database(dir.resolve("archive.db"));
        Schema.migrate(db);
        repo = new ArchiveRepository(db);
    }

    @Test
    void rowsRoundTripAndReplace() {
        Map<String, Integer> top = new LinkedHashMap<>();
        top.put("Ann (@ann)", 5);
        top.put("Bob", 2);
        repo.saveWeek(List.of(
                new WeeklyArchiveRow(VAULTS, "2026-W06", "Vaults", 3, 7, OptionalDouble.of(12.5), 2, top),
                new WeeklyArchiveRow(KINGMAKER, "2026-W06", "Kingmaker", 0, 0, OptionalDouble.empty(), 0, Map.of())
        ), NOW);

        List<WeeklyArchiveRow> week = repo.listWeek("2026-W06");
        assertThat(week).hasSize(2);
        WeeklyArchiveRow vaults = week.get(0);
        assertThat(vaults.campaignId()).isEqualTo(VAULTS);
        assertThat(vaults.totalPosts()).isEqualTo(10);
        assertThat(vaults.playerAvgGapHours()).hasValue(12.5);
        assertThat(vaults.topPlayers()).containsExactly(Map.entry("Ann (@ann)", 5), Map.entry("Bob", 2));
        assertThat(week.get(1).playerAvgGapHours()).isEmpty();

        repo.saveWeek(List.of(
                new WeeklyArchiveRow(VAULTS, "2026-W06", "Vaults", 4, 7, OptionalDouble.of(10.0), 2, top)), NOW);
        assertThat(repo.listWeek("2026-W06")).hasSize(2);
        assertThat(repo.listWeek("2026-W06").get(0).gmPosts()).isEqualTo(4);
    }

    @Test
    void unknownWeekIsEmpty() {
        assertThat(repo.listWeek("1999-W01")).isEmpty();
    }
}
