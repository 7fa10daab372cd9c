package com.pbpreminder.bot.check;

import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.store.ArchiveRepository;
import com.pbpreminder.bot.store.WeeklyArchiveRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.pbpreminder.bot.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WeeklyArchiveCheckTest {

    private ArchiveRepository archive;
    private ActivitySnapshot snap;

    @BeforeEach
    void setUp() {
        archive = mock(ArchiveRepository.class);
        snap = new ActivitySnapshot();
        snap.putPlayer(player(VAULTS, 10L, "Ann", NOW));
        // previous ISO week is Mon 2026-02-02 .. Sun 2026-02-08
        Instant monday = Instant.parse("2026-02-02T09:00:00Z");
        for (int i = 0; i < 3; i++) snap.appendTimestamp(PlayerKey.of(VAULTS, 10L), monday.plus(Duration.ofDays(i)));
        snap.appendTimestamp(PlayerKey.of(VAULTS, GM), monday.plus(Duration.ofHours(1)));
        snap.appendTimestamp(PlayerKey.of(VAULTS, 10L), NOW);
    }

    @SuppressWarnings("unchecked")
    @Test
    void archivesPreviousWeekOnce() {
        WeeklyArchiveCheck check = new WeeklyArchiveCheck(archive);
        NotificationSink sink = mock(NotificationSink.class);

        check.run(context(snap, config(), NOW, sink));
        check.run(context(snap, config(), NOW.plus(Duration.ofDays(1)), sink));

        ArgumentCaptor<List<WeeklyArchiveRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(archive, times(1)).saveWeek(rows.capture(), eq(NOW));
        assertThat(snap.lastArchivedWeek).isEqualTo("2026-W06");

        WeeklyArchiveRow vaults = rows.getValue().get(0);
        assertThat(vaults.week()).isEqualTo("2026-W06");
        assertThat(vaults.gmPosts()).isEqualTo(1);
        assertThat(vaults.playerPosts()).isEqualTo(3);
        assertThat(vaults.playerAvgGapHours()).hasValue(24.0);
        assertThat(vaults.topPlayers()).containsEntry("Ann (@ann)", 3);
        assertThat(rows.getValue().get(1).totalPosts()).isZero();
        verifyNoInteractions(sink);
    }

    @Test
    void weekAlreadyInArchiveIsNotOverwritten() {
        WeeklyArchiveRow existing = new WeeklyArchiveRow(VAULTS, "2026-W06", "Vaults", 2, 9,
                OptionalDouble.of(20.0), 3, Map.of("Ann (@ann)", 9));
        when(archive.listWeek("2026-W06")).thenReturn(List.of(existing));

        new WeeklyArchiveCheck(archive).run(context(snap, config(), NOW, mock(NotificationSink.class)));

        verify(archive, never()).saveWeek(anyList(), any());
        assertThat(snap.lastArchivedWeek).isEqualTo("2026-W06");
    }

    @Test
    void failedArchiveIsRetried() {
        doThrow(new IllegalStateException("disk full")).doNothing().when(archive).saveWeek(anyList(), any());
        WeeklyArchiveCheck check = new WeeklyArchiveCheck(archive);

        assertThrows(IllegalStateException.class,
                () -> check.run(context(snap, config(), NOW, mock(NotificationSink.class))));
        assertThat(snap.lastArchivedWeek).isNull();
        check.run(context(snap, config(), NOW, mock(NotificationSink.class)));
        assertThat(snap.lastArchivedWeek).isEqualTo("2026-W06");
        verify(archive, times(2)).saveWeek(anyList(), any());
    }
}
