package com.pbpreminder.bot.check;

import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.model.ActivitySnapshot;
import com.pbpreminder.bot.model.LedgerFamily;
import com.pbpreminder.bot.model.PlayerKey;
import com.pbpreminder.bot.model.TopicState;
import com.pbpreminder.bot.notify.NotificationSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.pbpreminder.bot.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TopicAlertCheckTest {

    private final TopicAlertCheck check = new TopicAlertCheck();
    private final CampaignConfig cfg = config();
    private NotificationSink sink;
    private ActivitySnapshot snap;

    @BeforeEach
    void setUp() {
        sink = mock(NotificationSink.class);
        snap = new ActivitySnapshot();
        TopicState t = new TopicState();
        t.lastMessageTime = hoursAgo(5);
        t.lastUser = "Ann";
        t.lastUserId = 10L;
        snap.topics.put(VAULTS, t);
        snap.incrementCount(PlayerKey.of(VAULTS, 10L));
        snap.incrementCount(PlayerKey.of(VAULTS, 10L));
    }

    @Test
    void failedSendIsRetriedAndSuccessIsDebounced() {
        when(sink.send(anyLong(), anyLong(), anyString())).thenReturn(false);
        check.run(context(snap, cfg, NOW, sink));
        assertNull(snap.ledger.lastFired(LedgerFamily.TOPIC_ALERT, VAULTS));

        when(sink.send(anyLong(), anyLong(), anyString())).thenReturn(true);
        check.run(context(snap, cfg, NOW.plusSeconds(600), sink));
        assertEquals(NOW.plusSeconds(600), snap.ledger.lastFired(LedgerFamily.TOPIC_ALERT, VAULTS));

        check.run(context(snap, cfg, NOW.plus(Duration.ofHours(2)), sink));
        verify(sink, times(2)).send(anyLong(), anyLong(), anyString());
    }

    @Test
    void alertNamesLastPosterAndCount() {
        when(sink.send(anyLong(), anyLong(), anyString())).thenReturn(true);
        check.run(context(snap, cfg, NOW, sink));
        verify(sink).send(GROUP, VAULTS_CHAT,
                "No new posts in <b>Vaults</b> PBP for 5h.\nLast post was from Ann (2 total posts) on 2026-02-11.");
    }

    @Test
    void recentActivityDoesNotAlert() {
        snap.topics.get(VAULTS).lastMessageTime = hoursAgo(1);
        check.run(context(snap, cfg, NOW, sink));
        verifyNoInteractions(sink);
    }
}
