package com.pbpreminder.bot.model;

import java.time.Instant;
import java.util.*;

/**
 * Everything the bot remembers between runs. Loaded once, mutated by the event processor and the
 * checks, saved once. Fields missing from an older document keep the defaults below.
 */
public final class ActivitySnapshot {

    public long offset;

    public Map<Long, TopicState> topics = new HashMap<>();

    // campaignId -> userId -> record
    public Map<Long, Map<Long, PlayerRecord>> players = new HashMap<>();
    public Map<Long, Map<Long, RemovedPlayer>> removedPlayers = new HashMap<>();
    public Map<Long, Map<Long, Long>> messageCounts = new HashMap<>();
    public Map<Long, Map<Long, List<Instant>>> postTimestamps = new HashMap<>();
    public Map<Long, Map<Long, PostDayRun>> postRuns = new HashMap<>();

    public Map<Long, CombatState> combat = new HashMap<>();
    public Map<Long, PendingAward> pendingAwards = new HashMap<>();

    public DebounceLedger ledger = new DebounceLedger();
    public String lastArchivedWeek;

    public ActivitySnapshot backfill() {
        if (topics == null) topics = new HashMap<>();
        if (players == null) players = new HashMap<>();
        if (removedPlayers == null) removedPlayers = new HashMap<>();
        if (messageCounts == null) messageCounts = new HashMap<>();
        if (postTimestamps == null) postTimestamps = new HashMap<>();
        if (postRuns == null) postRuns = new HashMap<>();
        if (combat == null) combat = new HashMap<>();
        if (pendingAwards == null) pendingAwards = new HashMap<>();
        if (ledger == null) ledger = new DebounceLedger();
        ledger.backfill();
        for (CombatState c : combat.values()) c.backfill();
        return this;
    }

    // --- players ---

    public Optional<PlayerRecord> player(PlayerKey key) {
        Map<Long, PlayerRecord> m = players.get(key.campaignId());
        return Optional.ofNullable(m == null ? null : m.get(key.userId()));
    }

    public void putPlayer(PlayerRecord p) {
        players.computeIfAbsent(p.campaignId, k -> new LinkedHashMap<>()).put(p.userId, p);
    }

    public Optional<PlayerRecord> removePlayer(PlayerKey key) {
        Map<Long, PlayerRecord> m = players.get(key.campaignId());
        if (m == null) return Optional.empty();
        PlayerRecord removed = m.remove(key.userId());
        if (m.isEmpty()) players.remove(key.campaignId());
        return Optional.ofNullable(removed);
    }

    public List<PlayerRecord> playersIn(long campaignId) {
        Map<Long, PlayerRecord> m = players.get(campaignId);
        return m == null ? List.of() : new ArrayList<>(m.values());
    }

    public List<PlayerRecord> allPlayers() {
        List<PlayerRecord> out = new ArrayList<>();
        for (Map<Long, PlayerRecord> m : players.values()) out.addAll(m.values());
        return out;
    }

    public boolean isRemoved(PlayerKey key) {
        Map<Long, RemovedPlayer> m = removedPlayers.get(key.campaignId());
        return m != null && m.containsKey(key.userId());
    }

    public void markRemoved(PlayerKey key, RemovedPlayer r) {
        removedPlayers.computeIfAbsent(key.campaignId(), k -> new HashMap<>()).put(key.userId(), r);
    }

    public void unmarkRemoved(PlayerKey key) {
        Map<Long, RemovedPlayer> m = removedPlayers.get(key.campaignId());
        if (m == null) return;
        m.remove(key.userId());
        if (m.isEmpty()) removedPlayers.remove(key.campaignId());
    }

    // --- counters and timestamps ---

    public long messageCount(PlayerKey key) {
        Map<Long, Long> m = messageCounts.get(key.campaignId());
        return m == null ? 0L : m.getOrDefault(key.userId(), 0L);
    }

    public Map<Long, Long> messageCounts(long campaignId) {
        return messageCounts.getOrDefault(campaignId, Map.of());
    }

    public void incrementCount(PlayerKey key) {
        messageCounts.computeIfAbsent(key.campaignId(), k -> new HashMap<>())
                .merge(key.userId(), 1L, Long::sum);
    }

    public Map<Long, List<Instant>> timestamps(long campaignId) {
        return postTimestamps.getOrDefault(campaignId, Map.of());
    }

    public List<Instant> timestamps(PlayerKey key) {
        return timestamps(key.campaignId()).getOrDefault(key.userId(), List.of());
    }

    public void appendTimestamp(PlayerKey key, Instant t) {
        List<Instant> list = postTimestamps.computeIfAbsent(key.campaignId(), k -> new HashMap<>())
                .computeIfAbsent(key.userId(), k -> new ArrayList<>());
        if (list.isEmpty() || !t.isBefore(list.get(list.size() - 1))) {
            list.add(t);
        } else {
            int idx = Collections.binarySearch(list, t);
            list.add(idx < 0 ? -idx - 1 : idx, t);
        }
    }

    public Optional<PostDayRun> postRun(PlayerKey key) {
        Map<Long, PostDayRun> m = postRuns.get(key.campaignId());
        return Optional.ofNullable(m == null ? null : m.get(key.userId()));
    }

    public void putPostRun(PlayerKey key, PostDayRun run) {
        postRuns.computeIfAbsent(key.campaignId(), k -> new HashMap<>()).put(key.userId(), run);
    }

    public void pruneTimestamps(Instant cutoff) {
        Iterator<Map.Entry<Long, Map<Long, List<Instant>>>> campaigns = postTimestamps.entrySet().iterator();
        while (campaigns.hasNext()) {
            Map<Long, List<Instant>> users = campaigns.next().getValue();
            Iterator<Map.Entry<Long, List<Instant>>> it = users.entrySet().iterator();
            while (it.hasNext()) {
                List<Instant> series = it.next().getValue();
                series.removeIf(t -> t.isBefore(cutoff));
                if (series.isEmpty()) it.remove();
            }
            if (users.isEmpty()) campaigns.remove();
        }
    }
}
