package com.pbpreminder.bot.service;

import com.pbpreminder.bot.activity.ActivityMetrics;
import com.pbpreminder.bot.check.AwardMessages;
import com.pbpreminder.bot.combat.CombatTracker;
import com.pbpreminder.bot.config.CampaignConfig;
import com.pbpreminder.bot.config.Feature;
import com.pbpreminder.bot.config.Settings;
import com.pbpreminder.bot.config.TopicMaps;
import com.pbpreminder.bot.model.*;
import com.pbpreminder.bot.notify.NotificationSink;
import com.pbpreminder.bot.telegram.CallbackData;
import com.pbpreminder.bot.telegram.ChatEvent;
import com.pbpreminder.bot.telegram.ChoiceTap;
import com.pbpreminder.bot.telegram.InboundUpdate;
import com.pbpreminder.bot.util.Html;
import com.pbpreminder.bot.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public final class EventProcessor {
    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    static final String HELP_TEXT = "<b>PBP Reminder Bot</b>\n"
            + "\n"
            + "I track activity across PBP campaigns and post automated summaries.\n"
            + "\n"
            + "What I do:\n"
            + "- Alert when a campaign goes quiet\n"
            + "- Warn inactive players weekly, then stop tracking them\n"
            + "- Post party rosters every few days\n"
            + "- Award Player of the Week (most consistent poster)\n"
            + "- Weekly pace reports, digest and cross-campaign leaderboard\n"
            + "- Celebrate posting streaks, message milestones and anniversaries\n"
            + "- Ping players who haven't acted during combat\n"
            + "- Recruitment notices when a party is under capacity\n"
            + "\n"
            + "GM commands:\n"
            + "/combat [enemy, enemy...] - Start combat at round 1\n"
            + "/round &lt;N&gt; players - Start round N, players' turn\n"
            + "/round &lt;N&gt; enemies - Start round N, enemies' turn\n"
            + "/next - Advance to the next phase\n"
            + "/clog &lt;text&gt; - Add a line to the combat log\n"
            + "/endcombat - End combat tracking\n"
            + "\n"
            + "Everyone:\n"
            + "/whosturn - Who still has to act\n"
            + "/help - Show this message\n"
            + "/status - Campaign health snapshot";

    private final CampaignConfig cfg;
    private final TopicMaps maps;
    private final NotificationSink sink;

    public EventProcessor(CampaignConfig cfg, TopicMaps maps, NotificationSink sink) {
        this.cfg = cfg;
        this.maps = maps;
        this.sink = sink;
    }

    /**
     * Applies the updates in order. The offset moves past each update before it is applied, so an
     * update that fails is logged and never fetched again.
     *
     * @return the new offset
     */
    public long process(ActivitySnapshot snapshot, List<InboundUpdate> updates, Instant now) {
        for (InboundUpdate u : updates) {
            snapshot.offset = Math.max(snapshot.offset, u.updateId() + 1);
            try {
                if (u.choiceTap().isPresent()) {
                    onChoice(snapshot, u.choiceTap().get());
                } else if (u.chatEvent().isPresent()) {
                    onMessage(snapshot, u.chatEvent().get(), now);
                }
            } catch (RuntimeException e) {
                log.error("Update {} failed, skipping it", u.updateId(), e);
            }
        }
        return snapshot.offset;
    }

    void onMessage(ActivitySnapshot snap, ChatEvent e, Instant now) {
        if (e.chatId() != cfg.groupId()) {
            log.debug("Skipping message from foreign chat {}", e.chatId());
            return;
        }
        if (e.threadId() == null) return;
        Optional<Long> canonical = maps.canonicalOf(e.threadId());
        if (canonical.isEmpty()) return;
        if (e.fromBot()) return;

        long cid = canonical.get();
        long threadId = e.threadId();
        String name = maps.nameOf(cid);
        Instant at = e.sentAt() == null ? now : e.sentAt();
        boolean gm = cfg.isGm(cid, e.senderId());
        String text = e.text() == null ? "" : e.text().trim();
        String command = command(text);

        if (command.equals("/help") || command.equals("/pbphelp")) {
            sink.send(cfg.groupId(), threadId, HELP_TEXT);
        } else if (command.equals("/status")) {
            sink.send(cfg.groupId(), threadId, status(snap, cid, now));
        }
        if (cfg.featureEnabled(cid, Feature.COMBAT)) {
            handleCombatCommand(snap, cid, name, threadId, command, text, gm, now);
        }

        TopicState topic = new TopicState();
        topic.lastMessageTime = at;
        topic.lastUser = e.firstName() == null || e.firstName().isBlank() ? "Someone" : e.firstName();
        topic.lastUserId = e.senderId();
        topic.campaignName = name;
        snap.topics.put(cid, topic);

        PlayerKey key = PlayerKey.of(cid, e.senderId());
        snap.incrementCount(key);
        snap.appendTimestamp(key, at);
        ActivityMetrics.latestRun(snap.timestamps(key), snap.postRun(key).orElse(null), cfg.settings().zone())
                .ifPresent(run -> snap.putPostRun(key, run));

        if (!gm) {
            upsertPlayer(snap, key, e, name, at);
            trackCombatAction(snap, cid, e.senderId(), threadId);
        }
        log.debug("Tracked message in {} from {}", name, e.firstName());
    }

    private void upsertPlayer(ActivitySnapshot snap, PlayerKey key, ChatEvent e, String campaign, Instant at) {
        PlayerRecord p = snap.player(key).orElseGet(PlayerRecord::new);
        p.userId = key.userId();
        p.campaignId = key.campaignId();
        p.campaignName = campaign;
        p.firstName = e.firstName();
        p.lastName = e.lastName();
        p.username = e.username();
        if (p.lastPostTime == null || at.isAfter(p.lastPostTime)) p.lastPostTime = at;
        p.lastWarnedWeek = 0;
        p.lastWarnedAt = null;
        snap.putPlayer(p);

        if (snap.isRemoved(key)) {
            snap.unmarkRemoved(key);
            log.info("Player {} rejoined {}", p.fullName(), campaign);
        }
    }

    private void trackCombatAction(ActivitySnapshot snap, long cid, long userId, long threadId) {
        CombatState c = snap.combat.get(cid);
        if (c == null || !c.active) return;
        if (!CombatTracker.recordAction(c, userId)) return;
        if (c.allActedNotified || !CombatTracker.allActed(c, snap.playersIn(cid))) return;
        if (sink.send(cfg.groupId(), threadId, CombatTracker.allActedMessage(c))) {
            c.allActedNotified = true;
        }
    }

    private void handleCombatCommand(ActivitySnapshot snap, long cid, String name, long threadId,
                                     String command, String text, boolean gm, Instant now) {
        if (command.isEmpty()) return;
        CombatTracker tracker = new CombatTracker(snap.combat);
        int space = text.indexOf(' ');
        String args = space < 0 ? "" : text.substring(space + 1).trim();

        if (command.equals("/whosturn")) {
            String reply = tracker.get(cid)
                    .map(c -> CombatTracker.whosTurn(c, snap.playersIn(cid), now))
                    .orElse("No combat running in " + Html.esc(name) + ".");
            sink.send(cfg.groupId(), threadId, reply);
            return;
        }
        if (!gm) return;

        switch (command) {
            case "/combat":
                if (args.equalsIgnoreCase("end")) {
                    endCombat(tracker, cid, name, threadId, now);
                    return;
                }
                Optional<CombatState> started = tracker.start(cid, name, enemies(args), now);
                if (started.isPresent()) {
                    log.info("Combat started in {}", name);
                    sink.send(cfg.groupId(), threadId, CombatTracker.startMessage(started.get()));
                } else {
                    tracker.get(cid).ifPresent(c -> sink.send(cfg.groupId(), threadId,
                            "Combat is already running. " + CombatTracker.phaseMessage(c)));
                }
                break;
            case "/round":
                parseRound(args).ifPresent(r -> {
                    CombatState c = tracker.advance(cid, name, r.round(), r.phase(), now);
                    log.info("Combat in {}: Round {}, {}", name, c.round, c.phase.label);
                    sink.send(cfg.groupId(), threadId, CombatTracker.phaseMessage(c));
                });
                break;
            case "/next":
                tracker.next(cid, now).ifPresent(c -> sink.send(cfg.groupId(), threadId, CombatTracker.phaseMessage(c)));
                break;
            case "/clog":
                tracker.log(cid, args, now);
                break;
            case "/endcombat":
                endCombat(tracker, cid, name, threadId, now);
                break;
            default:
                break;
        }
    }

    private void endCombat(CombatTracker tracker, long cid, String name, long threadId, Instant now) {
        tracker.end(cid).ifPresent(c -> {
            log.info("Combat ended in {}", name);
            sink.send(cfg.groupId(), threadId, CombatTracker.summary(c, now));
        });
    }

    void onChoice(ActivitySnapshot snap, ChoiceTap tap) {
        Optional<CallbackData.AwardChoice> choice = CallbackData.parseAward(tap.data());
        if (choice.isEmpty()) {
            sink.acknowledge(tap.callbackId(), "Invalid choice.");
            return;
        }
        long cid = choice.get().campaignId();
        int idx = choice.get().optionIndex();
        PendingAward pending = snap.pendingAwards.get(cid);
        if (pending == null) {
            sink.acknowledge(tap.callbackId(), "This choice has expired.");
            return;
        }
        if (tap.senderId() != pending.winnerUserId) {
            sink.acknowledge(tap.callbackId(), "Only the Player of the Week can choose!");
            return;
        }
        if (idx < 0 || idx >= pending.options.size()) {
            sink.acknowledge(tap.callbackId(), "Invalid choice.");
            return;
        }

        String text = AwardMessages.result(pending.options, idx, pending.baseMessage, AwardMessages.CHOSEN);
        if (sink.edit(tap.chatId(), tap.messageId(), text)) {
            snap.pendingAwards.remove(cid);
            sink.acknowledge(tap.callbackId(), "You chose boon #" + (idx + 1) + "!");
            log.info("Boon chosen for campaign {}: #{}", cid, idx + 1);
        } else {
            sink.acknowledge(tap.callbackId(), "Could not save your choice, please try again.");
        }
    }

    String status(ActivitySnapshot snap, long cid, Instant now) {
        Settings s = cfg.settings();
        List<PlayerRecord> players = snap.playersIn(cid);
        Set<Long> gmIds = cfg.gmIdsFor(cid);

        TopicState topic = snap.topics.get(cid);
        String last;
        if (topic == null || topic.lastMessageTime == null) {
            last = "no posts tracked yet";
        } else {
            double h = TimeUtil.hoursSince(now, topic.lastMessageTime);
            last = h < 1 ? "just now" : TimeUtil.fmtElapsed(h) + " ago";
        }

        Instant weekAgo = now.minus(Duration.ofDays(7));
        int gmWeek = 0, playerWeek = 0;
        for (Map.Entry<Long, List<Instant>> e : snap.timestamps(cid).entrySet()) {
            int n = ActivityMetrics.sessionsIn(e.getValue(), weekAgo, null, s.burstWindow()).size();
            if (gmIds.contains(e.getKey())) gmWeek += n;
            else playerWeek += n;
        }

        List<String> atRisk = new ArrayList<>();
        for (PlayerRecord p : players) {
            if (p.lastPostTime == null) continue;
            int days = (int) TimeUtil.daysSince(now, p.lastPostTime);
            if (days >= 7) atRisk.add(Html.esc(p.firstName) + " (" + days + "d)");
        }

        StringBuilder sb = new StringBuilder("<b>Status for ").append(Html.esc(maps.nameOf(cid))).append(":</b>\n")
                .append("Party: ").append(players.size()).append("/").append(s.requiredPlayers()).append("\n")
                .append("Last post: ").append(last).append("\n")
                .append("This week: ").append(playerWeek).append(" player + ").append(gmWeek).append(" GM posts");
        if (!atRisk.isEmpty()) sb.append("\nAt risk: ").append(String.join(", ", atRisk));
        CombatState c = snap.combat.get(cid);
        if (c != null && c.active) {
            sb.append("\nCombat: Round ").append(c.round).append(", ").append(c.phase.label).append("' turn");
        }
        return sb.toString();
    }

    // Lower-cased first token without any @botname suffix; empty if not a command.
    static String command(String text) {
        if (!text.startsWith("/")) return "";
        int space = text.indexOf(' ');
        String head = space < 0 ? text : text.substring(0, space);
        int at = head.indexOf('@');
        if (at > 0) head = head.substring(0, at);
        return head.toLowerCase(Locale.ROOT);
    }

    static List<String> enemies(String args) {
        List<String> out = new ArrayList<>();
        if (args.isBlank()) return out;
        for (String part : args.split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    static Optional<RoundTarget> parseRound(String args) {
        String[] parts = args.trim().split("\\s+");
        if (parts.length < 2) return Optional.empty();
        int round;
        try {
            round = Integer.parseInt(parts[0]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (round < 1) return Optional.empty();
        return CombatPhase.parse(parts[1]).map(phase -> new RoundTarget(round, phase));
    }

    record RoundTarget(int round, CombatPhase phase) {}
}
