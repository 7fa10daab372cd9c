package com.pbpreminder.bot.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class TopicMaps {

    private final Map<Long, Long> toCanonical;
    private final Map<Long, Long> toChat;
    private final Map<Long, String> toName;

    private TopicMaps(Map<Long, Long> toCanonical, Map<Long, Long> toChat, Map<Long, String> toName) {
        this.toCanonical = Collections.unmodifiableMap(toCanonical);
        this.toChat = Collections.unmodifiableMap(toChat);
        this.toName = Collections.unmodifiableMap(toName);
    }

    public static TopicMaps build(CampaignConfig cfg) {
        Map<Long, Long> toCanonical = new LinkedHashMap<>();
        Map<Long, Long> toChat = new LinkedHashMap<>();
        Map<Long, String> toName = new LinkedHashMap<>();
        for (CampaignDef c : cfg.campaigns()) {
            long canonical = c.canonicalId();
            toChat.put(canonical, c.chatTopicId());
            toName.put(canonical, c.name());
            for (Long tid : c.pbpTopicIds()) {
                toCanonical.put(tid, canonical);
            }
        }
        return new TopicMaps(toCanonical, toChat, toName);
    }

    public Optional<Long> canonicalOf(long threadId) {
        return Optional.ofNullable(toCanonical.get(threadId));
    }

    public Map<Long, Long> chatTopics() {
        return toChat;
    }

    public String nameOf(long canonicalId) {
        return toName.getOrDefault(canonicalId, "Unknown");
    }

    public Map<Long, String> names() {
        return toName;
    }
}
