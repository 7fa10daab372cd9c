package com.pbpreminder.bot.config;

import com.pbpreminder.bot.util.TimeUtil;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record CampaignDef(
        String name,
        long chatTopicId,
        List<Long> pbpTopicIds,
        String created,
        Set<String> disabledFeatures,
        Map<Long, String> characters,
        Set<Long> gmUserIds
) {

    public CampaignDef {
        if (pbpTopicIds == null || pbpTopicIds.isEmpty()) {
            throw new IllegalArgumentException("Campaign " + name + " has no pbp_topic_ids");
        }
        pbpTopicIds = List.copyOf(pbpTopicIds);
        disabledFeatures = disabledFeatures == null ? Set.of() : Set.copyOf(disabledFeatures);
        characters = characters == null ? Map.of() : Map.copyOf(characters);
        gmUserIds = gmUserIds == null ? Set.of() : Set.copyOf(gmUserIds);
    }

    public long canonicalId() {
        return pbpTopicIds.get(0);
    }

    public boolean enabled(Feature feature) {
        return !disabledFeatures.contains(feature.key());
    }

    public Optional<LocalDate> createdDate() {
        if (created == null || created.isBlank()) return Optional.empty();
        try {
            return Optional.of(TimeUtil.parseDate(created));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public Optional<String> characterOf(long userId) {
        return Optional.ofNullable(characters.get(userId));
    }
}
