package com.pbpreminder.bot.check;

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.pbpreminder.bot.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class BoonCatalog {
    private static final Logger log = LoggerFactory.getLogger(BoonCatalog.class);

    public static final int FLAVOUR_PICKS = 3;

    static final List<String> MECHANICAL = List.of(
            "+1 circumstance bonus on your next skill check.",
            "Recover 1d6 extra HP during your next rest.",
            "Your next critical failure on a skill check is a regular failure instead.",
            "Gain a +1 circumstance bonus to initiative in your next combat.",
            "+1 circumstance bonus to your next saving throw.",
            "Your next successful Strike deals 1 extra damage.",
            "Gain 1 temporary HP at the start of your next combat.",
            "Your next Recall Knowledge check gains a +2 circumstance bonus.",
            "+10 feet to your Speed for your first turn of your next combat.",
            "The DC of your next skill check is reduced by 1."
    );

    private static final String FALLBACK = "Something mildly beneficial happens to you today.";

    private final List<String> flavour;
    private final List<String> mechanical;

    public BoonCatalog(List<String> flavour, List<String> mechanical) {
        this.flavour = flavour.isEmpty() ? List.of(FALLBACK) : List.copyOf(flavour);
        this.mechanical = List.copyOf(mechanical);
    }

    public static BoonCatalog fromClasspath() {
        return new BoonCatalog(readResource("/boons.json"), MECHANICAL);
    }

    static List<String> readResource(String name) {
        try (InputStream in = BoonCatalog.class.getResourceAsStream(name)) {
            if (in == null) {
                log.warn("Boon list {} not found on classpath", name);
                return List.of();
            }
            try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                List<String> boons = JsonUtils.GSON.fromJson(r, new TypeToken<List<String>>() {}.getType());
                return boons == null ? List.of() : boons;
            }
        } catch (IOException | JsonParseException e) {
            log.warn("Could not load boons from {}: {}", name, e.getMessage());
            return List.of();
        }
    }

    public List<String> pick(Random random) {
        List<String> pool = new ArrayList<>(flavour);
        Collections.shuffle(pool, random);
        List<String> out = new ArrayList<>(pool.subList(0, Math.min(FLAVOUR_PICKS, pool.size())));
        if (!mechanical.isEmpty()) out.add(mechanical.get(random.nextInt(mechanical.size())));
        return out;
    }

    public List<String> flavour() {
        return flavour;
    }
}
