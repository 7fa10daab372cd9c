package com.pbpreminder.bot.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class JsonUtils {
    private JsonUtils() {}

    public static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .setPrettyPrinting()
            .create();

    public static JsonObject parseObj(String s) {
        if (s == null || s.isBlank()) return new JsonObject();
        return GSON.fromJson(s, JsonObject.class);
    }

    public static int getInt(JsonObject o, String key, int def) {
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || e.isJsonNull()) return def;
        return e.getAsInt();
    }

    public static double getDouble(JsonObject o, String key, double def) {
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || e.isJsonNull()) return def;
        return e.getAsDouble();
    }

    public static String getString(JsonObject o, String key, String def) {
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || e.isJsonNull()) return def;
        return e.getAsString();
    }

    public static Long getLong(JsonObject o, String key) {
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || e.isJsonNull()) return null;
        return e.getAsLong();
    }

    public static List<Integer> getIntList(JsonObject o, String key, List<Integer> def) {
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || !e.isJsonArray()) return def;
        List<Integer> out = new ArrayList<>();
        for (JsonElement x : e.getAsJsonArray()) out.add(x.getAsInt());
        return out;
    }

    public static List<Long> getLongList(JsonObject o, String key) {
        List<Long> out = new ArrayList<>();
        JsonElement e = o == null ? null : o.get(key);
        if (e == null || !e.isJsonArray()) return out;
        for (JsonElement x : e.getAsJsonArray()) out.add(x.getAsLong());
        return out;
    }

    static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Instant.parse(in.nextString());
        }
    }
}
