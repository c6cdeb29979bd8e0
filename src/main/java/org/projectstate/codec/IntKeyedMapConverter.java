package org.projectstate.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Function;

/**
 * Page-number keyed map. Portable form is an object with the page number as a
 * string key ({@code {"2": "rgb(250,250,250)"}}); the {@code [[2, "rgb(...)"]]} pair
 * list is accepted on restore as well. Keys that are not integers and values the
 * value reader rejects are dropped with a warning.
 */
public final class IntKeyedMapConverter<V> implements FieldConverter<Map<Integer, V>> {

    private static final Logger logger = LoggerFactory.getLogger(IntKeyedMapConverter.class);

    private final String field;
    private final Function<V, JsonElement> writer;
    private final Function<JsonElement, V> reader;

    /**
     * @param reader returns {@code null} for values it cannot read
     */
    public IntKeyedMapConverter(String field, Function<V, JsonElement> writer, Function<JsonElement, V> reader) {
        this.field = field;
        this.writer = writer;
        this.reader = reader;
    }

    public static IntKeyedMapConverter<String> ofStrings(String field) {
        return new IntKeyedMapConverter<>(field, JsonPrimitive::new,
                e -> e.isJsonPrimitive() ? e.getAsString() : null);
    }

    public static IntKeyedMapConverter<Boolean> ofBooleans(String field) {
        return new IntKeyedMapConverter<>(field, JsonPrimitive::new,
                e -> e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() ? e.getAsBoolean() : null);
    }

    @Override
    public JsonElement toPortable(Map<Integer, V> live) {
        JsonObject out = new JsonObject();
        if (live == null) return out;
        for (Entry<Integer, V> e : live.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            out.add(String.valueOf(e.getKey()), writer.apply(e.getValue()));
        }
        return out;
    }

    @Override
    public Map<Integer, V> fromPortable(JsonElement portable) {
        Map<Integer, V> out = new LinkedHashMap<>();
        if (portable == null || portable.isJsonNull()) return out;

        if (portable.isJsonObject()) {
            for (Entry<String, JsonElement> e : portable.getAsJsonObject().entrySet()) {
                put(out, parseKey(e.getKey()), e.getValue(), e.getKey());
            }
        } else if (portable.isJsonArray()) {
            for (JsonElement pair : portable.getAsJsonArray()) {
                if (!pair.isJsonArray() || pair.getAsJsonArray().size() != 2) {
                    logger.warn("{}: dropping entry that is not a [key, value] pair: {}", field, pair);
                    continue;
                }
                JsonArray kv = pair.getAsJsonArray();
                JsonElement k = kv.get(0);
                put(out, k.isJsonPrimitive() ? parseKey(k.getAsString()) : null, kv.get(1), k.toString());
            }
        } else {
            logger.warn("{}: expected an object or pair list, got {}", field, portable);
        }
        return out;
    }

    private void put(Map<Integer, V> out, Integer key, JsonElement raw, String rawKey) {
        if (key == null) {
            logger.warn("{}: dropping non-integer key '{}'", field, rawKey);
            return;
        }
        V value = raw == null || raw.isJsonNull() ? null : reader.apply(raw);
        if (value == null) {
            logger.warn("{}: dropping unreadable value for key {}", field, key);
            return;
        }
        out.put(key, value);
    }

    private static Integer parseKey(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
