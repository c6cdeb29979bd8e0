package org.projectstate.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Set of page numbers, stored as a JSON array. Restore accepts an array or an
 * array-like object whose keys are all integers ({@code {"0": 4, "1": 7}}, which is
 * also what an empty set degrades to: {@code {}}). Any other shape restores as an
 * empty set. Duplicates collapse.
 */
public final class IntSetConverter implements FieldConverter<Set<Integer>> {

    private static final Logger logger = LoggerFactory.getLogger(IntSetConverter.class);

    private final String field;

    public IntSetConverter(String field) {
        this.field = field;
    }

    @Override
    public JsonElement toPortable(Set<Integer> live) {
        JsonArray out = new JsonArray();
        if (live == null) return out;
        for (Integer page : live) {
            if (page != null) out.add(page);
        }
        return out;
    }

    @Override
    public Set<Integer> fromPortable(JsonElement portable) {
        Set<Integer> out = new LinkedHashSet<>();
        if (portable == null || portable.isJsonNull()) return out;

        if (portable.isJsonArray()) {
            addAll(out, portable.getAsJsonArray());
        } else if (portable.isJsonObject() && hasOnlyIntegerKeys(portable.getAsJsonObject())) {
            JsonArray values = new JsonArray();
            portable.getAsJsonObject().entrySet().forEach(e -> values.add(e.getValue()));
            addAll(out, values);
        } else {
            logger.warn("{}: unexpected shape {}, restoring empty set", field, portable);
        }
        return out;
    }

    private void addAll(Set<Integer> out, JsonArray values) {
        for (JsonElement e : values) {
            Integer page = asInt(e);
            if (page == null) {
                logger.warn("{}: dropping non-integer element {}", field, e);
            } else {
                out.add(page);
            }
        }
    }

    private static boolean hasOnlyIntegerKeys(JsonObject obj) {
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            if (!e.getKey().matches("\\d+")) return false;
        }
        return true;
    }

    private static Integer asInt(JsonElement e) {
        if (e == null || !e.isJsonPrimitive()) return null;
        try {
            double d = Double.parseDouble(e.getAsString().trim());
            if (d != Math.rint(d) || Double.isInfinite(d)) return null;
            return (int) d;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
