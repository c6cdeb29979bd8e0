package org.projectstate.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.ToNumberPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared Gson instances and tolerant field readers for untrusted JSON trees.
 * Readers never throw: a missing or wrongly typed field yields the default.
 */
public final class Json {

    public static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    public static final Gson PRETTY = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private Json() {}

    public static JsonObject object(JsonObject parent, String name) {
        JsonElement e = parent == null ? null : parent.get(name);
        return (e != null && e.isJsonObject()) ? e.getAsJsonObject() : null;
    }

    public static JsonArray array(JsonObject parent, String name) {
        JsonElement e = parent == null ? null : parent.get(name);
        return (e != null && e.isJsonArray()) ? e.getAsJsonArray() : null;
    }

    public static String string(JsonObject parent, String name, String def) {
        JsonElement e = parent == null ? null : parent.get(name);
        if (e == null || !e.isJsonPrimitive()) return def;
        return e.getAsString();
    }

    public static int integer(JsonObject parent, String name, int def) {
        JsonPrimitive p = number(parent, name);
        return p == null ? def : p.getAsInt();
    }

    public static long longValue(JsonObject parent, String name, long def) {
        JsonPrimitive p = number(parent, name);
        return p == null ? def : p.getAsLong();
    }

    public static double decimal(JsonObject parent, String name, double def) {
        JsonPrimitive p = number(parent, name);
        return p == null ? def : p.getAsDouble();
    }

    public static boolean bool(JsonObject parent, String name, boolean def) {
        JsonElement e = parent == null ? null : parent.get(name);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) return def;
        return e.getAsBoolean();
    }

    /** String elements of an array field; other element types are skipped. Never null. */
    public static List<String> strings(JsonObject parent, String name) {
        List<String> out = new ArrayList<>();
        JsonArray arr = array(parent, name);
        if (arr == null) return out;
        for (JsonElement e : arr) {
            if (e.isJsonPrimitive() && e.getAsJsonPrimitive().isString()) {
                out.add(e.getAsString());
            }
        }
        return out;
    }

    public static JsonArray toArray(List<String> values) {
        JsonArray arr = new JsonArray();
        if (values != null) values.forEach(arr::add);
        return arr;
    }

    private static JsonPrimitive number(JsonObject parent, String name) {
        JsonElement e = parent == null ? null : parent.get(name);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) return null;
        return e.getAsJsonPrimitive();
    }
}
