package org.projectstate.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Converts an arbitrary object graph into a JSON tree without ever throwing.
 * <p>
 * Plain data (maps, collections, arrays, records, enums, strings, numbers, booleans,
 * temporal values and Gson trees) is copied. Everything else, such as lambdas, threads,
 * streams and framework handles, is replaced by {@link #UNSERIALIZABLE}, and so is a
 * reference back to a container that is still being walked.
 */
public final class SafeSerializer {

    public static final String UNSERIALIZABLE = "[Unserializable]";

    private static final Logger logger = LoggerFactory.getLogger(SafeSerializer.class);

    public JsonElement toTree(Object value) {
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        return walk(value, "$", path);
    }

    private JsonElement walk(Object value, String where, Set<Object> path) {
        if (value == null) return JsonNull.INSTANCE;
        if (value instanceof JsonElement json) return json.deepCopy();
        if (value instanceof CharSequence || value instanceof Character) {
            return new JsonPrimitive(value.toString());
        }
        if (value instanceof Boolean b) return new JsonPrimitive(b);
        if (value instanceof Number n) return number(n, where);
        if (value instanceof Enum<?> e) return new JsonPrimitive(e.name());
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return new JsonPrimitive(value.toString());
        }
        if (value instanceof Optional<?> opt) {
            return opt.isPresent() ? walk(opt.get(), where, path) : JsonNull.INSTANCE;
        }

        boolean container = value instanceof Map || value instanceof Iterable
                || value.getClass().isArray() || value.getClass().isRecord();
        if (!container) {
            return placeholder(where, value.getClass().getName());
        }
        if (!path.add(value)) {
            return placeholder(where, "circular reference");
        }
        try {
            if (value instanceof Map<?, ?> map) {
                JsonObject out = new JsonObject();
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    String key = String.valueOf(e.getKey());
                    out.add(key, walk(e.getValue(), where + "." + key, path));
                }
                return out;
            }
            if (value instanceof Iterable<?> items) {
                JsonArray out = new JsonArray();
                int i = 0;
                for (Object item : items) {
                    out.add(walk(item, where + "[" + i++ + "]", path));
                }
                return out;
            }
            if (value.getClass().isArray()) {
                JsonArray out = new JsonArray();
                int len = Array.getLength(value);
                for (int i = 0; i < len; i++) {
                    out.add(walk(Array.get(value, i), where + "[" + i + "]", path));
                }
                return out;
            }
            return record(value, where, path);
        } catch (RuntimeException e) {
            // iterator or accessor failure: placeholder for this subtree only
            logger.warn("Serialization of {} failed: {}", where, e.toString());
            return new JsonPrimitive(UNSERIALIZABLE);
        } finally {
            path.remove(value);
        }
    }

    private JsonElement record(Object value, String where, Set<Object> path) {
        JsonObject out = new JsonObject();
        for (RecordComponent c : value.getClass().getRecordComponents()) {
            Object component;
            try {
                c.getAccessor().setAccessible(true);
                component = c.getAccessor().invoke(value);
            } catch (ReflectiveOperationException | RuntimeException e) {
                out.add(c.getName(), placeholder(where + "." + c.getName(), e.toString()));
                continue;
            }
            out.add(c.getName(), walk(component, where + "." + c.getName(), path));
        }
        return out;
    }

    private static JsonElement number(Number n, String where) {
        if ((n instanceof Double d && !Double.isFinite(d)) || (n instanceof Float f && !Float.isFinite(f))) {
            logger.warn("Non-finite number at {} written as null", where);
            return JsonNull.INSTANCE;
        }
        return new JsonPrimitive(n);
    }

    private static JsonElement placeholder(String where, String what) {
        logger.warn("Replacing unserializable value at {} ({})", where, what);
        return new JsonPrimitive(UNSERIALIZABLE);
    }
}
