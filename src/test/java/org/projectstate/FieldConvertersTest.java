package org.projectstate;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.projectstate.codec.IntKeyedMapConverter;
import org.projectstate.codec.IntSetConverter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FieldConvertersTest {

    private final IntKeyedMapConverter<String> backgrounds = IntKeyedMapConverter.ofStrings("detectedPageBackgrounds");
    private final IntSetConverter pages = new IntSetConverter("deletedPages");

    @Test
    void mapWritesStringKeysAndReadsThemBackAsIntegers() {
        Map<Integer, String> live = new LinkedHashMap<>();
        live.put(2, "rgb(250,250,250)");
        live.put(10, "#fff");

        JsonElement portable = backgrounds.toPortable(live);
        assertEquals("{\"2\":\"rgb(250,250,250)\",\"10\":\"#fff\"}", portable.toString());
        assertEquals(live, backgrounds.fromPortable(portable));
    }

    @Test
    void mapAcceptsPairListAndDropsBadKeys() {
        JsonElement pairs = JsonParser.parseString("[[1,\"white\"],[\"x\",\"red\"],[3],[\"4\",\"blue\"]]");
        assertEquals(Map.of(1, "white", 4, "blue"), backgrounds.fromPortable(pairs));

        JsonElement obj = JsonParser.parseString("{\"1\":\"white\",\"page\":\"red\"}");
        assertEquals(Map.of(1, "white"), backgrounds.fromPortable(obj));
    }

    @Test
    void mapOfUnexpectedShapeIsEmpty() {
        assertTrue(backgrounds.fromPortable(JsonParser.parseString("\"nope\"")).isEmpty());
        assertTrue(backgrounds.fromPortable(null).isEmpty());
    }

    @Test
    void booleanMapSkipsNonBooleanValues() {
        IntKeyedMapConverter<Boolean> flags = IntKeyedMapConverter.ofBooleans("isPageTranslated");
        assertEquals(Map.of(1, true), flags.fromPortable(JsonParser.parseString("{\"1\":true,\"2\":\"yes\"}")));
    }

    @Test
    void setAcceptsArrayAndNumericKeyedObject() {
        assertEquals(Set.of(4, 7), pages.fromPortable(JsonParser.parseString("[4,7,7]")));
        assertEquals(Set.of(4, 7), pages.fromPortable(JsonParser.parseString("{\"0\":4,\"1\":7}")));
    }

    @Test
    void setOfUnexpectedShapeDegradesToEmpty() {
        assertTrue(pages.fromPortable(JsonParser.parseString("{\"a\":1}")).isEmpty());
        assertTrue(pages.fromPortable(JsonParser.parseString("42")).isEmpty());
        assertEquals(Set.of(3), pages.fromPortable(JsonParser.parseString("[3,\"x\",2.5]")));
    }

    @Test
    void setWritesArray() {
        assertEquals("[4,7]", pages.toPortable(new LinkedHashSet<>(List.of(4, 7))).toString());
    }
}
