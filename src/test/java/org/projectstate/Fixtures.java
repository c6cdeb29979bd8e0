package org.projectstate;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.projectstate.codec.EditingSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared builders for snapshots and sessions. */
final class Fixtures {
    private Fixtures() {}

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    /** Smallest snapshot tree the codec accepts (plus optional deleted pages). */
    static JsonObject snapshotJson(String id, String name, int... deletedPages) {
        JsonObject doc = new JsonObject();
        JsonArray deleted = new JsonArray();
        for (int p : deletedPages) deleted.add(p);
        doc.add("deletedPages", deleted);

        JsonObject o = new JsonObject();
        if (id != null) o.addProperty("id", id);
        o.addProperty("name", name);
        o.addProperty("version", "1.0.0");
        o.add("documentState", doc);
        return o;
    }

    static EditingSession session(String name) {
        EditingSession s = new EditingSession();
        s.setName(name);
        s.getDocument().setUrl("https://files.example/doc.pdf");
        s.getDocument().setFileType("pdf");
        s.getDocument().setNumPages(8);
        s.getDocument().setCurrentPage(3);
        s.getDocument().setScale(1.25);
        s.getDocument().getDetectedPageBackgrounds().put(2, "rgb(250,250,250)");
        s.getDocument().getDeletedPages().add(4);
        s.getDocument().getDeletedPages().add(7);
        s.getDocument().getPageTranslated().put(1, true);
        s.getView().setCurrentWorkflowStep("layout");
        s.getLayers().getOriginalLayerOrder().add("tb-1");

        Map<String, Object> box = new LinkedHashMap<>();
        box.put("id", "tb-1");
        box.put("value", "Hello");
        List<Object> boxes = new ArrayList<>();
        boxes.add(box);
        s.getElementCollections().put("originalTextBoxes", boxes);
        s.setSourceLanguage("en");
        s.setDesiredLanguage("fr");
        return s;
    }
}
