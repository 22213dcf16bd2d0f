package com.example.pantrymatcher;

import com.example.pantrymatcher.engine.BatchLinker;
import com.example.pantrymatcher.engine.CanonicalizationEngine;
import com.example.pantrymatcher.engine.LinkSummary;
import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.model.ConfidenceTier;
import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.services.MatcherSettings;
import com.example.pantrymatcher.services.ThresholdAcceptancePolicy;
import com.example.pantrymatcher.services.TierAcceptancePolicy;
import com.example.pantrymatcher.storage.JsonStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchLinkerTests {
    private final JsonStorage storage = new JsonStorage();
    private CanonicalizationEngine engine;
    private List<IngredientRecord> records;

    @BeforeEach
    void loadSampleData() throws IOException {
        try (InputStream c = getClass().getResourceAsStream("/sample-data/catalog.json");
             InputStream r = getClass().getResourceAsStream("/sample-data/ingredients.json")) {
            List<CanonicalItem> catalog = storage.loadCatalog(c);
            engine = new CanonicalizationEngine(catalog);
            records = storage.loadIngredients(r);
        }
    }

    @Test
    void sample_run_counts_every_outcome() throws Exception {
        Map<String, String> links = new LinkedHashMap<>();
        LinkSummary s = new BatchLinker(engine, new ThresholdAcceptancePolicy(0.7), 4)
            .link(records, (record, match) -> links.put(record.id, match.canonicalId));

        assertEquals(16, s.total);
        assertEquals(1, s.alreadyLinked);
        assertEquals(2, s.junk);
        assertEquals(0, s.noSignal);
        assertEquals(5, s.exact);
        assertEquals(1, s.alias);
        assertEquals(6, s.fuzzy);
        assertEquals(1, s.unmatched);
        assertEquals(1, s.rejected);
        assertEquals(11, s.linked);
        assertEquals(0, s.failed);
        assertEquals(12.0 / 15, s.matchRate(), 1e-9);
        assertEquals(List.of("2 carots, shredded", "dragon fruit"), s.deferred);
        assertNotNull(s.startedAt);
        assertFalse(s.finishedAt.isBefore(s.startedAt));

        assertEquals("c-002", links.get("r-1"));
        assertEquals("c-017", links.get("r-11"));
        assertFalse(links.containsKey("r-14"), "already linked rows are left alone");
    }

    @Test
    void typos_are_linked_when_similar_enough() throws Exception {
        Map<String, String> links = new LinkedHashMap<>();
        List<IngredientRecord> typos = List.of(
            new IngredientRecord("t-1", "1 cup yoghurt", null),
            new IngredientRecord("t-2", "2 carots, shredded", null));
        LinkSummary byDefault = new BatchLinker(engine, ThresholdAcceptancePolicy.from(MatcherSettings.defaults()), 2)
            .link(typos, (record, match) -> links.put(record.id, match.canonicalId));

        // yoghurt/yogurt: 6 of 7 characters agree; carots/carrot only 4 of 6
        assertEquals("c-019", links.get("t-1"));
        assertEquals(List.of("2 carots, shredded"), byDefault.deferred);

        links.clear();
        LinkSummary relaxed = new BatchLinker(engine, new ThresholdAcceptancePolicy(0.65), 2)
            .link(records, (record, match) -> links.put(record.id, match.canonicalId));
        assertEquals("c-020", links.get("r-13"));
        assertEquals(12, relaxed.linked);
        assertEquals(0, relaxed.rejected);
        assertEquals(List.of("dragon fruit"), relaxed.deferred);
    }

    @Test
    void sink_sees_records_in_input_order_whatever_the_pool_size() throws Exception {
        List<String> serial = new ArrayList<>();
        List<String> parallel = new ArrayList<>();
        new BatchLinker(engine, new ThresholdAcceptancePolicy(0), 1).link(records, (r, m) -> serial.add(r.id));
        new BatchLinker(engine, new ThresholdAcceptancePolicy(0), 8).link(records, (r, m) -> parallel.add(r.id));

        assertEquals(serial, parallel);
        assertEquals("r-1", serial.get(0));
        assertEquals("r-16", serial.get(serial.size() - 1));
    }

    @Test
    void sink_failure_is_counted_and_the_run_continues() throws Exception {
        LinkSummary s = new BatchLinker(engine, new TierAcceptancePolicy(ConfidenceTier.EXACT), 2)
            .link(records, (record, match) -> {
                if (record.id.equals("r-2")) throw new IOException("row locked");
            });

        assertEquals(1, s.failed);
        assertEquals(4, s.linked);
        assertEquals(7, s.rejected);
    }

    @Test
    void null_and_empty_inputs_are_fine() throws Exception {
        BatchLinker linker = new BatchLinker(engine, new ThresholdAcceptancePolicy(0.7), 2);
        LinkSummary empty = linker.link(null, (r, m) -> fail("nothing to link"));
        assertEquals(0, empty.total);
        assertEquals(0.0, empty.matchRate());

        LinkSummary withNulls = linker.link(Arrays.asList(null, new IngredientRecord("x", "1 cup milk", null)), (r, m) -> {});
        assertEquals(1, withNulls.total);
        assertEquals(1, withNulls.linked);
    }

    @Test
    void bad_arguments_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new BatchLinker(engine, new ThresholdAcceptancePolicy(0.7), 0));
        assertThrows(NullPointerException.class, () -> new BatchLinker(engine, null, 1));
    }
}
