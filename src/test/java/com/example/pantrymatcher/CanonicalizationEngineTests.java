package com.example.pantrymatcher;

import com.example.pantrymatcher.engine.CanonicalizationEngine;
import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.model.ConfidenceTier;
import com.example.pantrymatcher.model.MatchOutcome;
import com.example.pantrymatcher.model.MatchResult;
import com.example.pantrymatcher.model.MatchStrategy;
import com.example.pantrymatcher.storage.JsonStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class CanonicalizationEngineTests {
    private CanonicalizationEngine engine;

    @BeforeEach
    void loadSampleCatalog() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/sample-data/catalog.json")) {
            assertNotNull(in, "sample catalog missing");
            List<CanonicalItem> catalog = new JsonStorage().loadCatalog(in);
            engine = new CanonicalizationEngine(catalog);
        }
    }

    @Test
    void junk_never_reaches_the_matcher() {
        MatchOutcome o = engine.classify("For the Dressing:");
        assertEquals(MatchOutcome.Status.JUNK, o.status);
        assertNull(o.normalized);
        assertTrue(o.result().isEmpty());
        assertTrue(engine.canonicalize("bamboo skewers").isEmpty());
    }

    @Test
    void noise_only_lines_have_no_signal() {
        MatchOutcome o = engine.classify("2 tbsp");
        assertEquals(MatchOutcome.Status.NO_SIGNAL, o.status);
        assertEquals("", o.normalized);
    }

    @Test
    void unknown_ingredients_are_unmatched_not_errors() {
        MatchOutcome o = engine.classify("dragon fruit");
        assertEquals(MatchOutcome.Status.UNMATCHED, o.status);
        assertEquals("dragon fruit", o.normalized);
    }

    @Test
    void recipe_lines_resolve_through_the_full_pipeline() {
        assertMatch("2 tablespoons extra virgin olive oil, divided", "c-002", ConfidenceTier.EXACT, MatchStrategy.EXACT_NAME);
        assertMatch("3 cloves garlic, minced", "c-001", ConfidenceTier.EXACT, MatchStrategy.EXACT_NAME);
        assertMatch("1 diced red onion, finely chopped", "c-004", ConfidenceTier.EXACT, MatchStrategy.EXACT_NAME);
        assertMatch("1/2 cup grated parmesan", "c-016", ConfidenceTier.ALIAS, MatchStrategy.EXACT_ALIAS);
        assertMatch("2 bell peppers", "c-005", ConfidenceTier.FUZZY, MatchStrategy.PLURAL);
        assertMatch("2 large eggs", "c-007", ConfidenceTier.FUZZY, MatchStrategy.CONTAINMENT);
        assertMatch("salt and pepper to taste", "c-017", ConfidenceTier.FUZZY, MatchStrategy.CONTAINMENT);
        assertMatch("2 carots, shredded", "c-020", ConfidenceTier.FUZZY, MatchStrategy.EDIT_DISTANCE);
    }

    @Test
    void outcome_carries_the_normalized_text() {
        MatchOutcome o = engine.classify("1/4 cup packed light brown sugar");
        assertEquals(MatchOutcome.Status.MATCHED, o.status);
        assertEquals("packed brown sugar", o.normalized);
        assertEquals("brown sugar", o.result().orElseThrow().matchedLabel);
    }

    @Test
    void batch_match_keeps_input_order_and_dedupes() {
        Map<String, Optional<MatchResult>> out = engine.batchMatch(Arrays.asList(
            "1 cup milk", "dragon fruit", null, "1 cup milk", "Topping:"));

        assertEquals(List.of("1 cup milk", "dragon fruit", "Topping:"), List.copyOf(out.keySet()));
        assertEquals("c-011", out.get("1 cup milk").orElseThrow().canonicalId);
        assertTrue(out.get("dragon fruit").isEmpty());
        assertTrue(out.get("Topping:").isEmpty());
        assertTrue(engine.batchMatch(null).isEmpty());
    }

    private void assertMatch(String raw, String expectedId, ConfidenceTier tier, MatchStrategy strategy) {
        MatchResult m = engine.canonicalize(raw).orElse(null);
        assertNotNull(m, "no match for " + raw);
        assertEquals(expectedId, m.canonicalId, raw);
        assertEquals(tier, m.tier, raw);
        assertEquals(strategy, m.strategy, raw);
    }
}
