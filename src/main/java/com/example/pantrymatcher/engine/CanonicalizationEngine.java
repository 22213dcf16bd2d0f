package com.example.pantrymatcher.engine;

import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.model.MatchOutcome;
import com.example.pantrymatcher.model.MatchResult;
import com.example.pantrymatcher.services.CatalogIndex;
import com.example.pantrymatcher.services.IngredientMatcher;
import com.example.pantrymatcher.services.IngredientNormalizer;
import com.example.pantrymatcher.services.IngredientRules;
import com.example.pantrymatcher.services.JunkClassifier;
import com.example.pantrymatcher.services.MatcherSettings;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full pipeline over one catalog snapshot: junk check, normalization, matching.
 * Immutable once built, so one instance can serve many threads.
 */
public class CanonicalizationEngine {
    private final JunkClassifier junk;
    private final IngredientNormalizer normalizer;
    private final IngredientMatcher matcher;
    private final CatalogIndex index;

    public CanonicalizationEngine(List<CanonicalItem> catalog) {
        this(catalog, IngredientRules.defaults(), MatcherSettings.defaults());
    }

    public CanonicalizationEngine(List<CanonicalItem> catalog, IngredientRules rules, MatcherSettings settings) {
        this.junk = new JunkClassifier(rules);
        this.normalizer = new IngredientNormalizer(rules);
        this.matcher = new IngredientMatcher(settings);
        this.index = CatalogIndex.build(catalog, normalizer);
    }

    /** Explains what happened to {@code raw}; junk never reaches the normalizer or the matcher. */
    public MatchOutcome classify(String raw) {
        if (junk.isJunk(raw)) return MatchOutcome.junk(raw);
        String normalized = normalizer.normalize(raw);
        if (!matcher.hasSignal(normalized)) return MatchOutcome.noSignal(raw, normalized);
        return matcher.findMatch(normalized, index)
            .map(m -> MatchOutcome.matched(raw, normalized, m))
            .orElseGet(() -> MatchOutcome.unmatched(raw, normalized));
    }

    public Optional<MatchResult> canonicalize(String raw) {
        return classify(raw).result();
    }

    /** Results keyed by raw name, in input order; repeated names are matched once. */
    public Map<String, Optional<MatchResult>> batchMatch(List<String> names) {
        Map<String, Optional<MatchResult>> out = new LinkedHashMap<>();
        if (names == null) return out;
        for (String name : names) {
            if (name != null && !out.containsKey(name)) out.put(name, canonicalize(name));
        }
        return out;
    }

    public CatalogIndex index() { return index; }
    public IngredientNormalizer normalizer() { return normalizer; }
    public IngredientMatcher matcher() { return matcher; }
}
