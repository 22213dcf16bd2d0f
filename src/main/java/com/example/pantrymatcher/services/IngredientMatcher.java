package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.ConfidenceTier;
import com.example.pantrymatcher.model.MatchResult;
import com.example.pantrymatcher.model.MatchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a normalized ingredient against a {@link CatalogIndex}. Strategies
 * run in a fixed order and the first one that produces a candidate wins:
 * exact name, exact alias, singular/plural, containment, edit distance.
 * Inside a strategy, ties go to the entry earliest in catalog order.
 */
public class IngredientMatcher {
    private static final Logger log = LoggerFactory.getLogger(IngredientMatcher.class);

    static final int EXACT_SCORE = 100;
    static final int ALIAS_SCORE = 95;
    static final int PLURAL_NAME_SCORE = 90;
    static final int PLURAL_ALIAS_SCORE = 88;
    static final int TERM_IN_QUERY_SCORE = 80;
    static final int QUERY_IN_TERM_SCORE = 75;
    static final int EDIT_DISTANCE_MAX_SCORE = 70;

    private final int minSignalLength;
    private final int minContainmentLength;
    private final Set<String> shortWords;
    private final double fuzzyRatio;

    public IngredientMatcher() {
        this(MatcherSettings.defaults());
    }

    public IngredientMatcher(MatcherSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (settings.fuzzyRatio < 0 || settings.fuzzyRatio >= 1) {
            throw new IllegalArgumentException("fuzzyRatio must be in [0, 1): " + settings.fuzzyRatio);
        }
        this.minSignalLength = settings.minSignalLength;
        this.minContainmentLength = settings.minContainmentLength;
        this.fuzzyRatio = settings.fuzzyRatio;
        this.shortWords = new HashSet<>();
        if (settings.shortWordAllowList != null) {
            for (String w : settings.shortWordAllowList) if (w != null) shortWords.add(w.trim().toLowerCase(Locale.ROOT));
        }
    }

    /** False for inputs too short to be worth matching. */
    public boolean hasSignal(String normalized) {
        return normalized != null && normalized.length() >= minSignalLength;
    }

    /** Empty when nothing qualifies; callers defer those to manual or LLM review. */
    public Optional<MatchResult> findMatch(String normalized, CatalogIndex index) {
        Objects.requireNonNull(index, "index");
        if (!hasSignal(normalized)) return Optional.empty();

        MatchResult result = exactName(normalized, index);
        if (result == null) result = exactAlias(normalized, index);
        if (result == null) result = plural(normalized, index);
        if (result == null) result = containment(normalized, index);
        if (result == null) result = editDistance(normalized, index);

        if (log.isDebugEnabled()) log.debug("'{}' -> {}", normalized, result == null ? "no match" : result);
        return Optional.ofNullable(result);
    }

    private MatchResult exactName(String q, CatalogIndex index) {
        CatalogIndex.Entry e = index.byName(q);
        return e == null ? null : result(e, ConfidenceTier.EXACT, q, MatchStrategy.EXACT_NAME, EXACT_SCORE);
    }

    private MatchResult exactAlias(String q, CatalogIndex index) {
        CatalogIndex.Entry e = index.byAlias(q);
        return e == null ? null : result(e, ConfidenceTier.ALIAS, q, MatchStrategy.EXACT_ALIAS, ALIAS_SCORE);
    }

    private MatchResult plural(String q, CatalogIndex index) {
        for (CatalogIndex.Entry e : index.entries()) {
            if (isPluralPair(q, e.normalizedName)) {
                return result(e, ConfidenceTier.FUZZY, e.normalizedName, MatchStrategy.PLURAL, PLURAL_NAME_SCORE);
            }
            for (String alias : e.normalizedAliases) {
                if (isPluralPair(q, alias)) {
                    return result(e, ConfidenceTier.ALIAS, alias, MatchStrategy.PLURAL, PLURAL_ALIAS_SCORE);
                }
            }
        }
        return null;
    }

    static boolean isPluralPair(String q, String term) {
        if (term.isEmpty()) return false;
        return term.equals(q + "s") || term.equals(q + "es") || q.equals(term + "s") || q.equals(term + "es");
    }

    private MatchResult containment(String q, CatalogIndex index) {
        // the short-word allow-list only admits catalog terms; "ice" must not hit "rice"
        boolean queryEligible = q.length() >= minContainmentLength;
        CatalogIndex.Entry best = null;
        String bestTerm = null;
        int bestLength = 0;
        int bestScore = 0;

        for (CatalogIndex.Entry e : index.entries()) {
            for (String term : e.terms()) {
                if (!eligibleForContainment(term)) continue;
                int length;
                int score;
                if (q.contains(term)) {
                    length = term.length();
                    score = TERM_IN_QUERY_SCORE;
                } else if (queryEligible && term.contains(q)) {
                    length = q.length();
                    score = QUERY_IN_TERM_SCORE;
                } else {
                    continue;
                }
                if (length > bestLength) {
                    best = e; bestTerm = term; bestLength = length; bestScore = score;
                }
            }
        }
        return best == null ? null : result(best, ConfidenceTier.FUZZY, bestTerm, MatchStrategy.CONTAINMENT, bestScore);
    }

    private boolean eligibleForContainment(String term) {
        return term.length() >= minContainmentLength || shortWords.contains(term);
    }

    private MatchResult editDistance(String q, CatalogIndex index) {
        CatalogIndex.Entry best = null;
        String bestTerm = null;
        int bestDistance = Integer.MAX_VALUE;
        int bestMaxLength = 0;

        for (CatalogIndex.Entry e : index.entries()) {
            for (String term : e.terms()) {
                int maxLength = Math.max(q.length(), term.length());
                // only a strictly smaller distance can replace the current best
                int bound = Math.min(threshold(maxLength), bestDistance - 1);
                if (bound < 0) continue;
                int d = Levenshtein.distance(q, term, bound);
                if (d <= bound) {
                    best = e; bestTerm = term; bestDistance = d; bestMaxLength = maxLength;
                }
            }
        }
        if (best == null) return null;
        double similarity = 1.0 - (double) bestDistance / bestMaxLength;
        int score = (int) Math.round(similarity * EDIT_DISTANCE_MAX_SCORE);
        return new MatchResult(best.id, ConfidenceTier.FUZZY, best.name, bestTerm, MatchStrategy.EDIT_DISTANCE, score, similarity);
    }

    /** ceil(ratio * length), with a small epsilon so 0.3 * 10 stays 3. */
    int threshold(int maxLength) {
        return (int) Math.ceil(fuzzyRatio * maxLength - 1e-9);
    }

    private static MatchResult result(CatalogIndex.Entry e, ConfidenceTier tier, String term, MatchStrategy strategy, int score) {
        return new MatchResult(e.id, tier, e.name, term, strategy, score);
    }
}
