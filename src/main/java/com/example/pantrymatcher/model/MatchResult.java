package com.example.pantrymatcher.model;

import java.util.Objects;

/**
 * Outcome of a successful lookup. {@code matchedLabel} is always the item's
 * authoritative name; {@code matchedTerm} is the normalized name or alias
 * that actually hit.
 */
public final class MatchResult {
    public final String canonicalId;
    public final ConfidenceTier tier;
    public final String matchedLabel;
    public final String matchedTerm;
    public final MatchStrategy strategy;
    public final int score; // 0..100
    private final double confidence;

    public MatchResult(String canonicalId, ConfidenceTier tier, String matchedLabel,
                       String matchedTerm, MatchStrategy strategy, int score) {
        this(canonicalId, tier, matchedLabel, matchedTerm, strategy, score, score / 100.0);
    }

    public MatchResult(String canonicalId, ConfidenceTier tier, String matchedLabel,
                       String matchedTerm, MatchStrategy strategy, int score, double confidence) {
        this.canonicalId = canonicalId; this.tier = tier; this.matchedLabel = matchedLabel;
        this.matchedTerm = matchedTerm; this.strategy = strategy; this.score = score;
        this.confidence = confidence;
    }

    /**
     * 0..1, the scale acceptance cutoffs are written in. {@code score / 100} for most
     * strategies; for edit distance it is the similarity {@code 1 - distance / maxLength}.
     */
    public double confidence() { return confidence; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchResult)) return false;
        MatchResult m = (MatchResult) o;
        return score == m.score && Double.compare(confidence, m.confidence) == 0 && Objects.equals(canonicalId, m.canonicalId) && tier == m.tier
            && Objects.equals(matchedLabel, m.matchedLabel) && Objects.equals(matchedTerm, m.matchedTerm)
            && strategy == m.strategy;
    }
    @Override public int hashCode() { return Objects.hash(canonicalId, tier, matchedLabel, matchedTerm, strategy, score, confidence); }
    @Override public String toString() {
        return "%s (%s, %s via '%s', score %d)".formatted(matchedLabel, tier, strategy, matchedTerm, score);
    }
}
