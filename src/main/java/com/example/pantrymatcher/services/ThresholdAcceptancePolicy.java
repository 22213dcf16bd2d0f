package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.MatchResult;

/** Accepts matches whose {@link MatchResult#confidence()} reaches a fixed cutoff. */
public class ThresholdAcceptancePolicy implements AcceptancePolicy {
    private final double threshold;

    public ThresholdAcceptancePolicy(double threshold) {
        if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("threshold must be in [0, 1]: " + threshold);
        this.threshold = threshold;
    }

    public static ThresholdAcceptancePolicy from(MatcherSettings settings) {
        return new ThresholdAcceptancePolicy(settings.acceptThreshold);
    }

    @Override public boolean accept(MatchResult match) {
        return match != null && match.confidence() >= threshold;
    }

    @Override public String toString() { return "confidence >= " + threshold; }
}
