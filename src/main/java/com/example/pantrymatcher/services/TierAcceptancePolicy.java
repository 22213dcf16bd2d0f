package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.ConfidenceTier;
import com.example.pantrymatcher.model.MatchResult;

import java.util.Objects;

/** Accepts matches whose tier is at least the configured one. */
public class TierAcceptancePolicy implements AcceptancePolicy {
    private final ConfidenceTier minimum;

    public TierAcceptancePolicy(ConfidenceTier minimum) {
        this.minimum = Objects.requireNonNull(minimum, "minimum");
    }

    @Override public boolean accept(MatchResult match) {
        return match != null && match.tier.isAtLeast(minimum);
    }

    @Override public String toString() { return "tier >= " + minimum; }
}
