package com.example.pantrymatcher.model;

/**
 * Trust ranking of a match, strongest first. The tier names the kind of
 * strategy that produced the match; numeric cutoffs are left to callers.
 */
public enum ConfidenceTier {
    EXACT,
    ALIAS,
    FUZZY;

    /** True when this tier is as trustworthy as {@code other} or more. */
    public boolean isAtLeast(ConfidenceTier other) {
        return compareTo(other) <= 0;
    }
}
