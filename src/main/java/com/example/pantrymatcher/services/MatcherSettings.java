package com.example.pantrymatcher.services;

import java.util.ArrayList;
import java.util.List;

/** Tunable thresholds for matching and batch linking. */
public class MatcherSettings {
    /** Normalized inputs shorter than this carry no usable signal. */
    public int minSignalLength = 3;
    /** Minimum normalized length for a term to take part in containment matching. */
    public int minContainmentLength = 4;
    /** Short terms that may take part in containment matching anyway. */
    public List<String> shortWordAllowList = new ArrayList<>(List.of(
        "egg", "oil", "ham", "jam", "tea", "ice", "yam", "pea", "cod", "pie"));
    /** Edit distance allowed, as a fraction of the longer string. */
    public double fuzzyRatio = 0.3;
    /** Cutoff on {@code score / 100} used by the threshold acceptance policy. */
    public double acceptThreshold = 0.7;
    /** Worker threads used by the batch linker. */
    public int threads = 4;

    public MatcherSettings() {}

    public static MatcherSettings defaults() { return new MatcherSettings(); }
}
