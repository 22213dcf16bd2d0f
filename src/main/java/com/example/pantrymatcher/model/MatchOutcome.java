package com.example.pantrymatcher.model;

import java.util.Optional;

/** Per-input trace of the pipeline: why a raw string did or did not resolve. */
public final class MatchOutcome {
    public enum Status { JUNK, NO_SIGNAL, UNMATCHED, MATCHED }

    public final String raw;
    public final String normalized; // null when junk short-circuited normalization
    public final Status status;
    private final MatchResult result;

    private MatchOutcome(String raw, String normalized, Status status, MatchResult result) {
        this.raw = raw; this.normalized = normalized; this.status = status; this.result = result;
    }

    public static MatchOutcome junk(String raw) { return new MatchOutcome(raw, null, Status.JUNK, null); }
    public static MatchOutcome noSignal(String raw, String normalized) { return new MatchOutcome(raw, normalized, Status.NO_SIGNAL, null); }
    public static MatchOutcome unmatched(String raw, String normalized) { return new MatchOutcome(raw, normalized, Status.UNMATCHED, null); }
    public static MatchOutcome matched(String raw, String normalized, MatchResult result) {
        return new MatchOutcome(raw, normalized, Status.MATCHED, result);
    }

    public Optional<MatchResult> result() { return Optional.ofNullable(result); }

    @Override public String toString() {
        return status == Status.MATCHED ? "\"" + raw + "\" -> " + result : "\"" + raw + "\" -> " + status;
    }
}
