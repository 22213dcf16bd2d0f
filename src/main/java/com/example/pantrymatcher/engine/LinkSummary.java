package com.example.pantrymatcher.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Counters for one batch run, plus the names left for manual or LLM review. */
public class LinkSummary {
    public int total;
    public int alreadyLinked;
    public int junk;
    public int noSignal;
    public int exact;
    public int alias;
    public int fuzzy;
    public int unmatched;
    public int rejected;   // matched, but refused by the acceptance policy
    public int linked;
    public int failed;     // accepted, but the sink threw
    public List<String> deferred = new ArrayList<>();
    public Instant startedAt;
    public Instant finishedAt;

    public int matched() { return exact + alias + fuzzy; }

    /** Matched share of the records that were actually attempted. */
    public double matchRate() {
        int attempted = total - alreadyLinked;
        return attempted == 0 ? 0.0 : (double) matched() / attempted;
    }

    @Override public String toString() {
        return String.format(
            "Records: %d (already linked %d)  |  Matched: %d (exact %d, alias %d, fuzzy %d) = %.1f%%  |  "
                + "Junk: %d  No signal: %d  Unmatched: %d  |  Linked: %d  Rejected: %d  Failed: %d",
            total, alreadyLinked, matched(), exact, alias, fuzzy, 100.0 * matchRate(),
            junk, noSignal, unmatched, linked, rejected, failed);
    }
}
