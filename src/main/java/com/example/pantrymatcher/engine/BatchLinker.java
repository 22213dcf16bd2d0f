package com.example.pantrymatcher.engine;

import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.model.MatchOutcome;
import com.example.pantrymatcher.model.MatchResult;
import com.example.pantrymatcher.services.AcceptancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Links a batch of ingredient rows to the catalog. Matching fans out over a
 * fixed pool; acceptance and persistence then run on the calling thread in
 * input order, so the sink never sees concurrent calls.
 */
public class BatchLinker {
    private static final Logger log = LoggerFactory.getLogger(BatchLinker.class);
    private static final int PROGRESS_EVERY = 1000;

    private final CanonicalizationEngine engine;
    private final AcceptancePolicy policy;
    private final int threads;

    public BatchLinker(CanonicalizationEngine engine, AcceptancePolicy policy, int threads) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
        this.threads = threads;
    }

    public LinkSummary link(List<IngredientRecord> records, IngredientSink sink) throws InterruptedException {
        Objects.requireNonNull(sink, "sink");
        LinkSummary summary = new LinkSummary();
        summary.startedAt = Instant.now();
        if (records == null) records = List.of();
        log.info("Linking {} ingredient records against {} catalog items (policy: {})",
            records.size(), engine.index().size(), policy);

        List<IngredientRecord> pending = new ArrayList<>();
        for (IngredientRecord r : records) {
            if (r != null && r.isLinked()) summary.alreadyLinked++;
            else if (r != null) pending.add(r);
        }
        summary.total = summary.alreadyLinked + pending.size();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, pending.size())));
        try {
            List<Future<MatchOutcome>> futures = new ArrayList<>(pending.size());
            for (IngredientRecord r : pending) futures.add(pool.submit(() -> engine.classify(r.name)));

            for (int i = 0; i < pending.size(); i++) {
                record(summary, pending.get(i), outcomeOf(futures.get(i)), sink);
                if ((i + 1) % PROGRESS_EVERY == 0) log.info("   processed {} / {}", i + 1, pending.size());
            }
        } finally {
            pool.shutdownNow();
        }

        summary.finishedAt = Instant.now();
        log.info("Link run finished: {}", summary);
        return summary;
    }

    private void record(LinkSummary summary, IngredientRecord record, MatchOutcome outcome, IngredientSink sink) {
        switch (outcome.status) {
            case JUNK -> summary.junk++;
            case NO_SIGNAL -> summary.noSignal++;
            case UNMATCHED -> {
                summary.unmatched++;
                summary.deferred.add(record.name);
                log.debug("No match for '{}' (normalized '{}')", record.name, outcome.normalized);
            }
            case MATCHED -> {
                MatchResult match = outcome.result().orElseThrow();
                switch (match.tier) {
                    case EXACT -> summary.exact++;
                    case ALIAS -> summary.alias++;
                    case FUZZY -> summary.fuzzy++;
                }
                if (!policy.accept(match)) {
                    summary.rejected++;
                    summary.deferred.add(record.name);
                    log.debug("Rejected '{}' -> {}", record.name, match);
                    return;
                }
                try {
                    sink.link(record, match);
                    summary.linked++;
                    log.debug("Linked '{}' -> {}", record.name, match);
                } catch (IOException ex) {
                    summary.failed++;
                    log.error("Failed to link record {} ('{}') to {}", record.id, record.name, match.canonicalId, ex);
                }
            }
        }
    }

    private static MatchOutcome outcomeOf(Future<MatchOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Matching failed unexpectedly", ex.getCause());
        }
    }
}
