package com.example.pantrymatcher.storage;

import com.example.pantrymatcher.engine.LinkSummary;
import com.example.pantrymatcher.model.ConfidenceTier;
import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.model.MatchResult;
import com.example.pantrymatcher.model.MatchStrategy;

import java.util.ArrayList;
import java.util.List;

/** What a link run writes to disk: the summary plus one line per accepted link. */
public class LinkReport {
    public LinkSummary summary;
    public List<Link> links = new ArrayList<>();

    public static class Link {
        public String recordId;
        public String name;
        public String canonicalItemId;
        public String matchedLabel;
        public ConfidenceTier tier;
        public MatchStrategy strategy;
        public int score;

        public Link() {}
        public Link(IngredientRecord record, MatchResult match) {
            this.recordId = record.id; this.name = record.name;
            this.canonicalItemId = match.canonicalId; this.matchedLabel = match.matchedLabel;
            this.tier = match.tier; this.strategy = match.strategy; this.score = match.score;
        }
    }
}
