package com.example.pantrymatcher.engine;

import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.model.MatchResult;

import java.io.IOException;

/** Where accepted links are persisted. Called from a single thread, in input order. */
public interface IngredientSink {
    void link(IngredientRecord record, MatchResult match) throws IOException;
}
