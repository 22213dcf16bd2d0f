package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.MatchResult;

/**
 * Caller-side decision on whether a match is trusted enough to be written
 * without review. Swapping policies never touches the matching logic.
 */
public interface AcceptancePolicy {
    boolean accept(MatchResult match);
}
