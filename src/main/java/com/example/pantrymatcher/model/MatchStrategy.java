package com.example.pantrymatcher.model;

/** Matching strategies in the order the matcher tries them. */
public enum MatchStrategy {
    EXACT_NAME,
    EXACT_ALIAS,
    PLURAL,
    CONTAINMENT,
    EDIT_DISTANCE
}
