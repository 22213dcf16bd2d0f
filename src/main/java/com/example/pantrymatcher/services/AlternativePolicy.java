package com.example.pantrymatcher.services;

/**
 * What the normalizer keeps from an "X or Y" phrase. Both variants keep the
 * first-listed alternative; they differ in whether a shared head noun survives.
 */
public enum AlternativePolicy {
    /** Drops "or" and up to two following words: "grapeseed or vegetable oil" -> "grapeseed". */
    FIRST_ONLY,
    /**
     * Keeps the last word of a two word alternative as the shared noun:
     * "grapeseed or vegetable oil" -> "grapeseed oil". One word alternatives are dropped.
     */
    FIRST_WITH_HEAD_NOUN
}
