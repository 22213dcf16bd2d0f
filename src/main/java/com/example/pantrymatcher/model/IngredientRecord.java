package com.example.pantrymatcher.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

/** A caller-side ingredient row (recipe line or pantry item) waiting to be linked. */
public class IngredientRecord {
    public String id;
    @JsonAlias("ingredient_name")
    public String name;
    @JsonAlias("canonical_item_id")
    public String canonicalItemId; // nullable until linked

    public IngredientRecord() {}
    public IngredientRecord(String id, String name, String canonicalItemId) {
        this.id = id; this.name = name; this.canonicalItemId = canonicalItemId;
    }

    @JsonIgnore
    public boolean isLinked() { return canonicalItemId != null && !canonicalItemId.isBlank(); }
}
