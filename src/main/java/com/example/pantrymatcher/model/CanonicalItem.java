package com.example.pantrymatcher.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.List;

/** One authoritative catalog ingredient, e.g. "olive oil". */
public class CanonicalItem {
    public String id;
    @JsonAlias("canonical_name")
    public String name;
    public List<String> aliases = new ArrayList<>();
    public String category; // nullable

    public CanonicalItem() {}
    public CanonicalItem(String id, String name, List<String> aliases, String category) {
        this.id = id; this.name = name; this.category = category;
        this.aliases = aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
    }
    public CanonicalItem(String id, String name, String... aliases) {
        this(id, name, List.of(aliases), null);
    }

    @Override public String toString() { return id + ":" + name; }
}
