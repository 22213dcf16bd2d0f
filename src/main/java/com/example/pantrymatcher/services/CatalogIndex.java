package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.CanonicalItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot of the canonical catalog with every name and alias
 * normalized once. Exact lookups are hash based; the other strategies scan
 * {@link #entries()} in catalog order. Rebuild the index when the catalog changes.
 */
public final class CatalogIndex {

    /** One catalog item as the matcher sees it. */
    public static final class Entry {
        public final int ordinal;
        public final String id;
        public final String name;
        public final String category;
        public final String normalizedName;       // may be empty
        public final List<String> normalizedAliases;

        Entry(int ordinal, String id, String name, String category, String normalizedName, List<String> normalizedAliases) {
            this.ordinal = ordinal; this.id = id; this.name = name; this.category = category;
            this.normalizedName = normalizedName;
            this.normalizedAliases = Collections.unmodifiableList(normalizedAliases);
        }

        /** Normalized name first (when non-empty), then aliases. */
        public List<String> terms() {
            if (normalizedName.isEmpty()) return normalizedAliases;
            List<String> out = new ArrayList<>(normalizedAliases.size() + 1);
            out.add(normalizedName);
            out.addAll(normalizedAliases);
            return out;
        }
    }

    private final List<Entry> entries;
    private final Map<String, Entry> byName;
    private final Map<String, Entry> byAlias;
    private final IngredientNormalizer normalizer;

    private CatalogIndex(List<Entry> entries, Map<String, Entry> byName, Map<String, Entry> byAlias,
                         IngredientNormalizer normalizer) {
        this.entries = Collections.unmodifiableList(entries);
        this.byName = Collections.unmodifiableMap(byName);
        this.byAlias = Collections.unmodifiableMap(byAlias);
        this.normalizer = normalizer;
    }

    public static CatalogIndex build(List<CanonicalItem> items) {
        return build(items, new IngredientNormalizer());
    }

    /**
     * Items must carry an id. When two items normalize to the same name or alias,
     * the one earlier in {@code items} answers exact lookups.
     */
    public static CatalogIndex build(List<CanonicalItem> items, IngredientNormalizer normalizer) {
        if (items == null) throw new IllegalArgumentException("Catalog must not be null.");
        if (normalizer == null) throw new IllegalArgumentException("Normalizer must not be null.");

        List<Entry> entries = new ArrayList<>(items.size());
        Map<String, Entry> byName = new HashMap<>();
        Map<String, Entry> byAlias = new HashMap<>();

        for (CanonicalItem item : items) {
            if (item == null || item.id == null || item.id.isBlank()) {
                throw new IllegalArgumentException("Catalog item at position " + entries.size() + " has no id: " + item);
            }
            String normName = normalizer.normalize(item.name);
            Set<String> aliases = new LinkedHashSet<>();
            if (item.aliases != null) {
                for (String alias : item.aliases) {
                    String a = normalizer.normalize(alias);
                    if (!a.isEmpty() && !a.equals(normName)) aliases.add(a);
                }
            }
            Entry e = new Entry(entries.size(), item.id, item.name, item.category, normName, new ArrayList<>(aliases));
            entries.add(e);
            if (!normName.isEmpty()) byName.putIfAbsent(normName, e);
            for (String a : e.normalizedAliases) byAlias.putIfAbsent(a, e);
        }
        return new CatalogIndex(entries, byName, byAlias, normalizer);
    }

    public Entry byName(String normalized) { return normalized == null ? null : byName.get(normalized); }

    public Entry byAlias(String normalized) { return normalized == null ? null : byAlias.get(normalized); }

    public List<Entry> entries() { return entries; }

    public int size() { return entries.size(); }

    /** The normalizer the catalog terms were reduced with; queries must use the same one. */
    public IngredientNormalizer normalizer() { return normalizer; }
}
