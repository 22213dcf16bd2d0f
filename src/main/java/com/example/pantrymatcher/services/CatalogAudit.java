package com.example.pantrymatcher.services;

import com.example.pantrymatcher.model.CanonicalItem;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reports catalog problems instead of hiding them: aliases that repeat their own
 * name, names that collide after normalization, aliases claimed by two items,
 * and names that normalize to nothing usable.
 */
public class CatalogAudit {
    static final String UNCATEGORIZED = "uncategorized";

    private final IngredientNormalizer normalizer;
    private final IngredientMatcher matcher;

    public CatalogAudit(IngredientNormalizer normalizer, IngredientMatcher matcher) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public AuditReport audit(List<CanonicalItem> items) {
        AuditReport report = new AuditReport();
        if (items == null) return report;

        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, CanonicalItem> nameOwners = new HashMap<>();
        Map<String, CanonicalItem> termOwners = new HashMap<>();

        for (CanonicalItem item : items) {
            if (item == null) continue;
            report.totalItems++;
            int aliasCount = item.aliases == null ? 0 : item.aliases.size();
            if (aliasCount > 0) report.itemsWithAliases++;
            report.totalAliases += aliasCount;
            String cat = item.category == null || item.category.isBlank() ? UNCATEGORIZED : item.category;
            byCategory.merge(cat, 1, Integer::sum);

            String name = normalizer.normalize(item.name);
            if (!matcher.hasSignal(name)) {
                report.namesWithoutSignal.add(describe(item) + " normalizes to '" + name + "'");
            } else {
                CanonicalItem previous = nameOwners.putIfAbsent(name, item);
                if (previous != null) {
                    report.duplicateNames.add("'" + name + "': " + describe(previous) + ", " + describe(item));
                }
                termOwners.putIfAbsent(name, item);
            }
        }

        // second pass so collisions are found regardless of catalog order
        for (CanonicalItem item : items) {
            if (item == null || item.aliases == null) continue;
            String name = normalizer.normalize(item.name);
            for (String alias : item.aliases) {
                String a = normalizer.normalize(alias);
                if (a.isEmpty()) continue;
                if (a.equals(name)) {
                    report.selfAliases.add(describe(item) + " lists '" + alias + "'");
                    continue;
                }
                CanonicalItem owner = termOwners.putIfAbsent(a, item);
                if (owner != null && owner != item) {
                    report.aliasCollisions.add("'" + alias + "' of " + describe(item) + " also resolves to " + describe(owner));
                }
            }
        }

        report.averageAliases = report.totalItems == 0 ? 0.0 : (double) report.totalAliases / report.totalItems;
        byCategory.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .forEach(e -> report.itemsByCategory.put(e.getKey(), e.getValue()));
        return report;
    }

    private static String describe(CanonicalItem item) {
        return item.name + " [" + item.id + "]";
    }
}
