package com.example.pantrymatcher.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Statistics and data-quality findings for one catalog snapshot. */
public class AuditReport {
    // coverage
    public int totalItems;
    public int itemsWithAliases;
    public int totalAliases;
    public double averageAliases;
    public Map<String, Integer> itemsByCategory = new LinkedHashMap<>();

    // defects, one human-readable line each
    public List<String> selfAliases = new ArrayList<>();
    public List<String> duplicateNames = new ArrayList<>();
    public List<String> aliasCollisions = new ArrayList<>();
    public List<String> namesWithoutSignal = new ArrayList<>();

    public int defectCount() {
        return selfAliases.size() + duplicateNames.size() + aliasCollisions.size() + namesWithoutSignal.size();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Items: %d  |  with aliases: %d (%.1f%%)  |  aliases: %d (avg %.2f)%n",
            totalItems, itemsWithAliases, totalItems == 0 ? 0.0 : 100.0 * itemsWithAliases / totalItems,
            totalAliases, averageAliases));
        itemsByCategory.forEach((cat, n) -> sb.append(String.format("  %-20s %4d%n", cat, n)));
        section(sb, "Self-aliases", selfAliases);
        section(sb, "Duplicate names", duplicateNames);
        section(sb, "Alias collisions", aliasCollisions);
        section(sb, "Names without signal", namesWithoutSignal);
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) return;
        sb.append(title).append(" (").append(lines.size()).append("):").append(System.lineSeparator());
        for (String l : lines) sb.append("  - ").append(l).append(System.lineSeparator());
    }
}
