package com.example.pantrymatcher.services;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Flags raw lines that are not ingredients at all: section headers, formatting
 * leftovers, lone prep words, kitchen equipment and notes. Runs on the raw text,
 * before any normalization.
 */
public class JunkClassifier {
    private static final Pattern NO_LETTERS_OR_DIGITS = Pattern.compile("^[^\\p{L}\\p{N}]+$");

    private final List<String> headerMarkers;
    private final Set<String> fragments;
    private final Set<String> prepFragments;
    private final Pattern equipment;
    private final List<String> noteMarkers;

    public JunkClassifier() {
        this(IngredientRules.defaults());
    }

    public JunkClassifier(IngredientRules rules) {
        Objects.requireNonNull(rules, "rules");
        this.headerMarkers = rules.headerMarkers == null ? List.of()
            : rules.headerMarkers.stream().filter(w -> w != null && !w.isBlank()).toList();
        this.fragments = lowered(rules.fragments);
        this.prepFragments = lowered(rules.prepFragments);
        this.equipment = IngredientNormalizer.words(rules.equipment, "");
        this.noteMarkers = lowered(rules.noteMarkers).stream().toList();
    }

    public boolean isJunk(String raw) {
        if (raw == null) return true;
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);

        if (lower.length() <= 2) return true;

        // section headers: "For the Dressing:", "Topping:"
        if (lower.startsWith("for ") || trimmed.endsWith(":")) return true;
        for (String marker : headerMarkers) if (trimmed.contains(marker)) return true;

        if (NO_LETTERS_OR_DIGITS.matcher(trimmed).matches()) return true;
        if (fragments.contains(lower) || lower.startsWith("s)")) return true;

        if (prepFragments.contains(lower)) return true;
        if (equipment != null && equipment.matcher(lower).find()) return true;

        for (String marker : noteMarkers) if (lower.contains(marker)) return true;
        return false;
    }

    private static Set<String> lowered(Collection<String> words) {
        if (words == null) return new HashSet<>();
        return words.stream()
            .filter(w -> w != null && !w.isBlank())
            .map(w -> w.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
