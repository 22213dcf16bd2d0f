package com.example.pantrymatcher.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reduces a free-text ingredient phrase to the words that identify the
 * ingredient: "2 tablespoons extra virgin olive oil, divided" becomes
 * "olive oil". Pure and thread-safe; all patterns are compiled up front.
 *
 * <p>The rule pipeline is re-applied until the text stops changing, so
 * {@code normalize(normalize(s)).equals(normalize(s))} for every input.
 */
public class IngredientNormalizer {
    private static final Pattern LEADING_S = Pattern.compile("^s\\s+");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern ALTERNATIVE = Pattern.compile("\\s+or\\s+[\\p{L}\\p{N}']+(?:\\s+([\\p{L}\\p{N}']+))?");
    private static final Pattern NUMBER = Pattern.compile("(?:\\b\\d+(?:[./]\\d+)?|[\\u00BC-\\u00BE\\u2150-\\u215E])\\s*");
    private static final Pattern SEPARATORS = Pattern.compile("[,;()\\[\\]]+");
    private static final Pattern DASH = Pattern.compile("\\s*[-\\u2010-\\u2015]\\s*");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final Pattern modifiers;
    private final List<Pattern> varietals;
    private final Pattern prepAdverbs;
    private final Pattern prepWords;
    private final Pattern stateWords;
    private final Pattern descriptors;
    private final Pattern notes;
    private final Pattern containers;
    private final Pattern units;
    private final AlternativePolicy alternativePolicy;

    public IngredientNormalizer() {
        this(IngredientRules.defaults());
    }

    public IngredientNormalizer(IngredientRules rules) {
        Objects.requireNonNull(rules, "rules");
        List<String> modifierWords = new ArrayList<>();
        if (rules.modifiers != null) modifierWords.addAll(rules.modifiers);
        if (rules.brands != null) modifierWords.addAll(rules.brands);
        this.modifiers = words(modifierWords, "");
        this.varietals = new ArrayList<>();
        if (rules.varietals != null) {
            for (Map.Entry<String, List<String>> e : rules.varietals.entrySet()) {
                Pattern p = varietalPattern(e.getKey(), e.getValue());
                if (p != null) varietals.add(p);
            }
        }
        this.prepAdverbs = words(rules.prepAdverbs, "");
        this.prepWords = words(rules.prepWords, "");
        this.stateWords = words(rules.stateWords, "");
        this.descriptors = words(rules.descriptors, "");
        this.notes = words(rules.notes, "");
        this.containers = words(rules.containers, "\\s+(?:of\\s+)?");
        this.units = words(rules.units, "");
        this.alternativePolicy = rules.alternativePolicy == null ? AlternativePolicy.FIRST_ONLY : rules.alternativePolicy;
    }

    /** Never throws; {@code null} and blank input give the empty string. */
    public String normalize(String raw) {
        if (raw == null) return "";
        String current = raw;
        // every pass after the first only shortens the text, so this bound is never the reason to stop
        for (int pass = 0; pass <= raw.length() + 1; pass++) {
            String next = applyRules(current);
            if (next.equals(current)) return next;
            current = next;
        }
        return current;
    }

    String applyRules(String input) {
        String s = input.replace('\u00A0', ' ').toLowerCase(Locale.ROOT).trim();
        s = LEADING_S.matcher(s).replaceFirst("");

        s = strip(modifiers, s);
        for (Pattern varietal : varietals) s = varietal.matcher(s).replaceAll("");

        s = strip(prepAdverbs, s);
        s = strip(prepWords, s);
        s = strip(stateWords, s);
        s = strip(descriptors, s);
        s = strip(notes, s);

        s = strip(containers, s);

        s = PARENTHETICAL.matcher(s).replaceAll("");
        s = resolveAlternatives(s);

        s = strip(units, s);
        s = NUMBER.matcher(s).replaceAll("");

        s = SEPARATORS.matcher(s).replaceAll(" ");
        s = DASH.matcher(s).replaceAll(" ");
        s = SPACES.matcher(s).replaceAll(" ");
        return s.trim();
    }

    private String resolveAlternatives(String s) {
        Matcher m = ALTERNATIVE.matcher(s);
        if (!m.find()) return s;
        StringBuilder sb = new StringBuilder();
        do {
            String headNoun = m.group(1);
            String replacement = alternativePolicy == AlternativePolicy.FIRST_WITH_HEAD_NOUN && headNoun != null
                ? " " + headNoun : "";
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }

    private static String strip(Pattern p, String s) {
        return p == null ? s : p.matcher(s).replaceAll("");
    }

    /** Whole-word alternation, longest entries first so "reduced-fat" is tried before "reduced". */
    static Pattern words(Collection<String> words, String suffix) {
        String alternation = alternation(words);
        return alternation.isEmpty() ? null : Pattern.compile("\\b(?:" + alternation + ")\\b" + suffix);
    }

    private static Pattern varietalPattern(String baseNoun, Collection<String> names) {
        if (baseNoun == null || baseNoun.isBlank()) return null;
        String alternation = alternation(names);
        if (alternation.isEmpty()) return null;
        return Pattern.compile("\\b(?:" + alternation + ")\\s+(?=" + Pattern.quote(baseNoun.trim().toLowerCase(Locale.ROOT)) + ")");
    }

    private static String alternation(Collection<String> words) {
        if (words == null) return "";
        return words.stream()
            .filter(w -> w != null && !w.isBlank())
            .map(w -> w.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    }
}
