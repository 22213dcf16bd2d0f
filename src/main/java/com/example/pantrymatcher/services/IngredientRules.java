package com.example.pantrymatcher.services;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Word lists driving the normalizer and the junk classifier. Bound from JSON by
 * {@link com.example.pantrymatcher.storage.JsonStorage#loadRules}; any list left
 * out of the file keeps its default.
 */
public class IngredientRules {
    // normalizer, in the order the lists are applied
    public List<String> modifiers;
    public List<String> brands;
    public Map<String, List<String>> varietals;
    public List<String> prepAdverbs;
    public List<String> prepWords;
    public List<String> stateWords;
    public List<String> descriptors;
    public List<String> notes;
    public List<String> containers;
    public List<String> units;
    public AlternativePolicy alternativePolicy;

    // junk classifier; header markers are matched case-sensitively on the raw line
    public List<String> headerMarkers;
    public List<String> fragments;
    public List<String> prepFragments;
    public List<String> equipment;
    public List<String> noteMarkers;

    public IngredientRules() {}

    public static IngredientRules defaults() {
        IngredientRules r = new IngredientRules();
        r.modifiers = list("low-fat", "lowfat", "reduced-fat", "fat-free", "nonfat", "non-fat",
            "low-sodium", "reduced-sodium", "sodium-free",
            "lite", "light", "reduced", "part-skim", "plain", "extra virgin", "extra-virgin");
        r.brands = list("kirkland", "365", "great value", "member's mark", "store brand", "store-brand", "organic");
        r.varietals = new LinkedHashMap<>();
        r.varietals.put("apple", list("granny smith", "gala", "fuji", "honeycrisp", "red delicious", "tart"));
        r.prepAdverbs = list("finely", "coarsely", "freshly", "thinly", "thickly", "roughly", "lightly");
        r.prepWords = list("chopped", "sliced", "diced", "minced", "grated", "shredded", "crushed", "ground", "whole");
        r.stateWords = list("fresh", "dried", "frozen", "canned", "raw", "roasted", "toasted", "cooked", "prepared",
            "uncooked", "instant", "quick-cooking", "rapid-rise", "ready-to-eat");
        r.descriptors = list("peeled", "seeded", "trimmed", "drained", "rinsed", "scrubbed", "halved", "quartered",
            "pitted", "cubed");
        r.notes = list("divided", "plus more", "to taste", "optional", "if desired", "if needed");
        r.containers = list("bunch", "sprig", "sprigs", "leaves", "leaf", "clove", "cloves", "head", "heads",
            "piece", "pieces", "pinch", "dash", "envelope", "can", "jar", "package", "box", "container");
        r.units = list("cup", "cups", "tablespoon", "tablespoons", "teaspoon", "teaspoons", "tbsp", "tsp",
            "oz", "ounce", "ounces", "lb", "lbs", "pound", "pounds", "g", "gram", "grams", "kg",
            "ml", "liter", "liters", "litre", "litres");
        r.alternativePolicy = AlternativePolicy.FIRST_ONLY;

        r.headerMarkers = list("Ingredient", "Topping:", "Salad:", "Dressing:");
        r.fragments = list(")", "(", "to medium");
        r.prepFragments = list("fresh", "grated", "chopped", "sliced", "diced", "minced", "en", "canned", "cubed",
            "halved", "quartered");
        r.equipment = list("aluminum foil", "foil", "parchment", "paper", "bamboo skewers", "skewers", "toothpicks",
            "popsicle sticks", "craft sticks");
        r.noteMarkers = list("note:", "optional toppings", "necessary tools", "to reduce browning", "adjust to taste",
            "eating smart", "basic soup", "\"logs\"", "\"bugs\"");
        return r;
    }

    private static List<String> list(String... words) { return new ArrayList<>(Arrays.asList(words)); }
}
