package com.example.pantrymatcher;

import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.services.AuditReport;
import com.example.pantrymatcher.services.CatalogAudit;
import com.example.pantrymatcher.services.IngredientMatcher;
import com.example.pantrymatcher.services.IngredientNormalizer;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class CatalogAuditTests {
    private final CatalogAudit audit = new CatalogAudit(new IngredientNormalizer(), new IngredientMatcher());

    @Test
    void reports_every_kind_of_defect() {
        List<CanonicalItem> catalog = List.of(
            new CanonicalItem("a", "milk", List.of("whole milk"), "dairy"),
            new CanonicalItem("b", "green onion", List.of("scallion"), "produce"),
            new CanonicalItem("c", "scallion", List.of(), "produce"),
            new CanonicalItem("d", "Olive Oil", List.of(), "pantry"),
            new CanonicalItem("e", "extra virgin olive oil", List.of(), "pantry"),
            new CanonicalItem("f", "fresh", List.of(), null));

        AuditReport r = audit.audit(catalog);

        assertEquals(6, r.totalItems);
        assertEquals(2, r.itemsWithAliases);
        assertEquals(2, r.totalAliases);
        assertEquals(2.0 / 6, r.averageAliases, 1e-9);

        assertEquals(List.of("milk [a] lists 'whole milk'"), r.selfAliases);
        assertEquals(List.of("'olive oil': Olive Oil [d], extra virgin olive oil [e]"), r.duplicateNames);
        assertEquals(List.of("'scallion' of green onion [b] also resolves to scallion [c]"), r.aliasCollisions);
        assertEquals(List.of("fresh [f] normalizes to ''"), r.namesWithoutSignal);
        assertEquals(4, r.defectCount());
    }

    @Test
    void categories_are_counted_largest_first() {
        List<CanonicalItem> catalog = List.of(
            new CanonicalItem("1", "milk", List.of(), "dairy"),
            new CanonicalItem("2", "onion", List.of(), "produce"),
            new CanonicalItem("3", "carrot", List.of(), "produce"),
            new CanonicalItem("4", "salt", List.of(), " "));

        AuditReport r = audit.audit(catalog);
        assertEquals(List.of("produce", "dairy", "uncategorized"), List.copyOf(r.itemsByCategory.keySet()));
        assertEquals(2, r.itemsByCategory.get("produce"));
        assertEquals(0, r.defectCount());
        assertTrue(r.toString().startsWith("Items: 4"));
    }

    @Test
    void clean_or_missing_catalog_has_no_defects() {
        assertEquals(0, audit.audit(null).totalItems);
        assertEquals(0.0, audit.audit(List.of()).averageAliases);
        AuditReport r = audit.audit(List.of(new CanonicalItem("1", "garlic", "garlic clove")));
        assertEquals(0, r.defectCount());
        assertFalse(r.toString().contains("Self-aliases"));
    }
}
