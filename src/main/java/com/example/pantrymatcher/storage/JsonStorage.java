package com.example.pantrymatcher.storage;

import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.services.IngredientRules;
import com.example.pantrymatcher.services.MatcherSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .registerModule(new JavaTimeModule());

    // database exports carry extra columns (created_at, household_id, ...)
    private final ObjectReader lenient = mapper.reader().without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /** Accepts a bare array of items or an {"items": [...]} wrapper. */
    public List<CanonicalItem> loadCatalog(InputStream in) throws IOException {
        byte[] data = in.readAllBytes();
        List<CanonicalItem> list = null;
        IOException last = null;
        try {
            list = lenient.forType(new TypeReference<List<CanonicalItem>>() {}).readValue(new ByteArrayInputStream(data));
        } catch (IOException ex) { last = ex; }
        if (list == null) {
            try {
                CatalogWrapper wrap = lenient.forType(CatalogWrapper.class).readValue(new ByteArrayInputStream(data));
                if (wrap != null) list = wrap.items;
            } catch (IOException ex) { last = ex; }
        }
        if (list == null) {
            throw new IOException("Failed to parse catalog JSON. Provide an array of canonical items or {\"items\":[...]}.", last);
        }
        return list;
    }

    public static class CatalogWrapper { public List<CanonicalItem> items; }

    public List<IngredientRecord> loadIngredients(InputStream in) throws IOException {
        try {
            return lenient.forType(new TypeReference<List<IngredientRecord>>() {}).readValue(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse ingredients JSON. Expect an array of {id, name, canonicalItemId}.", ex);
        }
    }

    /** Lists present in the file replace the defaults; absent ones keep them. */
    public IngredientRules loadRules(InputStream in) throws IOException {
        try {
            return mapper.readerForUpdating(IngredientRules.defaults()).readValue(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse rules JSON. Expect an object of word lists, e.g. {\"brands\": [..]}.", ex);
        }
    }

    public MatcherSettings loadSettings(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, MatcherSettings.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse matcher settings JSON.", ex);
        }
    }

    public void saveSettings(MatcherSettings settings, File f) throws IOException {
        mapper.writeValue(f, settings);
    }

    public void saveLinkReport(LinkReport report, File f) throws IOException {
        mapper.writeValue(f, report);
    }
}
