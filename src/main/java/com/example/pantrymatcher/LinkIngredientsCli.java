package com.example.pantrymatcher;

import com.example.pantrymatcher.engine.BatchLinker;
import com.example.pantrymatcher.engine.CanonicalizationEngine;
import com.example.pantrymatcher.engine.LinkSummary;
import com.example.pantrymatcher.model.CanonicalItem;
import com.example.pantrymatcher.model.IngredientRecord;
import com.example.pantrymatcher.services.CatalogAudit;
import com.example.pantrymatcher.services.IngredientRules;
import com.example.pantrymatcher.services.MatcherSettings;
import com.example.pantrymatcher.services.ThresholdAcceptancePolicy;
import com.example.pantrymatcher.storage.JsonStorage;
import com.example.pantrymatcher.storage.LinkReport;
import com.example.pantrymatcher.storage.SettingsStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Links ingredient rows from a JSON file to a catalog snapshot and prints what it decided.
 *
 * <pre>
 * LinkIngredientsCli &lt;catalog.json&gt; &lt;ingredients.json&gt; [--rules f] [--settings f] [--out f] [--audit]
 * LinkIngredientsCli --sample [--audit]
 * </pre>
 */
public class LinkIngredientsCli {
    private static final Logger log = LoggerFactory.getLogger(LinkIngredientsCli.class);
    static final String SAMPLE_CATALOG = "/sample-data/catalog.json";
    static final String SAMPLE_INGREDIENTS = "/sample-data/ingredients.json";

    public static void main(String[] args) {
        try {
            System.exit(run(args, System.out));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while linking", ex);
            System.exit(1);
        }
    }

    static int run(String[] args, PrintStream out) throws InterruptedException {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            out.println("Usage: <catalog.json> <ingredients.json> [--rules f] [--settings f] [--out f] [--audit] | --sample [--audit]");
            return 2;
        }

        JsonStorage storage = new JsonStorage();
        List<CanonicalItem> catalog;
        List<IngredientRecord> records;
        IngredientRules rules;
        MatcherSettings settings;
        try (InputStream catalogIn = open(opts.catalog, SAMPLE_CATALOG, opts.sample);
             InputStream recordsIn = open(opts.ingredients, SAMPLE_INGREDIENTS, opts.sample)) {
            catalog = storage.loadCatalog(catalogIn);
            records = storage.loadIngredients(recordsIn);
            rules = loadRules(storage, opts.rules);
            settings = opts.settings == null ? new SettingsStorage().load() : new SettingsStorage(opts.settings).load();
        } catch (IOException ex) {
            log.error("Could not load input: {}", ex.getMessage(), ex);
            return 1;
        }
        log.info("Loaded {} canonical items and {} ingredient records", catalog.size(), records.size());

        CanonicalizationEngine engine;
        BatchLinker linker;
        try {
            engine = new CanonicalizationEngine(catalog, rules, settings);
            linker = new BatchLinker(engine, ThresholdAcceptancePolicy.from(settings), settings.threads);
        } catch (IllegalArgumentException ex) {
            out.println("Invalid catalog or settings: " + ex.getMessage());
            return 2;
        }
        if (opts.audit) {
            out.println("Catalog audit:");
            out.print(new CatalogAudit(engine.normalizer(), engine.matcher()).audit(catalog));
            out.println();
        }

        LinkReport report = new LinkReport();
        LinkSummary summary = linker.link(records, (record, match) -> {
            report.links.add(new LinkReport.Link(record, match));
            out.printf("  ok  \"%s\" -> \"%s\" (%s, %d)%n", record.name, match.matchedLabel, match.tier, match.score);
        });
        report.summary = summary;

        for (String name : summary.deferred) out.printf("  --  \"%s\" deferred for review%n", name);
        out.println();
        out.println(summary);

        if (opts.out != null) {
            try {
                storage.saveLinkReport(report, opts.out.toFile());
                log.info("Wrote link report to {}", opts.out);
            } catch (IOException ex) {
                log.error("Could not write link report to {}", opts.out, ex);
                return 1;
            }
        }
        return 0;
    }

    private static IngredientRules loadRules(JsonStorage storage, Path path) throws IOException {
        if (path == null) return IngredientRules.defaults();
        try (InputStream in = Files.newInputStream(path)) {
            return storage.loadRules(in);
        }
    }

    private static InputStream open(Path path, String sampleResource, boolean sample) throws IOException {
        if (!sample) return Files.newInputStream(path);
        InputStream in = LinkIngredientsCli.class.getResourceAsStream(sampleResource);
        if (in == null) throw new FileNotFoundException("Missing bundled resource " + sampleResource);
        return in;
    }

    static final class Options {
        Path catalog;
        Path ingredients;
        Path rules;
        Path settings;
        Path out;
        boolean audit;
        boolean sample;

        static Options parse(String[] args) {
            Options o = new Options();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--sample" -> o.sample = true;
                    case "--audit" -> o.audit = true;
                    case "--rules" -> o.rules = Path.of(value(args, ++i, a));
                    case "--settings" -> o.settings = Path.of(value(args, ++i, a));
                    case "--out" -> o.out = Path.of(value(args, ++i, a));
                    default -> {
                        if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option " + a);
                        positional.add(a);
                    }
                }
            }
            if (!o.sample) {
                if (positional.size() != 2) throw new IllegalArgumentException("Expected a catalog file and an ingredients file.");
                o.catalog = Path.of(positional.get(0));
                o.ingredients = Path.of(positional.get(1));
            }
            return o;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
            return args[i];
        }
    }
}
