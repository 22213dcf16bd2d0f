package com.example.pantrymatcher.storage;

import com.example.pantrymatcher.services.MatcherSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Matcher settings kept in {@code ~/.pantry-matcher/matcher.json} unless a path is given. */
public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);

    private final JsonStorage json = new JsonStorage();
    private final Path file;

    public SettingsStorage() {
        this(Path.of(System.getProperty("user.home"), ".pantry-matcher", "matcher.json"));
    }

    public SettingsStorage(Path file) {
        this.file = file;
    }

    /** Falls back to defaults when the file is missing or unreadable. */
    public MatcherSettings load() {
        if (!Files.exists(file)) {
            log.debug("No matcher settings at {}, using defaults", file);
            return MatcherSettings.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return json.loadSettings(in);
        } catch (IOException ex) {
            log.warn("Ignoring unreadable matcher settings at {}: {}", file, ex.getMessage());
            return MatcherSettings.defaults();
        }
    }

    public void save(MatcherSettings s) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        json.saveSettings(s, file.toFile());
    }

    public Path file() { return file; }
}
