package com.sokoban.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Preset puzzles bundled as classpath resources under {@code puzzles/}. The index file lists the
 * preset ids in display order together with their name and difficulty.
 */
public final class PuzzleCatalog {

    private static final Logger LOGGER = Logger.getLogger(PuzzleCatalog.class.getName());
    private static final String DEFAULT_ROOT = "puzzles/";
    private static final String INDEX_FILE = "index.properties";

    private final Map<String, Preset> presets;

    /**
     * A bundled puzzle.
     */
    public record Preset(String id, String name, String difficulty, String puzzle) {

        public Preset {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(difficulty, "difficulty");
            Objects.requireNonNull(puzzle, "puzzle");
        }
    }

    private PuzzleCatalog(Map<String, Preset> presets) {
        this.presets = Collections.unmodifiableMap(presets);
    }

    /**
     * Loads the presets shipped with this library.
     *
     * @throws UncheckedIOException if the index or a listed puzzle cannot be read
     */
    public static PuzzleCatalog load() {
        return load(PuzzleCatalog.class.getClassLoader(), DEFAULT_ROOT);
    }

    public static PuzzleCatalog load(ClassLoader loader, String root) {
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(root, "root");
        Properties index = new Properties();
        try (InputStream input = open(loader, root + INDEX_FILE)) {
            index.load(input);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read puzzle index " + root + INDEX_FILE, ex);
        }

        Map<String, Preset> presets = new LinkedHashMap<>();
        for (String rawId : index.getProperty("ids", "").split(",")) {
            String id = rawId.trim();
            if (id.isEmpty()) {
                continue;
            }
            String name = index.getProperty(id + ".name", id);
            String difficulty = index.getProperty(id + ".difficulty", "unknown");
            presets.put(id, new Preset(id, name, difficulty, readPuzzle(loader, root + id + ".txt")));
        }
        LOGGER.fine(() -> String.format("Loaded %d preset puzzles from %s", presets.size(), root));
        return new PuzzleCatalog(presets);
    }

    public List<Preset> list() {
        return new ArrayList<>(presets.values());
    }

    public Optional<Preset> find(String id) {
        return Optional.ofNullable(presets.get(id));
    }

    public int size() {
        return presets.size();
    }

    private static String readPuzzle(ClassLoader loader, String resource) {
        try (InputStream input = open(loader, resource)) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read puzzle " + resource, ex);
        }
    }

    private static InputStream open(ClassLoader loader, String resource) throws IOException {
        InputStream input = loader.getResourceAsStream(resource);
        if (input == null) {
            throw new IOException("Resource not found: " + resource);
        }
        return input;
    }
}
