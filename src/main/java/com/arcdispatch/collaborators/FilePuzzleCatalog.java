package com.arcdispatch.collaborators;

import com.arcdispatch.AppLogger;
import com.arcdispatch.models.Puzzle;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Reads ARC task files ({@code <id>.json} with train/test arrays) from a directory and caches them.
 */
public class FilePuzzleCatalog implements PuzzleCatalog {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, Puzzle> cache = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public FilePuzzleCatalog(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Puzzle findById(String puzzleId) {
        if (puzzleId == null || !SAFE_ID.matcher(puzzleId).matches()) {
            return null;
        }
        Puzzle cached = cache.get(puzzleId);
        if (cached != null) {
            return cached;
        }
        Path file = directory.resolve(puzzleId + ".json");
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            Puzzle puzzle = objectMapper.readValue(file.toFile(), Puzzle.class);
            puzzle.setId(puzzleId);
            cache.put(puzzleId, puzzle);
            return puzzle;
        } catch (IOException e) {
            logger.warn("[FilePuzzleCatalog] Failed to read puzzle " + puzzleId + ": " + e.getMessage());
            throw new IllegalStateException("Puzzle file " + puzzleId + " is unreadable", e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
