package com.arcdispatch.collaborators;

import com.arcdispatch.models.Puzzle;

/**
 * Source of puzzles by id.
 */
public interface PuzzleCatalog {

    /**
     * @return the puzzle, or null when the id is unknown
     */
    Puzzle findById(String puzzleId);
}
