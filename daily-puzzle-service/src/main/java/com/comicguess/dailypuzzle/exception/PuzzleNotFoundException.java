package com.comicguess.dailypuzzle.exception;

import com.comicguess.dailypuzzle.model.PuzzleKey;

public class PuzzleNotFoundException extends GameplayException {

    public PuzzleNotFoundException(PuzzleKey key) {
        super("puzzle_not_found", "Puzzle " + key.toPuzzleId() + " not found");
    }
}
