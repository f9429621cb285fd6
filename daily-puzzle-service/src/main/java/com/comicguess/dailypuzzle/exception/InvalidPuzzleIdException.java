package com.comicguess.dailypuzzle.exception;

public class InvalidPuzzleIdException extends GameplayException {

    public InvalidPuzzleIdException(String puzzleId) {
        super("invalid_puzzle_id", "Puzzle id must look like YYYYMMDD-universe, got: " + puzzleId);
    }
}
