package com.comicguess.dailypuzzle.exception;

public class AlreadySolvedException extends GameplayException {

    public AlreadySolvedException(String puzzleId) {
        super("already_solved", "Puzzle " + puzzleId + " already solved");
    }
}
