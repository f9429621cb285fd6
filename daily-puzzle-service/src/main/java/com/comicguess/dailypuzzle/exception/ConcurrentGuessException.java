package com.comicguess.dailypuzzle.exception;

public class ConcurrentGuessException extends GameplayException {

    public ConcurrentGuessException(String puzzleId) {
        super("concurrent_guess", "Another guess for puzzle " + puzzleId + " was recorded at the same time, retry");
    }
}
