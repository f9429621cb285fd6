package com.comicguess.dailypuzzle.exception;

public class AttemptsExhaustedException extends GameplayException {

    public AttemptsExhaustedException(String puzzleId, int maxAttempts) {
        super("attempts_exhausted", "Maximum attempts (" + maxAttempts + ") reached for puzzle " + puzzleId);
    }
}
