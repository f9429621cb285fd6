package com.comicguess.dailypuzzle.model;

/**
 * Per-user state of one puzzle. SOLVED and EXHAUSTED are terminal.
 */
public enum GameState {
    NOT_STARTED,
    IN_PROGRESS,
    SOLVED,
    EXHAUSTED;

    public static GameState of(boolean solved, int attemptsUsed, int maxAttempts) {
        if (solved) {
            return SOLVED;
        }
        if (attemptsUsed >= maxAttempts) {
            return EXHAUSTED;
        }
        return attemptsUsed == 0 ? NOT_STARTED : IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == SOLVED || this == EXHAUSTED;
    }
}
