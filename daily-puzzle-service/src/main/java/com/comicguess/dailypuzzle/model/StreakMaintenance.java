package com.comicguess.dailypuzzle.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether today's play keeps a universe streak alive
 */
public enum StreakMaintenance {
    COMPLETED("completed", "Puzzle solved - streak maintained"),
    PENDING("pending", "Puzzle not finished - streak at risk"),
    FAILED("failed", "Puzzle failed - streak will be reset"),
    NO_PUZZLE("no_puzzle", "No puzzle available today");

    private final String code;
    private final String message;

    StreakMaintenance(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public static StreakMaintenance of(GameState state) {
        switch (state) {
            case SOLVED:
                return COMPLETED;
            case EXHAUSTED:
                return FAILED;
            default:
                return PENDING;
        }
    }
}
