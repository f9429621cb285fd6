package com.comicguess.dailypuzzle.exception;

/**
 * Base class for gameplay failures. The error code is stable and rendered to clients as-is.
 */
public abstract class GameplayException extends RuntimeException {

    private final String errorCode;

    protected GameplayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
