package com.comicguess.dailypuzzle.exception;

public class InvalidGuessException extends GameplayException {

    public InvalidGuessException(String message) {
        super("invalid_guess", message);
    }
}
