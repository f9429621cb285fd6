package com.comicguess.dailypuzzle.exception;

public class AuthenticationRequiredException extends GameplayException {

    public AuthenticationRequiredException(String message) {
        super("unauthenticated", message);
    }
}
