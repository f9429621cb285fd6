package com.comicguess.dailypuzzle.exception;

public class UserNotFoundException extends GameplayException {

    public UserNotFoundException(String userId) {
        super("user_not_found", "User " + userId + " not found");
    }
}
