package com.comicguess.dailypuzzle.exception;

public class InvalidDateException extends GameplayException {

    public InvalidDateException(String date) {
        super("invalid_date", "Date must look like YYYY-MM-DD, got: " + date);
    }
}
