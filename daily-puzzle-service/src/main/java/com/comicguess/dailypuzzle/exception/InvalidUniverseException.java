package com.comicguess.dailypuzzle.exception;

public class InvalidUniverseException extends GameplayException {

    public InvalidUniverseException(String universe) {
        super("invalid_universe", "Unknown universe: " + universe);
    }
}
