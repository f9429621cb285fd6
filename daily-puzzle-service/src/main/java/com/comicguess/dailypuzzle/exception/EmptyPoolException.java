package com.comicguess.dailypuzzle.exception;

import com.comicguess.dailypuzzle.model.Universe;

/**
 * The character pool of a universe is empty. This is a deployment misconfiguration, not a user error.
 */
public class EmptyPoolException extends GameplayException {

    public EmptyPoolException(Universe universe) {
        super("empty_pool", "No characters configured for universe " + universe.getKey());
    }
}
