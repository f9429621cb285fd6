package com.comicguess.dailypuzzle.model;

import com.comicguess.dailypuzzle.exception.InvalidUniverseException;

import java.util.Locale;

/**
 * Comic universes that each get their own daily puzzle
 */
public enum Universe {
    MARVEL("marvel", "Marvel"),

    DC("dc", "DC"),

    IMAGE("image", "Image");

    private final String key;
    private final String displayName;

    Universe(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Lowercase key used in puzzle ids, image paths and selection seeds
     */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a universe from its key, ignoring case ("DC" and "dc" are the same universe)
     */
    public static Universe fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidUniverseException(key);
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Universe universe : values()) {
            if (universe.key.equals(normalized)) {
                return universe;
            }
        }
        throw new InvalidUniverseException(key);
    }
}
