package com.comicguess.dailypuzzle.ratelimit;

public enum LimitDimension {
    IP("ip"),
    USER("user");

    private final String label;

    LimitDimension(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
