package com.comicguess.dailypuzzle.service;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes character names and guesses so that case, spacing, punctuation and
 * hyphen/space variants ("Spider-Man", "spider man", "SPIDERMAN") compare equal.
 * Diacritics are not folded.
 */
public final class GuessNormalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private GuessNormalizer() {
    }

    /**
     * Lowercase, drop punctuation except hyphens inside words, collapse whitespace
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String stripped = DISALLOWED.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
        StringBuilder normalized = new StringBuilder();
        for (String token : WHITESPACE.split(stripped.trim())) {
            String word = trimHyphens(token);
            if (word.isEmpty()) {
                continue;
            }
            if (normalized.length() > 0) {
                normalized.append(' ');
            }
            normalized.append(word);
        }
        return normalized.toString();
    }

    /**
     * Normalized form with spaces and hyphens removed
     */
    public static String compact(String normalized) {
        return normalized.replace(" ", "").replace("-", "");
    }

    /**
     * True when the guess names the character or one of its aliases
     */
    public static boolean matches(String rawGuess, String characterName, Collection<String> aliases) {
        String guess = normalize(rawGuess);
        if (guess.isEmpty()) {
            return false;
        }
        String compactGuess = compact(guess);

        if (nameMatches(guess, compactGuess, characterName)) {
            return true;
        }
        if (aliases != null) {
            for (String alias : aliases) {
                if (nameMatches(guess, compactGuess, alias)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean nameMatches(String guess, String compactGuess, String name) {
        String normalizedName = normalize(name);
        if (normalizedName.isEmpty()) {
            return false;
        }
        return guess.equals(normalizedName) || compactGuess.equals(compact(normalizedName));
    }

    private static String trimHyphens(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '-') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '-') {
            end--;
        }
        return token.substring(start, end);
    }
}
