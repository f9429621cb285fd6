package com.comicguess.dailypuzzle.model;

import com.comicguess.dailypuzzle.exception.InvalidPuzzleIdException;
import com.comicguess.dailypuzzle.exception.InvalidUniverseException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Natural key of a puzzle. The public id format is {@code YYYYMMDD-universe}, e.g. {@code 20240115-marvel}.
 */
public record PuzzleKey(Universe universe, LocalDate date) {

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public String toPuzzleId() {
        return date.format(ID_DATE) + "-" + universe.getKey();
    }

    public static PuzzleKey parse(String puzzleId) {
        if (puzzleId == null) {
            throw new InvalidPuzzleIdException(null);
        }
        int dash = puzzleId.indexOf('-');
        if (dash != 8) {
            throw new InvalidPuzzleIdException(puzzleId);
        }
        try {
            LocalDate date = LocalDate.parse(puzzleId.substring(0, dash), ID_DATE);
            Universe universe = Universe.fromKey(puzzleId.substring(dash + 1));
            return new PuzzleKey(universe, date);
        } catch (DateTimeParseException | InvalidUniverseException e) {
            throw new InvalidPuzzleIdException(puzzleId);
        }
    }
}
