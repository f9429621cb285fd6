package com.comicguess.dailypuzzle.service;

import com.comicguess.dailypuzzle.entity.Puzzle;
import com.comicguess.dailypuzzle.exception.EmptyPoolException;
import com.comicguess.dailypuzzle.exception.PuzzleNotFoundException;
import com.comicguess.dailypuzzle.model.CharacterProfile;
import com.comicguess.dailypuzzle.model.PuzzleKey;
import com.comicguess.dailypuzzle.model.Universe;
import com.comicguess.dailypuzzle.repository.PuzzleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks and stores the daily puzzle of each universe. The pick is a pure function of
 * (date, universe, pool), so every process and every restart agrees on it.
 */
@Slf4j
@Service
public class PuzzleSelector {

    private final PuzzleRepository puzzleRepository;
    private final CharacterPoolCatalog catalog;

    public PuzzleSelector(PuzzleRepository puzzleRepository, CharacterPoolCatalog catalog) {
        this.puzzleRepository = puzzleRepository;
        this.catalog = catalog;
    }

    /**
     * Get the puzzle for a universe and date, creating it on first access
     */
    @Transactional
    public Puzzle getOrCreatePuzzle(Universe universe, LocalDate date) {
        Optional<Puzzle> existing = puzzleRepository.findByUniverseAndPuzzleDate(universe, date);
        if (existing.isPresent()) {
            return existing.get();
        }

        CharacterProfile selected = selectCharacter(universe, date);
        Puzzle puzzle = puzzleRepository.createIfAbsent(Puzzle.builder()
                .universe(universe)
                .puzzleDate(date)
                .character(selected.getName())
                .aliases(copyAliases(selected.getAliases()))
                .imageKey(selected.getImageKey())
                .build());

        log.info("Puzzle {} ready with character '{}'", puzzle.getPuzzleId(), puzzle.getCharacter());
        return puzzle;
    }

    /**
     * Look up a puzzle without creating it
     */
    @Transactional(readOnly = true)
    public Optional<Puzzle> findPuzzle(Universe universe, LocalDate date) {
        return puzzleRepository.findByUniverseAndPuzzleDate(universe, date);
    }

    /**
     * Deterministic character choice for a universe and date
     */
    public CharacterProfile selectCharacter(Universe universe, LocalDate date) {
        List<CharacterProfile> pool = catalog.poolFor(universe);
        if (pool.isEmpty()) {
            log.error("Cannot select a character for {} on {}: pool is empty", universe.getKey(), date);
            throw new EmptyPoolException(universe);
        }
        return pool.get(selectionIndex(universe, date, pool.size()));
    }

    /**
     * Emergency override: replace the character of an existing puzzle.
     * Breaks determinism for that day on purpose, so the change is logged with old and new values.
     */
    @Transactional
    public Puzzle hotfixPuzzle(Universe universe, LocalDate date, CharacterProfile replacement) {
        if (replacement == null || replacement.getName() == null || replacement.getName().isBlank()) {
            throw new IllegalArgumentException("Replacement character must have a name");
        }
        PuzzleKey key = new PuzzleKey(universe, date);
        Puzzle puzzle = puzzleRepository.findByUniverseAndPuzzleDate(universe, date)
                .orElseThrow(() -> new PuzzleNotFoundException(key));

        String previousCharacter = puzzle.getCharacter();
        List<String> previousAliases = puzzle.getAliases();
        String previousImageKey = puzzle.getImageKey();

        puzzle.setCharacter(replacement.getName().trim());
        puzzle.setAliases(copyAliases(replacement.getAliases()));
        if (replacement.getImageKey() != null) {
            puzzle.setImageKey(replacement.getImageKey());
        }
        Puzzle saved = puzzleRepository.save(puzzle);

        log.warn("HOTFIX APPLIED: puzzle {} character changed from '{}' {} [{}] to '{}' {} [{}]",
                key.toPuzzleId(),
                previousCharacter, previousAliases, previousImageKey,
                saved.getCharacter(), saved.getAliases(), saved.getImageKey());
        return saved;
    }

    /**
     * Retention cleanup. Returns the number of deleted puzzles.
     */
    @Transactional
    public int cleanupOlderThan(LocalDate cutoff) {
        int deleted = puzzleRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} puzzles dated before {}", deleted, cutoff);
        return deleted;
    }

    static int selectionIndex(Universe universe, LocalDate date, int poolSize) {
        long seed = selectionSeed(date + "-" + universe.getKey());
        return (int) (seed % poolSize);
    }

    /**
     * First four bytes of SHA-256(value), big-endian, as an unsigned 32-bit number
     */
    static long selectionSeed(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return Integer.toUnsignedLong(ByteBuffer.wrap(hash, 0, 4).getInt());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<String> copyAliases(List<String> aliases) {
        return aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
    }
}
