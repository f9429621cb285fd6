package com.comicguess.dailypuzzle.service;

import com.comicguess.dailypuzzle.dto.DailyProgressResponse;
import com.comicguess.dailypuzzle.dto.GuessResponse;
import com.comicguess.dailypuzzle.dto.PuzzleResponse;
import com.comicguess.dailypuzzle.dto.PuzzleStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakMaintenanceStatus;
import com.comicguess.dailypuzzle.dto.StreakStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakSummary;
import com.comicguess.dailypuzzle.dto.UniverseProgress;
import com.comicguess.dailypuzzle.entity.Puzzle;
import com.comicguess.dailypuzzle.exception.ConcurrentGuessException;
import com.comicguess.dailypuzzle.exception.InvalidDateException;
import com.comicguess.dailypuzzle.exception.PuzzleNotFoundException;
import com.comicguess.dailypuzzle.model.GameState;
import com.comicguess.dailypuzzle.model.PuzzleKey;
import com.comicguess.dailypuzzle.model.StreakMaintenance;
import com.comicguess.dailypuzzle.model.Universe;
import com.comicguess.dailypuzzle.util.KeyedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for the HTTP layer. Resolves today's puzzle and serializes guesses per (user, puzzle).
 */
@Slf4j
@Service
public class GameService {

    private final PuzzleSelector puzzleSelector;
    private final GuessValidator guessValidator;
    private final StreakTracker streakTracker;
    private final KeyedLocks locks;
    private final Clock clock;

    public GameService(PuzzleSelector puzzleSelector,
                       GuessValidator guessValidator,
                       StreakTracker streakTracker,
                       KeyedLocks locks,
                       Clock clock) {
        this.puzzleSelector = puzzleSelector;
        this.guessValidator = guessValidator;
        this.streakTracker = streakTracker;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Today's date in UTC
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Today's puzzle of a universe, without the answer
     */
    public PuzzleResponse getTodaysPuzzle(String universeKey) {
        Universe universe = Universe.fromKey(universeKey);
        Puzzle puzzle = puzzleSelector.getOrCreatePuzzle(universe, today());
        return PuzzleResponse.builder()
                .puzzleId(puzzle.getPuzzleId())
                .universe(universe.getKey())
                .activeDate(puzzle.getPuzzleDate())
                .build();
    }

    /**
     * Submit a guess against today's puzzle of a universe
     */
    public GuessResponse submitGuess(String userId, String universeKey, String rawGuess) {
        Universe universe = Universe.fromKey(universeKey);
        Puzzle puzzle = puzzleSelector.getOrCreatePuzzle(universe, today());

        ReentrantLock lock = locks.lockFor(userId + ":" + puzzle.getId());
        lock.lock();
        try {
            return guessValidator.submitGuess(userId, puzzle, rawGuess);
        } catch (DataIntegrityViolationException e) {
            // Another process recorded the same attempt number first
            log.warn("Concurrent guess for user {} on puzzle {}: {}", userId, puzzle.getPuzzleId(), e.getMessage());
            throw new ConcurrentGuessException(puzzle.getPuzzleId());
        } finally {
            lock.unlock();
        }
    }

    public PuzzleStatusResponse getPuzzleStatus(String userId, String puzzleId) {
        PuzzleKey key = PuzzleKey.parse(puzzleId);
        Puzzle puzzle = puzzleSelector.findPuzzle(key.universe(), key.date())
                .orElseThrow(() -> new PuzzleNotFoundException(key));
        return guessValidator.getStatus(userId, puzzle);
    }

    public Map<String, StreakSummary> getStreaks(String userId) {
        return streakTracker.getStreaks(userId);
    }

    public StreakSummary getStreak(String userId, String universeKey) {
        return streakTracker.getStreak(userId, Universe.fromKey(universeKey));
    }

    /**
     * Progress on every universe's puzzle for a day (today when {@code date} is null).
     * Puzzles are looked up, never created.
     */
    public DailyProgressResponse getDailyProgress(String userId, String date) {
        LocalDate day = date == null || date.isBlank() ? today() : parseDate(date);

        Map<String, UniverseProgress> universes = new LinkedHashMap<>();
        for (Universe universe : Universe.values()) {
            universes.put(universe.getKey(), progressFor(userId, universe, day));
        }
        return DailyProgressResponse.builder()
                .date(day)
                .userId(userId)
                .universes(universes)
                .build();
    }

    /**
     * Current streaks and whether today's play keeps each of them
     */
    public StreakStatusResponse getStreakStatus(String userId) {
        LocalDate day = today();
        Map<String, StreakSummary> streaks = streakTracker.getStreaks(userId);

        Map<String, StreakMaintenanceStatus> maintenance = new LinkedHashMap<>();
        for (Universe universe : Universe.values()) {
            UniverseProgress progress = progressFor(userId, universe, day);
            StreakMaintenance status = progress.isPuzzleAvailable()
                    ? StreakMaintenance.of(GameState.of(progress.getSolved(), progress.getAttemptsUsed(),
                            GuessValidator.MAX_ATTEMPTS))
                    : StreakMaintenance.NO_PUZZLE;
            maintenance.put(universe.getKey(), StreakMaintenanceStatus.builder()
                    .status(status)
                    .message(status.getMessage())
                    .attemptsRemaining(status == StreakMaintenance.PENDING ? progress.getAttemptsRemaining() : null)
                    .build());
        }
        return StreakStatusResponse.builder()
                .userId(userId)
                .date(day)
                .streaks(streaks)
                .maintenance(maintenance)
                .build();
    }

    private UniverseProgress progressFor(String userId, Universe universe, LocalDate day) {
        PuzzleKey key = new PuzzleKey(universe, day);
        Optional<Puzzle> puzzle = puzzleSelector.findPuzzle(universe, day);
        if (puzzle.isEmpty()) {
            return UniverseProgress.builder()
                    .puzzleAvailable(false)
                    .puzzleId(key.toPuzzleId())
                    .build();
        }
        PuzzleStatusResponse status = guessValidator.getStatus(userId, puzzle.get());
        return UniverseProgress.builder()
                .puzzleAvailable(true)
                .puzzleId(status.getPuzzleId())
                .solved(status.isSolved())
                .attemptsUsed(status.getAttemptsUsed())
                .attemptsRemaining(status.getAttemptsRemaining())
                .canGuess(status.isCanGuess())
                .guesses(status.getGuesses())
                .build();
    }

    private static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(date);
        }
    }
}
