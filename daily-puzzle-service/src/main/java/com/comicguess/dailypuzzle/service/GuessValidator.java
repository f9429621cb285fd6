package com.comicguess.dailypuzzle.service;

import com.comicguess.dailypuzzle.dto.GuessResponse;
import com.comicguess.dailypuzzle.dto.PuzzleStatusResponse;
import com.comicguess.dailypuzzle.entity.GuessAttempt;
import com.comicguess.dailypuzzle.entity.Puzzle;
import com.comicguess.dailypuzzle.entity.UserStreak;
import com.comicguess.dailypuzzle.exception.AlreadySolvedException;
import com.comicguess.dailypuzzle.exception.AttemptsExhaustedException;
import com.comicguess.dailypuzzle.exception.InvalidGuessException;
import com.comicguess.dailypuzzle.exception.UserNotFoundException;
import com.comicguess.dailypuzzle.model.GameState;
import com.comicguess.dailypuzzle.repository.GuessAttemptRepository;
import com.comicguess.dailypuzzle.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Attempt state machine of one user on one puzzle:
 * NOT_STARTED -> IN_PROGRESS -> SOLVED | EXHAUSTED.
 * Callers must serialize submissions per (user, puzzle).
 */
@Slf4j
@Service
public class GuessValidator {

    public static final int MAX_ATTEMPTS = 6;
    public static final int MAX_GUESS_LENGTH = 100;

    private final GuessAttemptRepository guessRepository;
    private final UserRepository userRepository;
    private final StreakTracker streakTracker;
    private final Clock clock;

    public GuessValidator(GuessAttemptRepository guessRepository,
                          UserRepository userRepository,
                          StreakTracker streakTracker,
                          Clock clock) {
        this.guessRepository = guessRepository;
        this.userRepository = userRepository;
        this.streakTracker = streakTracker;
        this.clock = clock;
    }

    /**
     * Evaluate and record one guess. Terminal states reject further guesses without recording anything.
     */
    @Transactional
    public GuessResponse submitGuess(String userId, Puzzle puzzle, String rawGuess) {
        if (userId == null || !userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        String puzzleId = puzzle.getPuzzleId();

        if (guessRepository.existsByUserIdAndPuzzleIdAndCorrectTrue(userId, puzzle.getId())) {
            throw new AlreadySolvedException(puzzleId);
        }
        int attemptsUsed = (int) guessRepository.countByUserIdAndPuzzleId(userId, puzzle.getId());
        if (attemptsUsed >= MAX_ATTEMPTS) {
            throw new AttemptsExhaustedException(puzzleId, MAX_ATTEMPTS);
        }

        String normalized = validateGuess(rawGuess);
        boolean correct = GuessNormalizer.matches(rawGuess, puzzle.getCharacter(), puzzle.getAliases());
        int attemptNumber = attemptsUsed + 1;

        // Flush now so a racing writer for the same attempt number fails here, not at commit
        guessRepository.saveAndFlush(GuessAttempt.builder()
                .userId(userId)
                .puzzleId(puzzle.getId())
                .attemptNumber(attemptNumber)
                .guess(rawGuess.trim())
                .normalizedGuess(normalized)
                .correct(correct)
                .submittedAt(clock.instant())
                .build());

        GameState state = GameState.of(correct, attemptNumber, MAX_ATTEMPTS);
        int streak;
        if (state.isTerminal()) {
            UserStreak updated = streakTracker.recordOutcome(
                    userId, puzzle.getUniverse(), puzzle.getPuzzleDate(), correct);
            streak = updated.getCurrentStreak();
            log.info("User {} finished puzzle {} as {} on attempt {}", userId, puzzleId, state, attemptNumber);
        } else {
            streak = streakTracker.currentStreak(userId, puzzle.getUniverse());
        }

        return GuessResponse.builder()
                .puzzleId(puzzleId)
                .correct(correct)
                .character(correct ? puzzle.getCharacter() : null)
                .imageKey(correct ? puzzle.getImageKey() : null)
                .attemptNumber(attemptNumber)
                .attemptsRemaining(MAX_ATTEMPTS - attemptNumber)
                .maxAttempts(MAX_ATTEMPTS)
                .gameOver(state.isTerminal())
                .streak(streak)
                .build();
    }

    /**
     * Where the user stands on a puzzle
     */
    @Transactional(readOnly = true)
    public PuzzleStatusResponse getStatus(String userId, Puzzle puzzle) {
        List<GuessAttempt> attempts = guessRepository
                .findByUserIdAndPuzzleIdOrderByAttemptNumberAsc(userId, puzzle.getId());
        boolean solved = attempts.stream().anyMatch(GuessAttempt::isCorrect);
        int attemptsUsed = attempts.size();
        GameState state = GameState.of(solved, attemptsUsed, MAX_ATTEMPTS);

        return PuzzleStatusResponse.builder()
                .puzzleId(puzzle.getPuzzleId())
                .state(state)
                .canGuess(!state.isTerminal())
                .solved(solved)
                .attemptsUsed(attemptsUsed)
                .attemptsRemaining(Math.max(0, MAX_ATTEMPTS - attemptsUsed))
                .maxAttempts(MAX_ATTEMPTS)
                .guesses(attempts.stream().map(GuessAttempt::getGuess).toList())
                .build();
    }

    /**
     * Retention cleanup. Returns the number of deleted attempts.
     */
    @Transactional
    public int cleanupSubmittedBefore(Instant cutoff) {
        int deleted = guessRepository.deleteSubmittedBefore(cutoff);
        log.info("Deleted {} guess attempts submitted before {}", deleted, cutoff);
        return deleted;
    }

    private static String validateGuess(String rawGuess) {
        if (rawGuess == null || rawGuess.isBlank()) {
            throw new InvalidGuessException("Guess cannot be empty");
        }
        if (rawGuess.trim().length() > MAX_GUESS_LENGTH) {
            throw new InvalidGuessException("Guess cannot be longer than " + MAX_GUESS_LENGTH + " characters");
        }
        String normalized = GuessNormalizer.normalize(rawGuess);
        if (normalized.isEmpty()) {
            throw new InvalidGuessException("Guess must contain letters or digits");
        }
        return normalized;
    }
}
