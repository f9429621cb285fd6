package com.comicguess.dailypuzzle.scheduler;

import com.comicguess.dailypuzzle.exception.GameplayException;
import com.comicguess.dailypuzzle.model.Universe;
import com.comicguess.dailypuzzle.service.GuessValidator;
import com.comicguess.dailypuzzle.service.PuzzleSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Pre-generates upcoming puzzles and purges data past the retention horizon
 */
@Slf4j
@Component
public class PuzzleMaintenanceJob {

    private final PuzzleSelector puzzleSelector;
    private final GuessValidator guessValidator;
    private final Clock clock;
    private final int daysAhead;
    private final int retentionDays;

    public PuzzleMaintenanceJob(PuzzleSelector puzzleSelector,
                                GuessValidator guessValidator,
                                Clock clock,
                                @Value("${puzzle.schedule.days-ahead:1}") int daysAhead,
                                @Value("${puzzle.retention.days:365}") int retentionDays) {
        this.puzzleSelector = puzzleSelector;
        this.guessValidator = guessValidator;
        this.clock = clock;
        this.daysAhead = daysAhead;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${puzzle.schedule.cron:0 5 0 * * *}", zone = "UTC")
    public void generateUpcomingPuzzles() {
        LocalDate today = LocalDate.now(clock);
        for (int offset = 0; offset <= daysAhead; offset++) {
            generateForDate(today.plusDays(offset));
        }
    }

    /**
     * Create the puzzle of every universe for a date. A failing universe does not stop the others.
     *
     * @return number of universes with a puzzle for the date
     */
    public int generateForDate(LocalDate date) {
        int ready = 0;
        for (Universe universe : Universe.values()) {
            try {
                puzzleSelector.getOrCreatePuzzle(universe, date);
                ready++;
            } catch (GameplayException | DataAccessException e) {
                log.error("Failed to generate {} puzzle for {}: {}", universe.getKey(), date, e.getMessage(), e);
            }
        }
        log.info("Generated puzzles for {}: {}/{} universes", date, ready, Universe.values().length);
        return ready;
    }

    @Scheduled(cron = "${puzzle.retention.cron:0 30 3 * * *}", zone = "UTC")
    public void purgeExpiredData() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        int puzzles = puzzleSelector.cleanupOlderThan(cutoff);
        int attempts = guessValidator.cleanupSubmittedBefore(cutoff.atStartOfDay().toInstant(ZoneOffset.UTC));
        log.info("Retention cleanup before {} removed {} puzzles and {} guess attempts", cutoff, puzzles, attempts);
    }
}
