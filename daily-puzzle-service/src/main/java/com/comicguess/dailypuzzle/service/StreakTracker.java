package com.comicguess.dailypuzzle.service;

import com.comicguess.dailypuzzle.dto.StreakSummary;
import com.comicguess.dailypuzzle.entity.UserStreak;
import com.comicguess.dailypuzzle.exception.UserNotFoundException;
import com.comicguess.dailypuzzle.model.Universe;
import com.comicguess.dailypuzzle.repository.UserRepository;
import com.comicguess.dailypuzzle.repository.UserStreakRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains per-universe consecutive-day streaks. Callers record an outcome once per
 * user, universe and day, when the puzzle reaches a terminal state.
 */
@Slf4j
@Service
public class StreakTracker {

    private final UserStreakRepository streakRepository;
    private final UserRepository userRepository;

    public StreakTracker(UserStreakRepository streakRepository, UserRepository userRepository) {
        this.streakRepository = streakRepository;
        this.userRepository = userRepository;
    }

    /**
     * Record the terminal outcome of a day's puzzle
     */
    @Transactional
    public UserStreak recordOutcome(String userId, Universe universe, LocalDate date, boolean success) {
        requireUser(userId);

        Optional<UserStreak> existing = streakRepository.findByUserIdAndUniverse(userId, universe);
        UserStreak streak;
        if (existing.isEmpty()) {
            int current = success ? 1 : 0;
            streak = UserStreak.builder()
                    .userId(userId)
                    .universe(universe)
                    .currentStreak(current)
                    .longestStreak(current)
                    .lastPlayedDate(date)
                    .build();
        } else {
            streak = existing.get();
            int current;
            if (!success) {
                current = 0;
            } else if (date.minusDays(1).equals(streak.getLastPlayedDate())) {
                // Consecutive day
                current = streak.getCurrentStreak() + 1;
            } else {
                // Gap, or the same day recorded again
                current = 1;
            }
            streak.setCurrentStreak(current);
            streak.setLongestStreak(Math.max(streak.getLongestStreak(), current));
            streak.setLastPlayedDate(date);
        }

        UserStreak saved = streakRepository.save(streak);
        log.debug("Streak for user {} in {} is now {} (longest {})",
                userId, universe.getKey(), saved.getCurrentStreak(), saved.getLongestStreak());
        return saved;
    }

    /**
     * Current streak, 0 if the user never finished a puzzle in the universe
     */
    @Transactional(readOnly = true)
    public int currentStreak(String userId, Universe universe) {
        return streakRepository.findByUserIdAndUniverse(userId, universe)
                .map(UserStreak::getCurrentStreak)
                .orElse(0);
    }

    /**
     * Streak of one universe, zeros if the user never finished a puzzle there
     */
    @Transactional(readOnly = true)
    public StreakSummary getStreak(String userId, Universe universe) {
        requireUser(userId);
        return streakRepository.findByUserIdAndUniverse(userId, universe)
                .map(StreakTracker::toSummary)
                .orElse(StreakSummary.builder().current(0).longest(0).build());
    }

    /**
     * Streaks for every universe, keyed by universe key
     */
    @Transactional(readOnly = true)
    public Map<String, StreakSummary> getStreaks(String userId) {
        requireUser(userId);

        List<UserStreak> stored = streakRepository.findByUserId(userId);
        Map<String, StreakSummary> streaks = new LinkedHashMap<>();
        for (Universe universe : Universe.values()) {
            StreakSummary summary = stored.stream()
                    .filter(s -> s.getUniverse() == universe)
                    .findFirst()
                    .map(StreakTracker::toSummary)
                    .orElse(StreakSummary.builder().current(0).longest(0).build());
            streaks.put(universe.getKey(), summary);
        }
        return streaks;
    }

    private static StreakSummary toSummary(UserStreak streak) {
        return StreakSummary.builder()
                .current(streak.getCurrentStreak())
                .longest(streak.getLongestStreak())
                .lastPlayedDate(streak.getLastPlayedDate())
                .build();
    }

    private void requireUser(String userId) {
        if (userId == null || !userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
