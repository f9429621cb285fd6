package com.comicguess.dailypuzzle.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One guess a user made against a puzzle. Rows are append-only.
 * The unique key on (user, puzzle, attempt number) rejects a second writer racing for the same attempt.
 */
@Entity
@Table(name = "guess_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_guess_attempts_user_puzzle_attempt",
                columnNames = {"user_id", "puzzle_id", "attempt_number"}),
        indexes = @Index(name = "ix_guess_attempts_user_puzzle", columnList = "user_id, puzzle_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuessAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "puzzle_id", nullable = false)
    private Long puzzleId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "guess", nullable = false, length = 100)
    private String guess;

    @Column(name = "normalized_guess", nullable = false, length = 100)
    private String normalizedGuess;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @PrePersist
    protected void onCreate() {
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }
}
