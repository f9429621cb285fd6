package com.comicguess.dailypuzzle.entity;

import com.comicguess.dailypuzzle.model.PuzzleKey;
import com.comicguess.dailypuzzle.model.Universe;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The daily puzzle of one universe. Exactly one row exists per (universe, date).
 */
@Entity
@Table(name = "puzzles",
        uniqueConstraints = @UniqueConstraint(name = "uk_puzzles_universe_date",
                columnNames = {"universe", "puzzle_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Puzzle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "universe", nullable = false, length = 20)
    private Universe universe;

    @Column(name = "puzzle_date", nullable = false)
    private LocalDate puzzleDate;

    @Column(name = "character_name", nullable = false, length = 100)
    private String character;

    @Convert(converter = AliasListConverter.class)
    @Column(name = "character_aliases", nullable = false, length = 2000)
    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    @Column(name = "image_key", nullable = false, length = 255)
    private String imageKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public PuzzleKey key() {
        return new PuzzleKey(universe, puzzleDate);
    }

    /**
     * Public id in the form YYYYMMDD-universe
     */
    public String getPuzzleId() {
        return key().toPuzzleId();
    }
}
