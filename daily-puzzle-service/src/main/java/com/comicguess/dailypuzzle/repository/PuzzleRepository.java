package com.comicguess.dailypuzzle.repository;

import com.comicguess.dailypuzzle.entity.AliasListConverter;
import com.comicguess.dailypuzzle.entity.Puzzle;
import com.comicguess.dailypuzzle.model.Universe;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface PuzzleRepository extends JpaRepository<Puzzle, Long> {

    Optional<Puzzle> findByUniverseAndPuzzleDate(Universe universe, LocalDate puzzleDate);

    /**
     * Insert unless a puzzle already exists for the universe and date. Returns the number of inserted rows.
     * The only unique keys on puzzles are the id and (universe, puzzle_date), so no conflict target is named.
     */
    @Modifying
    @Query(value = "INSERT INTO puzzles (universe, puzzle_date, character_name, character_aliases, image_key, created_at, updated_at) " +
            "VALUES (:universe, :puzzleDate, :character, :aliases, :imageKey, :createdAt, :createdAt) " +
            "ON CONFLICT DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("universe") String universe,
                       @Param("puzzleDate") LocalDate puzzleDate,
                       @Param("character") String character,
                       @Param("aliases") String aliases,
                       @Param("imageKey") String imageKey,
                       @Param("createdAt") Instant createdAt);

    /**
     * Create-if-absent: concurrent callers for the same universe and date all get back the single stored row.
     */
    default Puzzle createIfAbsent(Puzzle puzzle) {
        insertIfAbsent(puzzle.getUniverse().name(),
                puzzle.getPuzzleDate(),
                puzzle.getCharacter(),
                AliasListConverter.toJson(puzzle.getAliases()),
                puzzle.getImageKey(),
                Instant.now());
        return findByUniverseAndPuzzleDate(puzzle.getUniverse(), puzzle.getPuzzleDate())
                .orElseThrow(() -> new IllegalStateException(
                        "Puzzle " + puzzle.getPuzzleId() + " missing right after insert"));
    }

    @Modifying
    @Query("DELETE FROM Puzzle p WHERE p.puzzleDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
