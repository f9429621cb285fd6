package com.comicguess.dailypuzzle.repository;

import com.comicguess.dailypuzzle.entity.GuessAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GuessAttemptRepository extends JpaRepository<GuessAttempt, Long> {

    long countByUserIdAndPuzzleId(String userId, Long puzzleId);

    boolean existsByUserIdAndPuzzleIdAndCorrectTrue(String userId, Long puzzleId);

    List<GuessAttempt> findByUserIdAndPuzzleIdOrderByAttemptNumberAsc(String userId, Long puzzleId);

    @Modifying
    @Query("DELETE FROM GuessAttempt g WHERE g.submittedAt < :cutoff")
    int deleteSubmittedBefore(@Param("cutoff") Instant cutoff);
}
