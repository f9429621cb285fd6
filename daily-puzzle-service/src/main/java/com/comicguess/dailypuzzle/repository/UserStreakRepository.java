package com.comicguess.dailypuzzle.repository;

import com.comicguess.dailypuzzle.entity.UserStreak;
import com.comicguess.dailypuzzle.model.Universe;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserStreakRepository extends JpaRepository<UserStreak, Long> {

    Optional<UserStreak> findByUserIdAndUniverse(String userId, Universe universe);

    List<UserStreak> findByUserId(String userId);
}
