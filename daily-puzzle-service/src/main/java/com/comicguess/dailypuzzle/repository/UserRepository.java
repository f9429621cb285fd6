package com.comicguess.dailypuzzle.repository;

import com.comicguess.dailypuzzle.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends JpaRepository<User, String> {
}
