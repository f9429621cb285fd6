package com.comicguess.dailypuzzle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DailyPuzzleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyPuzzleServiceApplication.class, args);
    }
}
