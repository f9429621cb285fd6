package com.comicguess.dailypuzzle.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GuessResponse {
    private String puzzleId;
    private boolean correct;
    private String character; // Only shown if correct
    private String imageKey;  // Only shown if correct
    private int attemptNumber;
    private int attemptsRemaining;
    private int maxAttempts;
    private boolean gameOver;
    private int streak;
}
