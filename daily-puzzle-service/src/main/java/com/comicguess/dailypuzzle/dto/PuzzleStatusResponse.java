package com.comicguess.dailypuzzle.dto;

import com.comicguess.dailypuzzle.model.GameState;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PuzzleStatusResponse {
    private String puzzleId;
    private GameState state;
    private boolean canGuess;
    @JsonProperty("is_solved")
    private boolean solved;
    private int attemptsUsed;
    private int attemptsRemaining;
    private int maxAttempts;
    private List<String> guesses; // in attempt order
}
