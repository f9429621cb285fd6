package com.comicguess.dailypuzzle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A user's progress on one universe's puzzle for a day. Only {@code puzzleAvailable} and
 * {@code puzzleId} are set when no puzzle exists yet.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UniverseProgress {
    private boolean puzzleAvailable;
    private String puzzleId;
    @JsonProperty("is_solved")
    private Boolean solved;
    private Integer attemptsUsed;
    private Integer attemptsRemaining;
    private Boolean canGuess;
    private List<String> guesses;
}
