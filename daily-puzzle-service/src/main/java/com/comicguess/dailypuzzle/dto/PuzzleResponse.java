package com.comicguess.dailypuzzle.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Puzzle as shown before it is solved: the character and aliases are left out
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PuzzleResponse {
    private String puzzleId;
    private String universe;
    private LocalDate activeDate;
}
