package com.comicguess.dailypuzzle.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyProgressResponse {
    private LocalDate date;
    private String userId;
    private Map<String, UniverseProgress> universes; // keyed by universe key
}
