package com.comicguess.dailypuzzle.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.Map;

/**
 * Current streaks together with what today's play means for each of them
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreakStatusResponse {
    private String userId;
    private LocalDate date;
    private Map<String, StreakSummary> streaks;
    private Map<String, StreakMaintenanceStatus> maintenance;
}
