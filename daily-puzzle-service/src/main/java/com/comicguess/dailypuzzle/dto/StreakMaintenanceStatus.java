package com.comicguess.dailypuzzle.dto;

import com.comicguess.dailypuzzle.model.StreakMaintenance;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreakMaintenanceStatus {
    private StreakMaintenance status;
    private String message;
    private Integer attemptsRemaining; // only while pending
}
