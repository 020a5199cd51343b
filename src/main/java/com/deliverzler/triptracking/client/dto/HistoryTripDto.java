package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/** Finished trip in the driver's history. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HistoryTripDto {

    private Long projectId;
    private String projectName;
    private String loadingArea;
    private String unloadingArea;
    private String startTime;
    private String endTime;
}
