package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/** Trip as returned by create, update and status calls. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TripDto {

    private Long tripId;
    private String projectName;
    private String driverName;
    private AreaTripDto loadingArea;
    private AreaTripDto unloadingArea;
    private String material;
    private String title;
    private String status;
}
