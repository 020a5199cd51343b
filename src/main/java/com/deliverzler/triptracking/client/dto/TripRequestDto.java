package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/** Body of trip create and update calls. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TripRequestDto {

    private Long driverId;
    private String material;
    private Long loadingAreaId;
    private Long unloadingAreaId;
    private Long projectId;
}
