package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/** One uploaded point; {@code timestamp} is {@code yyyy-MM-dd HH:mm:ss}. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GpsPositionDto {

    private Long tripId;
    private Double latitude;
    private Double longitude;
    private Double speed;
    private Double distance;
    private String timestamp;
}
