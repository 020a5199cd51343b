package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/** Server-side record of a tracked point; {@code distance} is the trip distance so far. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GpsTrackingDto {

    private Long id;
    private Double latitude;
    private Double longitude;
    private String time;
    private Double speed;
    private Double distance;
}
