package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/** Area as embedded in the latest-uncompleted-trip response. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AreaInfoDto {

    private Long id;
    private String name;
    private String address;
    private String typeFunction;
    private Double latitude;
    private Double longitude;
    private Double radius;
}
