package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Latest uncompleted trip of a driver. Also the JSON shape of the local trip cache.
 * {@code startTime} is {@code yyyy-MM-dd HH:mm} in the server's zone.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LatestTripDto {

    @Builder.Default
    private List<GpsTrackingDto> gpsTrackingResponse = new ArrayList<>();
    private Long tripId;
    private String material;
    private String status;
    private String startTime;
    private String endTime;
    private ProjectInfoDto projectInfo;
    private AreaInfoDto loadingAreaInfo;
    private AreaInfoDto unloadingAreaInfo;
}
