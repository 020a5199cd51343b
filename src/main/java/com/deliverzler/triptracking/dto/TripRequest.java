package com.deliverzler.triptracking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

/**
 * Parameters of a new or updated trip, as chosen by the driver.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripRequest {

    @NotNull(message = "Site ID is required")
    @Positive
    private Long siteId;

    @NotNull(message = "Project ID is required")
    @Positive
    private Long projectId;

    @NotNull(message = "Loading area ID is required")
    @Positive
    private Long loadingAreaId;

    @NotNull(message = "Unloading area ID is required")
    @Positive
    private Long unloadingAreaId;

    @NotBlank(message = "Material is required")
    private String material;
}
