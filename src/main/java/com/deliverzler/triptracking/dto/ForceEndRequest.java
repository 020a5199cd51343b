package com.deliverzler.triptracking.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ForceEndRequest {

    @NotBlank(message = "Reason is required")
    private String reason;

    // defaults to the trip's unloading area
    private Long unloadingAreaId;
}
