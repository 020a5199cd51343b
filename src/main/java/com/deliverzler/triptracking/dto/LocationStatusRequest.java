package com.deliverzler.triptracking.dto;

import com.deliverzler.triptracking.location.PermissionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LocationStatusRequest {

    @NotNull(message = "serviceEnabled is required")
    private Boolean serviceEnabled;

    private PermissionStatus permission;
}
