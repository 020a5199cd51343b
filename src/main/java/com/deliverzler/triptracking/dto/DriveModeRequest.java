package com.deliverzler.triptracking.dto;

import com.deliverzler.triptracking.model.DriveMode;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DriveModeRequest {

    @NotNull(message = "Drive mode is required")
    private DriveMode mode;
}
