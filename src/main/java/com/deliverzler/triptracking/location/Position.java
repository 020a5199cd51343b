package com.deliverzler.triptracking.location;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A single fix from the device. {@code speed} is in m/s and may be absent.
 */
@Value
@Builder
public class Position {

    double latitude;
    double longitude;
    Double speed;
    Double accuracy;
    LocalDateTime timestamp;
}
