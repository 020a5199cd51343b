package com.deliverzler.triptracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EndTripRequest {

    /** Text of the local notification shown once the trip has ended */
    private String message;
}
