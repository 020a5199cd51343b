package com.deliverzler.triptracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StreamErrorRequest {

    private String message;
}
