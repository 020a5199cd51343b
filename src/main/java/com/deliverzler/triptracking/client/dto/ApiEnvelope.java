package com.deliverzler.triptracking.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Response envelope used by every trip server endpoint: {@code {"message": ..., "data": ...}}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiEnvelope<T> {

    private String message;
    private T data;
}
