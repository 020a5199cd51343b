package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.client.dto.GpsPositionDto;
import com.deliverzler.triptracking.client.dto.GpsUploadRequestDto;
import com.deliverzler.triptracking.entity.GpsPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Uploads GPS batches to {@code POST /gps}.
 *
 * 2xx is ACCEPTED; 406 means the server already holds the points and counts as
 * success; anything else, including I/O failure, is FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HttpRemoteGpsService implements RemoteGpsService {

    public static final DateTimeFormatter POINT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final int HTTP_NOT_ACCEPTABLE = 406;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${remote.api.base-url}")
    private String baseUrl;

    @Value("${remote.api.request-timeout-seconds:30}")
    private long requestTimeoutSeconds;

    @Override
    public GpsUploadResult uploadBatch(long tripId, List<GpsPoint> points) {
        if (tripId == 0) {
            return GpsUploadResult.FAILED;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(toRequest(tripId, points));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialise GPS batch for trip #{}: {}", tripId, e.getMessage());
            return GpsUploadResult.FAILED;
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/gps"))
                .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                log.debug("Uploaded {} point(s) for trip #{}", points.size(), tripId);
                return GpsUploadResult.ACCEPTED;
            }
            if (status == HTTP_NOT_ACCEPTABLE) {
                log.info("Server already holds {} point(s) of trip #{} (406)", points.size(), tripId);
                return GpsUploadResult.ALREADY_RECEIVED;
            }
            log.warn("GPS upload for trip #{} answered HTTP {}", tripId, status);
            return GpsUploadResult.FAILED;
        } catch (IOException e) {
            log.warn("GPS upload for trip #{} failed: {}", tripId, e.getMessage());
            return GpsUploadResult.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("GPS upload for trip #{} interrupted", tripId);
            return GpsUploadResult.FAILED;
        }
    }

    private GpsUploadRequestDto toRequest(long tripId, List<GpsPoint> points) {
        List<GpsPositionDto> positions = points.stream()
                .map(p -> GpsPositionDto.builder()
                        .tripId(tripId)
                        .latitude(p.getLatitude())
                        .longitude(p.getLongitude())
                        .speed(p.getSpeed() != null ? p.getSpeed() : 0.0)
                        .distance(p.getDistanceDelta())
                        .timestamp(p.getTimestamp().format(POINT_TIMESTAMP))
                        .build())
                .toList();
        return new GpsUploadRequestDto(tripId, positions);
    }
}
