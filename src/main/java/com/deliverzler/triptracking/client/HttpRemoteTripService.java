package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.client.dto.*;
import com.deliverzler.triptracking.exception.RemoteServiceException;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Trip server client over JSON/HTTP.
 *
 * Endpoints:
 *  POST /trips                              create
 *  PUT  /trips/{id}                         update
 *  GET  /trips/{id}                         status
 *  GET  /trips/complete/{id}                complete
 *  GET  /trips/uncompleted/{driverId}       latest uncompleted trip
 *  POST /trips/force/{id}                   force end
 *  GET  /trips/histories/drivers/{driverId} history of one day
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HttpRemoteTripService implements RemoteTripService {

    private static final DateTimeFormatter HISTORY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${remote.api.base-url}")
    private String baseUrl;

    @Value("${remote.api.request-timeout-seconds:30}")
    private long requestTimeoutSeconds;

    @Override
    public Trip create(TripRequestDto request) {
        TripDto dto = exchange(post("/trips", request), new TypeReference<ApiEnvelope<TripDto>>() {});
        if (dto == null) {
            throw new RemoteServiceException("Trip server returned no trip for create");
        }
        return TripMapper.fromTripDto(dto, request.getDriverId());
    }

    @Override
    public Trip update(long tripId, TripRequestDto request) {
        TripDto dto = exchange(
                builder("/trips/" + tripId).PUT(jsonBody(request)).build(),
                new TypeReference<ApiEnvelope<TripDto>>() {});
        if (dto == null) {
            throw new RemoteServiceException("Trip server returned no trip for update of #" + tripId);
        }
        return TripMapper.fromTripDto(dto, request.getDriverId());
    }

    @Override
    public TripStatus getStatus(long tripId) {
        TripDto dto = exchange(get("/trips/" + tripId), new TypeReference<ApiEnvelope<TripDto>>() {});
        return dto != null ? TripStatus.fromRemote(dto.getStatus()) : TripStatus.UNKNOWN;
    }

    @Override
    public boolean complete(long tripId) {
        // any 2xx completes the trip, whatever the envelope carries
        exchange(get("/trips/complete/" + tripId), new TypeReference<ApiEnvelope<Object>>() {});
        return true;
    }

    @Override
    public void forceEnd(long tripId, String reason, long unloadingAreaId) {
        exchange(post("/trips/force/" + tripId, new ForceEndRequestDto(reason, unloadingAreaId)),
                new TypeReference<ApiEnvelope<Object>>() {});
    }

    @Override
    public Optional<Trip> latestUncompleted(long driverId) {
        LatestTripDto dto = exchange(get("/trips/uncompleted/" + driverId),
                new TypeReference<ApiEnvelope<LatestTripDto>>() {});
        if (dto == null || dto.getTripId() == null) {
            return Optional.empty();
        }
        return Optional.of(TripMapper.fromLatestTripDto(dto, driverId));
    }

    @Override
    public List<HistoryTripDto> listHistory(long driverId, LocalDate date) {
        List<HistoryTripDto> trips = exchange(
                get("/trips/histories/drivers/" + driverId + "?date=" + date.format(HISTORY_DATE)),
                new TypeReference<ApiEnvelope<List<HistoryTripDto>>>() {});
        return trips != null ? trips : List.of();
    }

    // ── HTTP plumbing ─────────────────────────────────────────────────────────

    private <T> T exchange(HttpRequest request, TypeReference<ApiEnvelope<T>> type) {
        log.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteServiceException(request.method() + " " + request.uri().getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException(request.method() + " " + request.uri().getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("{} {} answered {}: {}", request.method(), request.uri().getPath(), status, response.body());
            throw new RemoteServiceException(
                    request.method() + " " + request.uri().getPath() + " answered HTTP " + status, status);
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            ApiEnvelope<T> envelope = objectMapper.readValue(body, type);
            return envelope.getData();
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Unreadable response from " + request.uri().getPath(), e);
        }
    }

    private HttpRequest get(String path) {
        return builder(path).GET().build();
    }

    private HttpRequest post(String path, Object body) {
        return builder(path).POST(jsonBody(body)).build();
    }

    private HttpRequest.Builder builder(String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise request body", e);
        }
    }
}
