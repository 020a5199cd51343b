package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import com.deliverzler.triptracking.client.dto.TripRequestDto;
import com.deliverzler.triptracking.exception.RemoteServiceException;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HttpRemoteTripService: envelope parsing, endpoints and error mapping.
 */
@ExtendWith(MockitoExtension.class)
class HttpRemoteTripServiceTest {

    @Mock private HttpClient           httpClient;
    @Mock private HttpResponse<String> response;

    private HttpRemoteTripService tripService;

    private static final String TRIP_JSON = "{\"message\":\"ok\",\"data\":{"
                + "\"trip_id\":77,\"project_name\":\"Gangnam Tower\",\"driver_name\":\"Kim\","
                + "\"material\":\"Sand\",\"title\":\"Trip 77\",\"status\":\"UNCOMPLETED\","
                + "\"loading_area\":{\"id\":3,\"area_name\":\"Quarry\",\"area_address\":\"Yongin\","
                + "\"latitude\":37.24,\"longitude\":127.17,\"radius\":80.0},"
                + "\"unloading_area\":{\"id\":4,\"area_name\":\"Site\",\"area_address\":\"Seoul\","
                + "\"latitude\":37.51,\"longitude\":127.06}"
                + "}}";

    @BeforeEach
    void setUp() {
        tripService = new HttpRemoteTripService(httpClient, new ObjectMapper());
        ReflectionTestUtils.setField(tripService, "baseUrl", "http://trip-server/api");
        ReflectionTestUtils.setField(tripService, "requestTimeoutSeconds", 30L);
    }

    @Test
    @DisplayName("Create posts to /trips and maps areas, default radius when absent")
    void createMapsTrip() throws Exception {
        answer(200, TRIP_JSON);

        Trip trip = tripService.create(TripRequestDto.builder()
                .driverId(9L).material("Sand").loadingAreaId(3L).unloadingAreaId(4L).projectId(1L).build());

        HttpRequest sent = sentRequest();
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.uri().getPath()).isEqualTo("/api/trips");
        assertThat(trip.getId()).isEqualTo(77L);
        assertThat(trip.getStatus()).isEqualTo(TripStatus.UNCOMPLETED);
        assertThat(trip.getDriverId()).isEqualTo(9L);
        assertThat(trip.getLoadingArea().getName()).isEqualTo("Quarry");
        assertThat(trip.getLoadingArea().getRadiusMeters()).isEqualTo(80.0);
        assertThat(trip.getUnloadingArea().getRadiusMeters()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Status FORCE is read case-insensitively, unknown values map to UNKNOWN")
    void statusMapping() throws Exception {
        answer(200, "{\"data\":{\"trip_id\":77,\"status\":\"force\"}}");
        assertThat(tripService.getStatus(77L)).isEqualTo(TripStatus.FORCE);

        answer(200, "{\"data\":{\"trip_id\":77,\"status\":\"PAUSED\"}}");
        assertThat(tripService.getStatus(77L)).isEqualTo(TripStatus.UNKNOWN);
    }

    @Test
    @DisplayName("Any 2xx answer completes the trip, with or without data")
    void completeOnAny2xx() throws Exception {
        answer(200, "{\"message\":\"done\",\"data\":{\"trip_id\":77}}");
        assertThat(tripService.complete(77L)).isTrue();
        assertThat(sentRequest().uri().getPath()).isEqualTo("/api/trips/complete/77");

        answer(200, "{\"message\":\"nothing\",\"data\":null}");
        assertThat(tripService.complete(77L)).isTrue();

        answer(204, "");
        assertThat(tripService.complete(77L)).isTrue();
    }

    @Test
    @DisplayName("Non-2xx and I/O failures raise RemoteServiceException")
    void failuresRaise() throws Exception {
        answer(500, "{\"message\":\"boom\"}");
        assertThatThrownBy(() -> tripService.getStatus(77L))
                .isInstanceOf(RemoteServiceException.class)
                .satisfies(e -> assertThat(((RemoteServiceException) e).getStatus()).isEqualTo(500));

        doThrow(new IOException("timeout")).when(httpClient).send(any(HttpRequest.class), any());
        assertThatThrownBy(() -> tripService.complete(77L))
                .isInstanceOf(RemoteServiceException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Latest uncompleted trip takes its distance from the first tracking entry")
    void latestUncompleted() throws Exception {
        answer(200, "{\"data\":{\"trip_id\":88,\"status\":\"UNCOMPLETED\",\"material\":\"Gravel\","
                + "\"start_time\":\"2025-03-28 09:05\","
                + "\"project_info\":{\"id\":1,\"name\":\"Gangnam Tower\",\"address\":\"\"},"
                + "\"gps_tracking_response\":["
                + "{\"id\":2,\"latitude\":37.5,\"longitude\":127.0,\"time\":\"2025-03-28 09:30:00\",\"speed\":3.0,\"distance\":1520.5},"
                + "{\"id\":1,\"latitude\":37.4,\"longitude\":127.0,\"time\":\"2025-03-28 09:10:00\",\"speed\":3.0,\"distance\":300.0}]"
                + "}}");

        Optional<Trip> trip = tripService.latestUncompleted(9L);

        assertThat(sentRequest().uri().getPath()).isEqualTo("/api/trips/uncompleted/9");
        assertThat(trip).isPresent();
        assertThat(trip.get().getDistanceMeters()).isEqualTo(1520.5);
        assertThat(trip.get().getStartTime()).isEqualTo(LocalDateTime.of(2025, 3, 28, 9, 5));
        assertThat(trip.get().getProjectName()).isEqualTo("Gangnam Tower");
    }

    @Test
    @DisplayName("No uncompleted trip yields empty")
    void noUncompletedTrip() throws Exception {
        answer(200, "{\"message\":\"none\",\"data\":null}");

        assertThat(tripService.latestUncompleted(9L)).isEmpty();
    }

    @Test
    @DisplayName("History is requested per day")
    void historyByDate() throws Exception {
        answer(200, "{\"data\":[{\"project_id\":1,\"project_name\":\"Gangnam Tower\",\"loading_area\":\"Quarry\","
                + "\"unloading_area\":\"Site\",\"start_time\":\"2025-03-28 09:05:00\",\"end_time\":\"2025-03-28 10:00:00\"}]}");

        List<HistoryTripDto> trips = tripService.listHistory(9L, LocalDate.of(2025, 3, 28));

        assertThat(sentRequest().uri().toString())
                .isEqualTo("http://trip-server/api/trips/histories/drivers/9?date=2025-03-28");
        assertThat(trips).extracting(HistoryTripDto::getProjectName).containsExactly("Gangnam Tower");
    }

    private void answer(int status, String body) throws Exception {
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, atLeastOnce()).send(request.capture(), any());
        return request.getValue();
    }
}
