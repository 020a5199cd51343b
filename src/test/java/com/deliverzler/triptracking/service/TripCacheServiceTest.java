package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.model.Area;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Local trip cache against H2: what recovery reads back is what was saved.
 */
@DataJpaTest
@Import(TripCacheService.class)
class TripCacheServiceTest {

    @TestConfiguration
    static class Beans {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        Clock clock() {
            return Clock.systemDefaultZone();
        }
    }

    @Autowired private TripCacheService tripCacheService;

    private static final Long DRIVER_ID = 9L;

    @Test
    @DisplayName("Saved trip loads back with areas, start time and distance")
    void saveAndLoad() {
        Trip trip = Trip.builder()
                .id(77L)
                .status(TripStatus.UNCOMPLETED)
                .driverId(DRIVER_ID)
                .material("Sand")
                .projectName("Gangnam Tower")
                .startTime(LocalDateTime.of(2025, 3, 28, 9, 30))
                .loadingArea(Area.builder().id(3L).name("Quarry").latitude(37.24).longitude(127.17).radiusMeters(80.0).build())
                .unloadingArea(Area.builder().id(4L).name("Site").latitude(37.51).longitude(127.06).build())
                .distanceMeters(1520.5)
                .build();

        tripCacheService.save(trip);
        Optional<Trip> loaded = tripCacheService.load(DRIVER_ID);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getId()).isEqualTo(77L);
        assertThat(loaded.get().getStatus()).isEqualTo(TripStatus.UNCOMPLETED);
        assertThat(loaded.get().getStartTime()).isEqualTo(LocalDateTime.of(2025, 3, 28, 9, 30));
        assertThat(loaded.get().getDistanceMeters()).isEqualTo(1520.5);
        assertThat(loaded.get().getProjectName()).isEqualTo("Gangnam Tower");
        assertThat(loaded.get().getLoadingArea().getRadiusMeters()).isEqualTo(80.0);
        assertThat(loaded.get().getUnloadingArea().getName()).isEqualTo("Site");
    }

    @Test
    @DisplayName("Saving again replaces the driver's single cached trip; clear removes it")
    void replaceAndClear() {
        tripCacheService.save(Trip.builder().id(1L).driverId(DRIVER_ID).status(TripStatus.UNCOMPLETED).build());
        tripCacheService.save(Trip.builder().id(2L).driverId(DRIVER_ID).status(TripStatus.UNCOMPLETED).build());

        assertThat(tripCacheService.load(DRIVER_ID)).map(Trip::getId).contains(2L);

        tripCacheService.clear(DRIVER_ID);
        tripCacheService.clear(DRIVER_ID);

        assertThat(tripCacheService.load(DRIVER_ID)).isEmpty();
    }
}
