package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.RemoteTripService;
import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TripHistoryServiceTest {

    @Mock private RemoteTripService remoteTripService;

    @InjectMocks
    private TripHistoryService tripHistoryService;

    private static final LocalDate DAY = LocalDate.of(2025, 3, 28);

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(tripHistoryService, "driverId", 9L);
    }

    @Test
    @DisplayName("History is sorted newest first, unparseable start times last")
    void sortedNewestFirst() {
        when(remoteTripService.listHistory(9L, DAY)).thenReturn(List.of(
                history("Morning", "2025-03-28 08:10"),
                history("Broken", "yesterday"),
                history("Evening", "2025-03-28 17:45:30"),
                history("Noon", "2025-03-28 12:00")));

        List<HistoryTripDto> trips = tripHistoryService.getHistory(DAY);

        assertThat(trips).extracting(HistoryTripDto::getProjectName)
                .containsExactly("Evening", "Noon", "Morning", "Broken");
    }

    @Test
    @DisplayName("Empty day yields an empty list")
    void emptyDay() {
        when(remoteTripService.listHistory(9L, DAY)).thenReturn(List.of());

        assertThat(tripHistoryService.getHistory(DAY)).isEmpty();
    }

    private static HistoryTripDto history(String project, String startTime) {
        return HistoryTripDto.builder()
                .projectId(1L)
                .projectName(project)
                .loadingArea("Quarry")
                .unloadingArea("Site")
                .startTime(startTime)
                .build();
    }
}
