package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.RemoteTripService;
import com.deliverzler.triptracking.client.TripMapper;
import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import com.deliverzler.triptracking.config.CacheConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finished trips of the driver per day, newest first, cached in Caffeine.
 *
 * The cache is cleared whenever a trip is torn down so a just-finished trip shows up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripHistoryService {

    private final RemoteTripService remoteTripService;

    @Value("${driver.id}")
    private Long driverId;

    @Cacheable(cacheNames = CacheConfig.CACHE_TRIP_HISTORIES, key = "#date")
    public List<HistoryTripDto> getHistory(LocalDate date) {
        log.info("[CACHE MISS] Loading trip history of driver #{} for {}", driverId, date);
        List<HistoryTripDto> trips = new ArrayList<>(remoteTripService.listHistory(driverId, date));
        trips.sort(Comparator.comparing(
                (HistoryTripDto t) -> TripMapper.parseStartTime(t.getStartTime()),
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        return trips;
    }

    @CacheEvict(cacheNames = CacheConfig.CACHE_TRIP_HISTORIES, allEntries = true)
    public void evictAll() {
        log.info("[CACHE] Trip history cache cleared");
    }
}
