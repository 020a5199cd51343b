package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.TripMapper;
import com.deliverzler.triptracking.client.dto.LatestTripDto;
import com.deliverzler.triptracking.entity.CachedTrip;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.repository.CachedTripRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Local copy of the driver's latest uncompleted trip, read back when the server
 * cannot be reached at recovery time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripCacheService {

    private final CachedTripRepository cachedTripRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public void save(Trip trip) {
        try {
            String payload = objectMapper.writeValueAsString(TripMapper.toLatestTripDto(trip));
            cachedTripRepository.save(CachedTrip.builder()
                    .driverId(trip.getDriverId())
                    .tripId(trip.getId())
                    .payload(payload)
                    .startTime(trip.getStartTime())
                    .cachedAt(LocalDateTime.now(clock))
                    .build());
            log.debug("Trip #{} cached for driver #{}", trip.getId(), trip.getDriverId());
        } catch (JsonProcessingException e) {
            log.error("Could not cache trip #{}: {}", trip.getId(), e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public Optional<Trip> load(Long driverId) {
        Optional<CachedTrip> cached = cachedTripRepository.findById(driverId);
        if (cached.isEmpty()) {
            log.info("No cached trip for driver #{}", driverId);
            return Optional.empty();
        }
        try {
            LatestTripDto dto = objectMapper.readValue(cached.get().getPayload(), LatestTripDto.class);
            Trip trip = TripMapper.fromLatestTripDto(dto, driverId);
            if (trip.getStartTime() == null) {
                trip = trip.toBuilder().startTime(cached.get().getStartTime()).build();
            }
            return Optional.of(trip);
        } catch (JsonProcessingException e) {
            log.error("Cached trip of driver #{} is unreadable: {}", driverId, e.getMessage());
            return Optional.empty();
        }
    }

    @Transactional
    public void clear(Long driverId) {
        if (cachedTripRepository.existsById(driverId)) {
            cachedTripRepository.deleteById(driverId);
            log.debug("Cached trip of driver #{} removed", driverId);
        }
    }
}
