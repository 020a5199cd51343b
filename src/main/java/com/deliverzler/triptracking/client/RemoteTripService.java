package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.client.dto.HistoryTripDto;
import com.deliverzler.triptracking.client.dto.TripRequestDto;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Trip endpoints of the server. Every method throws
 * {@link com.deliverzler.triptracking.exception.RemoteServiceException} on network or
 * server failure.
 */
public interface RemoteTripService {

    Trip create(TripRequestDto request);

    Trip update(long tripId, TripRequestDto request);

    TripStatus getStatus(long tripId);

    /** @return true once the server answered 2xx; failures raise {@link com.deliverzler.triptracking.exception.RemoteServiceException} */
    boolean complete(long tripId);

    void forceEnd(long tripId, String reason, long unloadingAreaId);

    Optional<Trip> latestUncompleted(long driverId);

    List<HistoryTripDto> listHistory(long driverId, LocalDate date);
}
