package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.client.dto.*;
import com.deliverzler.triptracking.model.Area;
import com.deliverzler.triptracking.model.Trip;
import com.deliverzler.triptracking.model.TripStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between trip server payloads and the {@link Trip} model.
 */
@Slf4j
public final class TripMapper {

    /** Trip start times on the wire, wall-clock in the server's zone */
    public static final DateTimeFormatter START_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    // history entries may carry seconds
    private static final DateTimeFormatter START_TIME_PARSER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private TripMapper() {
    }

    public static Trip fromTripDto(TripDto dto, Long driverId) {
        return Trip.builder()
                .id(dto.getTripId())
                .status(TripStatus.fromRemote(dto.getStatus()))
                .projectName(dto.getProjectName())
                .driverName(dto.getDriverName())
                .driverId(driverId)
                .material(dto.getMaterial())
                .title(dto.getTitle())
                .loadingArea(toArea(dto.getLoadingArea()))
                .unloadingArea(toArea(dto.getUnloadingArea()))
                .build();
    }

    /**
     * The server lists tracked points newest first, so the first entry carries the
     * distance reached so far.
     */
    public static Trip fromLatestTripDto(LatestTripDto dto, Long driverId) {
        double distance = 0.0;
        if (dto.getGpsTrackingResponse() != null && !dto.getGpsTrackingResponse().isEmpty()) {
            Double first = dto.getGpsTrackingResponse().get(0).getDistance();
            distance = first != null ? first : 0.0;
        }
        return Trip.builder()
                .id(dto.getTripId())
                .status(TripStatus.fromRemote(dto.getStatus()))
                .projectName(dto.getProjectInfo() != null ? dto.getProjectInfo().getName() : null)
                .driverId(driverId)
                .material(dto.getMaterial())
                .startTime(parseStartTime(dto.getStartTime()))
                .loadingArea(toArea(dto.getLoadingAreaInfo()))
                .unloadingArea(toArea(dto.getUnloadingAreaInfo()))
                .distanceMeters(distance)
                .build();
    }

    /** Shape written to the local trip cache. */
    public static LatestTripDto toLatestTripDto(Trip trip) {
        List<GpsTrackingDto> tracking = new ArrayList<>();
        if (trip.getDistanceMeters() > 0) {
            tracking.add(new GpsTrackingDto(null, null, null, null, null, trip.getDistanceMeters()));
        }
        return LatestTripDto.builder()
                .tripId(trip.getId())
                .status(trip.getStatus() != null ? trip.getStatus().name() : null)
                .material(trip.getMaterial())
                .startTime(trip.getStartTime() != null ? trip.getStartTime().format(START_TIME_FORMAT) : null)
                .projectInfo(new ProjectInfoDto(null, trip.getProjectName(), ""))
                .loadingAreaInfo(toAreaInfo(trip.getLoadingArea()))
                .unloadingAreaInfo(toAreaInfo(trip.getUnloadingArea()))
                .gpsTrackingResponse(tracking)
                .build();
    }

    /** Null when absent or unparseable. */
    public static LocalDateTime parseStartTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), START_TIME_PARSER);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable trip start time '{}'", value);
            return null;
        }
    }

    private static Area toArea(AreaTripDto dto) {
        if (dto == null) {
            return null;
        }
        return Area.builder()
                .id(dto.getId())
                .name(dto.getAreaName())
                .address(dto.getAreaAddress())
                .latitude(dto.getLatitude())
                .longitude(dto.getLongitude())
                .radiusMeters(dto.getRadius() != null ? dto.getRadius() : Area.DEFAULT_RADIUS_METERS)
                .build();
    }

    private static Area toArea(AreaInfoDto dto) {
        if (dto == null) {
            return null;
        }
        return Area.builder()
                .id(dto.getId())
                .name(dto.getName())
                .address(dto.getAddress())
                .latitude(dto.getLatitude())
                .longitude(dto.getLongitude())
                .radiusMeters(dto.getRadius() != null ? dto.getRadius() : Area.DEFAULT_RADIUS_METERS)
                .build();
    }

    private static AreaInfoDto toAreaInfo(Area area) {
        if (area == null) {
            return null;
        }
        return AreaInfoDto.builder()
                .id(area.getId())
                .name(area.getName())
                .address(area.getAddress())
                .typeFunction("")
                .latitude(area.getLatitude())
                .longitude(area.getLongitude())
                .radius(area.getRadiusMeters())
                .build();
    }
}
