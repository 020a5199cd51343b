package com.deliverzler.triptracking.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Arrival target derived from a trip area. The notified flag is one-shot for
 * the tracking session; only a new session starts with fresh targets.
 */
@Getter
@RequiredArgsConstructor
public class ProximityTarget {

    private final TargetKind kind;
    private final Long areaId;
    private final String name;
    private final double latitude;
    private final double longitude;
    private final double radiusMeters;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean notified = new AtomicBoolean(false);

    /** Returns null when the area has no coordinates to watch. */
    public static ProximityTarget of(TargetKind kind, Area area) {
        if (area == null || !area.hasCoordinates()) {
            return null;
        }
        return new ProximityTarget(kind, area.getId(), area.getName(),
                area.getLatitude(), area.getLongitude(), area.getRadiusMeters());
    }

    public boolean isNotified() {
        return notified.get();
    }

    /**
     * Takes over the notified flag of the target this one replaces, when both watch
     * the same area for the same kind of arrival.
     */
    public void carryOverFrom(ProximityTarget previous) {
        if (previous != null && previous.kind == kind && Objects.equals(previous.areaId, areaId)
                && previous.isNotified()) {
            notified.set(true);
        }
    }

    /** @return true only for the first caller */
    public boolean markNotified() {
        return notified.compareAndSet(false, true);
    }
}
