package com.deliverzler.triptracking.repository;

import com.deliverzler.triptracking.entity.GpsPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for buffered GPS points.
 *
 * Ordering is always (timestamp, id) so points sharing a second keep insert order.
 */
@Repository
public interface GpsPointRepository extends JpaRepository<GpsPoint, Long> {

    List<GpsPoint> findByTripIdAndSyncedFalseOrderByTimestampAscIdAsc(Long tripId);

    List<GpsPoint> findByTripIdOrderByTimestampAscIdAsc(Long tripId);

    long countByTripIdAndSyncedFalse(Long tripId);

    long countByTripIdAndSyncedTrue(Long tripId);

    // Previous point of the trip, for timestamp clamping
    Optional<GpsPoint> findTopByTripIdOrderByTimestampDescIdDesc(Long tripId);

    boolean existsBySyncedFalse();

    @Query("select distinct p.tripId from GpsPoint p where p.synced = false order by p.tripId")
    List<Long> findTripIdsWithUnsyncedPoints();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update GpsPoint p set p.synced = true where p.id in :ids and p.synced = false")
    int markSynced(@Param("ids") Collection<Long> ids);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from GpsPoint p where p.tripId = :tripId")
    int deleteAllByTripId(@Param("tripId") Long tripId);
}
