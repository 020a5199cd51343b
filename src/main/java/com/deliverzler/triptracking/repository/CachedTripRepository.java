package com.deliverzler.triptracking.repository;

import com.deliverzler.triptracking.entity.CachedTrip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedTripRepository extends JpaRepository<CachedTrip, Long> {
}
