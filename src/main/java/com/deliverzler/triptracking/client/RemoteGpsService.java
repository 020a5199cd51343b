package com.deliverzler.triptracking.client;

import com.deliverzler.triptracking.entity.GpsPoint;

import java.util.List;

/**
 * GPS upload endpoint of the server. Never throws: failures come back as
 * {@link GpsUploadResult#FAILED}.
 */
public interface RemoteGpsService {

    GpsUploadResult uploadBatch(long tripId, List<GpsPoint> points);
}
