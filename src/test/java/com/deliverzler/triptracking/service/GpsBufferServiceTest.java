package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.client.ConnectivityChecker;
import com.deliverzler.triptracking.client.GpsUploadResult;
import com.deliverzler.triptracking.client.RemoteGpsService;
import com.deliverzler.triptracking.entity.GpsPoint;
import com.deliverzler.triptracking.util.Retrier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Buffer behaviour against a real (in-memory H2) store.
 *
 *  1. twelve buffered points, one successful batch: 0 unsynced, 12 synced
 *  2. timestamps are truncated to seconds and never go backwards
 *  3. marking by id touches exactly those points
 *  4. delete is scoped to one trip
 */
@DataJpaTest
@Import({GpsBufferService.class, GpsSyncService.class})
class GpsBufferServiceTest {

    @Autowired private GpsBufferService gpsBufferService;
    @Autowired private GpsSyncService   gpsSyncService;

    @MockBean private RemoteGpsService    remoteGpsService;
    @MockBean private ConnectivityChecker connectivityChecker;
    @MockBean private TelemetryService    telemetryService;
    @MockBean private Retrier             retrier;

    private static final Long TRIP_ID = 42L;
    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 28, 9, 5, 42);

    @Test
    @DisplayName("12 unsynced points, batch accepted: 0 unsynced and 12 synced remain")
    void twelvePointBatch() {
        for (int i = 0; i < 12; i++) {
            gpsBufferService.append(TRIP_ID, 37.51 + i * 0.0001, 127.06, 5.0, 11.1, T0.plusSeconds(i));
        }
        when(connectivityChecker.isOnline()).thenReturn(true);
        when(remoteGpsService.uploadBatch(eq(TRIP_ID), anyList())).thenReturn(GpsUploadResult.ACCEPTED);

        boolean synced = gpsSyncService.syncIfThresholdReached(TRIP_ID);

        assertThat(synced).isTrue();
        assertThat(gpsBufferService.countUnsynced(TRIP_ID)).isZero();
        assertThat(gpsBufferService.countSynced(TRIP_ID)).isEqualTo(12);
        assertThat(gpsBufferService.hasUnsyncedData()).isFalse();
        verify(remoteGpsService, times(1)).uploadBatch(eq(TRIP_ID), argThat(batch -> batch.size() == 12));
    }

    @Test
    @DisplayName("Timestamps are truncated to seconds and clamped to the trip's latest point")
    void timestampsAreClampedToLatest() {
        GpsPoint first = gpsBufferService.append(TRIP_ID, 37.5, 127.0, 3.0, 0, T0.withNano(700_000_000));
        GpsPoint late  = gpsBufferService.append(TRIP_ID, 37.6, 127.0, 3.0, 0, T0.minusSeconds(3));
        GpsPoint other = gpsBufferService.append(99L, 37.6, 127.0, 3.0, 0, T0.minusSeconds(3));

        assertThat(first.getTimestamp()).isEqualTo(T0);
        assertThat(late.getTimestamp()).isEqualTo(T0);
        assertThat(other.getTimestamp()).isEqualTo(T0.minusSeconds(3));

        assertThat(gpsBufferService.history(TRIP_ID))
                .extracting(GpsPoint::getId)
                .containsExactly(first.getId(), late.getId());
    }

    @Test
    @DisplayName("Marking by id leaves points sharing a timestamp untouched")
    void markSyncedById() {
        GpsPoint a = gpsBufferService.append(TRIP_ID, 37.5, 127.0, 3.0, 0, T0);
        GpsPoint b = gpsBufferService.append(TRIP_ID, 37.6, 127.0, 3.0, 0, T0);

        int updated = gpsBufferService.markSynced(List.of(a.getId()));

        assertThat(updated).isEqualTo(1);
        assertThat(gpsBufferService.unsynced(TRIP_ID)).extracting(GpsPoint::getId).containsExactly(b.getId());
        assertThat(gpsBufferService.markSynced(List.of(a.getId()))).isZero();
        assertThat(gpsBufferService.markSynced(List.of())).isZero();
    }

    @Test
    @DisplayName("Deleting a trip's points keeps other trips and lists them as pending")
    void deleteIsScopedToTrip() {
        gpsBufferService.append(TRIP_ID, 37.5, 127.0, 3.0, 0, T0);
        gpsBufferService.append(7L, 37.5, 127.0, 3.0, 0, T0);

        int deleted = gpsBufferService.deleteByTrip(TRIP_ID);

        assertThat(deleted).isEqualTo(1);
        assertThat(gpsBufferService.history(TRIP_ID)).isEmpty();
        assertThat(gpsBufferService.tripsWithUnsyncedData()).containsExactly(7L);
    }
}
