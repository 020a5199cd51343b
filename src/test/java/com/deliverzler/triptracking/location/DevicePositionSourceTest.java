package com.deliverzler.triptracking.location;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class DevicePositionSourceTest {

    private final DevicePositionSource source = new DevicePositionSource();

    @Test
    @DisplayName("Published fixes reach live subscribers only")
    void fanOut() {
        List<Position> received = new ArrayList<>();
        Subscription subscription = source.subscribe(received::add, e -> { });

        source.publish(fix(37.5));
        subscription.close();
        source.publish(fix(37.6));

        assertThat(received).extracting(Position::getLatitude).containsExactly(37.5);
        assertThat(subscription.isActive()).isFalse();
        assertThat(source.liveSubscriptions()).isZero();
        assertThat(source.getOnce()).map(Position::getLatitude).contains(37.6);
    }

    @Test
    @DisplayName("A failing subscriber does not stop delivery to the others")
    void failingSubscriberIsIsolated() {
        List<Position> received = new ArrayList<>();
        source.subscribe(p -> { throw new IllegalStateException("boom"); }, e -> { });
        source.subscribe(received::add, e -> { });

        source.publish(fix(37.5));

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Stream errors are delivered to error handlers")
    void errorsAreDelivered() {
        List<Throwable> errors = new ArrayList<>();
        source.subscribe(p -> { }, errors::add);

        source.publishError(new IllegalStateException("gps lost"));

        assertThat(errors).extracting(Throwable::getMessage).containsExactly("gps lost");
    }

    @Test
    @DisplayName("Permission request waits for the device answer")
    void permissionAnswerWakesWaiter() {
        CompletableFuture<PermissionStatus> answer =
                CompletableFuture.supplyAsync(() -> source.requestPermission(Duration.ofSeconds(10)));

        source.updateStatus(true, PermissionStatus.GRANTED);

        assertThat(answer.join()).isEqualTo(PermissionStatus.GRANTED);
        assertThat(source.isServiceEnabled()).isTrue();
    }

    @Test
    @DisplayName("Unanswered permission request times out as UNDETERMINED")
    void permissionTimeout() {
        assertThat(source.requestPermission(Duration.ofMillis(50))).isEqualTo(PermissionStatus.UNDETERMINED);

        source.updateStatus(false, null);

        assertThat(source.isServiceEnabled()).isFalse();
        assertThat(source.requestPermission(Duration.ZERO)).isEqualTo(PermissionStatus.UNDETERMINED);
    }

    private static Position fix(double lat) {
        return Position.builder()
                .latitude(lat)
                .longitude(127.0)
                .speed(3.0)
                .timestamp(LocalDateTime.of(2025, 3, 28, 9, 0))
                .build();
    }
}
