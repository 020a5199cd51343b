package com.deliverzler.triptracking.config;

import com.deliverzler.triptracking.service.TripLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Resumes the driver's uncompleted trip once the application is up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TripRecoveryRunner implements ApplicationRunner {

    private final TripLifecycleService tripLifecycleService;

    @Value("${trip.recovery.on-startup:true}")
    private boolean recoverOnStartup;

    @Override
    public void run(ApplicationArguments args) {
        if (!recoverOnStartup) {
            log.info("Trip recovery on startup disabled");
            return;
        }
        log.info("Looking for an uncompleted trip to resume...");
        tripLifecycleService.recoverUncompletedTrip()
                .ifPresentOrElse(
                        s -> log.info("Resumed trip #{}", s.getTripId()),
                        () -> log.info("No trip to resume"));
    }
}
