package com.deliverzler.triptracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Trip Lifecycle & Offline GPS Synchronization Engine
 */
@SpringBootApplication
public class TripTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripTrackingApplication.class, args);
    }

}
