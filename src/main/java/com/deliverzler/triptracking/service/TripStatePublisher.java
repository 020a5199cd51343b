package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.dto.TripSnapshot;
import com.deliverzler.triptracking.model.TripState;
import com.deliverzler.triptracking.model.TripTerminationNotice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes trip state changes and termination notices to STOMP subscribers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TripStatePublisher {

    public static final String STATE_TOPIC = "/topic/trip-state";
    public static final String EVENTS_TOPIC = "/topic/trip-events";

    private final SimpMessagingTemplate messagingTemplate;

    /** @param state current state, null once the trip is gone */
    public void publishState(TripState state) {
        send(STATE_TOPIC, state != null ? TripSnapshot.from(state) : TripSnapshot.idle());
    }

    public void publishTermination(TripTerminationNotice notice) {
        send(EVENTS_TOPIC, notice);
    }

    private void send(String topic, Object payload) {
        try {
            messagingTemplate.convertAndSend(topic, payload);
        } catch (MessagingException e) {
            log.warn("Could not publish to {}: {}", topic, e.getMessage());
        }
    }
}
