package com.deliverzler.triptracking.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Driver-facing notification, audio cue and vibration sink.
 *
 * Messages are pushed to /topic/notifications for the device app to show.
 * Everything here is fire-and-forget: a failed push is logged, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    public static final String NOTIFICATION_TOPIC = "/topic/notifications";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    private final AtomicBoolean cuePlaying = new AtomicBoolean(false);

    /** Shows one local notification with the given text. */
    public void notify(String text) {
        log.info("[NOTIFICATION] {}", text);
        push("NOTIFICATION", text);
    }

    /** Starts the arrival sound. */
    public void playCue() {
        cuePlaying.set(true);
        log.info("[CUE] Playing arrival sound");
        push("CUE", null);
    }

    public void vibrate() {
        log.info("[CUE] Vibrating");
        push("VIBRATE", null);
    }

    /** Stops the arrival sound if one is playing. */
    public void stopCue() {
        if (cuePlaying.compareAndSet(true, false)) {
            log.info("[CUE] Stopping arrival sound");
            push("CUE_STOP", null);
        }
    }

    public boolean isCuePlaying() {
        return cuePlaying.get();
    }

    private void push(String kind, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", kind);
        payload.put("text", text);
        payload.put("timestamp", LocalDateTime.now(clock).toString());
        try {
            messagingTemplate.convertAndSend(NOTIFICATION_TOPIC, payload);
        } catch (MessagingException e) {
            log.warn("Could not push {} to {}: {}", kind, NOTIFICATION_TOPIC, e.getMessage());
        }
    }
}
