package com.deliverzler.triptracking.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock private SimpMessagingTemplate messagingTemplate;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(messagingTemplate, Clock.systemDefaultZone());
    }

    @Test
    @DisplayName("Notification text is pushed to the notification topic")
    @SuppressWarnings("unchecked")
    void pushesNotification() {
        notificationService.notify("Arrived at the loading area");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(NotificationService.NOTIFICATION_TOPIC), payload.capture());
        Map<String, Object> body = (Map<String, Object>) payload.getValue();
        assertThat(body).containsEntry("kind", "NOTIFICATION").containsEntry("text", "Arrived at the loading area");
    }

    @Test
    @DisplayName("Stop only sends when a cue is playing")
    void stopCueOnlyWhenPlaying() {
        notificationService.stopCue();
        verifyNoInteractions(messagingTemplate);

        notificationService.playCue();
        notificationService.stopCue();
        notificationService.stopCue();

        assertThat(notificationService.isCuePlaying()).isFalse();
        verify(messagingTemplate, times(2)).convertAndSend(eq(NotificationService.NOTIFICATION_TOPIC), any(Object.class));
    }

    @Test
    @DisplayName("Push failure is not fatal")
    void pushFailureIsSwallowed() {
        doThrow(new MessageDeliveryException("no broker"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> notificationService.vibrate()).doesNotThrowAnyException();
    }
}
