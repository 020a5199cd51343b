package com.deliverzler.triptracking.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.config.annotation.SockJsServiceRegistration;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.StompWebSocketEndpointRegistration;

import static org.mockito.Mockito.*;

class WebSocketConfigTest {

    private final WebSocketConfig webSocketConfig = new WebSocketConfig();

    @Test
    @DisplayName("Broker serves exactly the trip state, trip event and notification topics")
    void brokerServesTripTopics() {
        MessageBrokerRegistry registry = mock(MessageBrokerRegistry.class);

        webSocketConfig.configureMessageBroker(registry);

        verify(registry).enableSimpleBroker("/topic/trip-state", "/topic/trip-events", "/topic/notifications");
        verify(registry, never()).setApplicationDestinationPrefixes(any(String[].class));
    }

    @Test
    @DisplayName("The /ws endpoint uses the configured origins with SockJS")
    void endpointUsesConfiguredOrigins() {
        ReflectionTestUtils.setField(webSocketConfig, "allowedOrigins", new String[]{"https://driver.example"});
        StompEndpointRegistry registry = mock(StompEndpointRegistry.class);
        StompWebSocketEndpointRegistration registration = mock(StompWebSocketEndpointRegistration.class);
        when(registry.addEndpoint("/ws")).thenReturn(registration);
        when(registration.setAllowedOriginPatterns("https://driver.example")).thenReturn(registration);
        when(registration.withSockJS()).thenReturn(mock(SockJsServiceRegistration.class));

        webSocketConfig.registerStompEndpoints(registry);

        verify(registration).setAllowedOriginPatterns("https://driver.example");
        verify(registration).withSockJS();
    }
}
