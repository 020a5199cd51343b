package com.deliverzler.triptracking.config;

import com.deliverzler.triptracking.util.Retrier;
import com.deliverzler.triptracking.util.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * HTTP client, clock and retry support shared by the services.
 */
@Configuration
public class ClientConfig {

    @Bean
    public HttpClient httpClient(@Value("${remote.api.connect-timeout-seconds:10}") long connectTimeoutSeconds) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Retrier retrier() {
        return new Retrier(Sleeper.THREAD);
    }
}
