package com.deliverzler.triptracking.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Online when the API host answers an HTTP probe at all, whatever the status code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpConnectivityChecker implements ConnectivityChecker {

    private final HttpClient httpClient;

    @Value("${connectivity.probe-url:${remote.api.base-url}}")
    private String probeUrl;

    @Value("${connectivity.timeout-ms:3000}")
    private long timeoutMs;

    @Override
    public boolean isOnline() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(probeUrl))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .timeout(Duration.ofMillis(timeoutMs))
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            log.trace("Connectivity probe answered {}", response.statusCode());
            return true;
        } catch (IOException e) {
            log.debug("Connectivity probe failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
