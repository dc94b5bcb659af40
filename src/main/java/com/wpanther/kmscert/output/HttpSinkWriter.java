package com.wpanther.kmscert.output;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * POSTs the certificate to an HTTP endpoint
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpSinkWriter {

    static final String PEM_CONTENT_TYPE = "application/x-pem-file";
    static final String JSON_CONTENT_TYPE = "application/json";

    private final HttpClient httpClient;

    @Value("${app.http.timeout-seconds:30}")
    private long timeoutSeconds = 30;

    public void write(SinkTarget.HttpPost target, String payload) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(target.getUrl()))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", target.isJson() ? JSON_CONTENT_TYPE : PEM_CONTENT_TYPE)
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SinkWriteException("Cannot POST certificate to " + target.getUrl() + ": " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Failed to POST certificate", e);
            throw new SinkWriteException("Failed to POST certificate to " + target.getUrl() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkWriteException("Interrupted while posting certificate to " + target.getUrl(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new SinkWriteException("POST to " + target.getUrl() + " returned HTTP status " + response.statusCode());
        }
        log.info("Posted certificate to {} (HTTP {})", target.getUrl(), response.statusCode());
    }
}
