package com.company.eventrelay.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Client for posting webhook payloads to subscriber endpoints.
 * Performs a single HTTP call; retries are the caller's concern.
 */
@Component
public class WebhookClient {

    private static final Logger logger = LoggerFactory.getLogger(WebhookClient.class);

    private final RestTemplate restTemplate;

    public WebhookClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Posts the exact payload bytes to the given URL.
     *
     * @param url The subscriber endpoint
     * @param payload The serialized body, sent unchanged so the signature stays valid
     * @param headers Request headers, including content type and signature
     * @return WebhookResponse with the status code, body and duration of the call
     * @throws IllegalArgumentException if the URL is not a valid URI
     * @throws RestClientException on transport failures (timeout, refused connection, DNS)
     */
    public WebhookResponse sendWebhook(String url, byte[] payload, HttpHeaders headers) {
        URI uri = URI.create(url);
        HttpEntity<byte[]> entity = new HttpEntity<>(payload, headers);

        logger.trace("Webhook request - URL: {}, Headers: {}", url, headers.keySet());

        long startTime = System.nanoTime();
        ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.POST, entity, String.class);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);

        logger.debug("Webhook to {} answered {} in {}ms", url, response.getStatusCodeValue(), durationMs);

        return new WebhookResponse(response.getStatusCodeValue(), response.getBody(), durationMs);
    }

    /**
     * Response of a single webhook call.
     */
    public static class WebhookResponse {
        private final int statusCode;
        private final String body;
        private final long durationMs;

        public WebhookResponse(int statusCode, String body, long durationMs) {
            this.statusCode = statusCode;
            this.body = body;
            this.durationMs = durationMs;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getBody() {
            return body;
        }

        public long getDurationMs() {
            return durationMs;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
