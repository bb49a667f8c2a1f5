package com.company.eventrelay.domain.service.webhook;

import com.company.eventrelay.config.DatabaseConfig;
import com.company.eventrelay.domain.enums.DeliveryStatus;
import com.company.eventrelay.domain.model.WebhookSubscription;
import com.company.eventrelay.domain.repository.WebhookSubscriptionRepository;
import com.company.eventrelay.infrastructure.http.HttpClientConfig;
import com.company.eventrelay.infrastructure.http.WebhookClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Delivery engine wired to the real registry and repository, with subscriber
 * endpoints served by {@link MockRestServiceServer}.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(DatabaseConfig.class)
@DisplayName("Webhook delivery against the persisted registry")
class WebhookDeliveryIntegrationTest {

    private static final String URL = "https://agent.test/hook";
    private static final String SECRET = "s3cr3t";

    @Autowired
    private WebhookSubscriptionRepository repository;

    private final WebhookSigner signer = new WebhookSigner("HmacSHA256", "sha256=");

    private SubscriptionRegistry registry;
    private MockRestServiceServer server;
    private WebhookDeliveryService deliveryService;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        registry = new SubscriptionRegistry(repository, 5, 6);

        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setErrorHandler(new HttpClientConfig.PassThroughResponseErrorHandler());
        server = MockRestServiceServer.bindTo(restTemplate).build();

        deliveryService = new WebhookDeliveryServiceImpl(registry, signer, new WebhookClient(restTemplate),
                new RetryBackoffPolicy(0, 2.0, 0), new ObjectMapper(), Runnable::run, 3);
    }

    private WebhookSubscription register(int maxFailedAttempts, String event) {
        return registry.register("TestAgent", URL, Collections.singletonList(event), SECRET, maxFailedAttempts);
    }

    private WebhookSubscription reload(WebhookSubscription subscription) {
        return repository.findById(subscription.getId()).orElseThrow();
    }

    @Test
    @DisplayName("Should stamp the last successful call and reset the counter on a signed delivery")
    void shouldPersistSuccess() {
        // Given
        WebhookSubscription subscription = register(5, "booking.created");
        registry.recordFailure(subscription.getId());
        assertThat(reload(subscription).getFailedAttempts()).isEqualTo(1);

        server.expect(ExpectedCount.once(), requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(request -> {
                    MockClientHttpRequest sent = (MockClientHttpRequest) request;
                    String signature = sent.getHeaders().getFirst(WebhookDeliveryServiceImpl.SIGNATURE_HEADER);
                    assertThat(signer.verify(SECRET, sent.getBodyAsBytes(), signature)).isTrue();
                })
                .andRespond(withSuccess());

        // When
        DeliveryReport report = deliveryService.deliverEvent("booking.created",
                Collections.singletonMap("booking_id", "B1"));

        // Then
        server.verify();
        assertThat(report.getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        WebhookSubscription stored = reload(subscription);
        assertThat(stored.getFailedAttempts()).isZero();
        assertThat(stored.getLastSuccessfulCall()).isNotNull();
        assertThat(stored.getIsActive()).isTrue();
    }

    @Test
    @DisplayName("Should deactivate after three failed deliveries and then find no subscribers")
    void shouldDeactivateAfterRepeatedFailures() {
        // Given
        WebhookSubscription subscription = register(3, "booking.created");
        server.expect(ExpectedCount.times(9), requestTo(URL)).andRespond(withServerError());

        // When / Then
        DeliveryReport first = deliveryService.deliverEvent("booking.created", Collections.emptyMap());
        assertThat(first.getStatus()).isEqualTo(DeliveryStatus.ALL_FAILED);
        assertThat(reload(subscription).getFailedAttempts()).isEqualTo(1);
        assertThat(reload(subscription).getIsActive()).isTrue();

        deliveryService.deliverEvent("booking.created", Collections.emptyMap());
        assertThat(reload(subscription).getFailedAttempts()).isEqualTo(2);
        assertThat(reload(subscription).getIsActive()).isTrue();

        DeliveryReport third = deliveryService.deliverEvent("booking.created", Collections.emptyMap());
        assertThat(third.getOutcomes()).singleElement()
                .satisfies(outcome -> assertThat(outcome.isDeactivated()).isTrue());
        assertThat(reload(subscription).getFailedAttempts()).isEqualTo(3);
        assertThat(reload(subscription).getIsActive()).isFalse();

        DeliveryReport fourth = deliveryService.deliverEvent("booking.created", Collections.emptyMap());
        assertThat(fourth.getStatus()).isEqualTo(DeliveryStatus.NO_SUBSCRIBERS);
        server.verify();
    }

    @Test
    @DisplayName("Should make no HTTP call for an event nobody subscribed to")
    void shouldSkipUnmatchedEvent() {
        // Given
        WebhookSubscription subscription = register(5, "payment.received");

        // When
        DeliveryReport report = deliveryService.deliverEvent("booking.cancelled",
                Collections.singletonMap("booking_id", "B1"));

        // Then
        assertThat(report.getStatus()).isEqualTo(DeliveryStatus.NO_SUBSCRIBERS);
        assertThat(report.getOutcomes()).isEmpty();
        server.verify();
        WebhookSubscription stored = reload(subscription);
        assertThat(stored.getFailedAttempts()).isZero();
        assertThat(stored.getLastSuccessfulCall()).isNull();
    }
}
