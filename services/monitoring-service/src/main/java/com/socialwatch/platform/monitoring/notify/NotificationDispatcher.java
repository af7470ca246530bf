package com.socialwatch.platform.monitoring.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.entity.WebhookDestination;
import com.socialwatch.platform.monitoring.model.StatField;
import com.socialwatch.platform.monitoring.service.ResourceNotFoundException;
import com.socialwatch.platform.monitoring.store.MonitoringStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class NotificationDispatcher {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final WebhookPayloadRenderer payloadRenderer;
    private final PayloadSigner signer;
    private final MonitoringStore store;
    private final Clock clock;
    private final Duration deliveryTimeout;
    private final String signatureHeader;
    private final ZoneId zone;

    public NotificationDispatcher(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                  WebhookPayloadRenderer payloadRenderer, PayloadSigner signer,
                                  MonitoringStore store, MonitoringProperties properties, Clock clock) {
        this.webClient = webClientBuilder.clone().build();
        this.objectMapper = objectMapper;
        this.payloadRenderer = payloadRenderer;
        this.signer = signer;
        this.store = store;
        this.clock = clock;
        this.deliveryTimeout = properties.getNotify().getDeliveryTimeout();
        this.signatureHeader = properties.getNotify().getSignatureHeader();
        this.zone = properties.getScheduler().getZoneId();
    }

    /**
     * Sends one notification to one destination. Never throws: every problem ends up in the result.
     */
    public DeliveryResult notify(WebhookDestination destination, PostNotification notification) {
        long started = System.nanoTime();
        try {
            String body = objectMapper.writeValueAsString(
                    payloadRenderer.render(destination.getProvider(), destination.getMessageTemplate(), notification));

            ResponseEntity<Void> response = webClient.post()
                    .uri(URI.create(destination.getTargetUrl()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (destination.getCustomHeaders() != null) {
                            destination.getCustomHeaders().forEach(headers::set);
                        }
                        String secret = destination.getSigningSecret();
                        if (secret != null && !secret.isEmpty()) {
                            headers.set(signatureHeader, signer.sign(body, secret));
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(deliveryTimeout)
                    .block();

            int status = response != null ? response.getStatusCode().value() : 0;
            log.info("Webhook {} ({}) accepted post {} with HTTP {}",
                    destination.getName(), destination.getProvider().getCode(), notification.getPostId(), status);
            return DeliveryResult.success(destination.getId(), status, elapsedMillis(started));
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            int status = cause instanceof WebClientResponseException
                    ? ((WebClientResponseException) cause).getStatusCode().value()
                    : 0;
            String message = describe(cause);
            log.warn("Webhook {} ({}) failed for post {}: {}",
                    destination.getName(), destination.getProvider() != null ? destination.getProvider().getCode() : "?",
                    notification.getPostId(), message);
            return DeliveryResult.failure(destination.getId(), status, message, elapsedMillis(started));
        }
    }

    public int dispatch(MonitoredAccount account, UUID postId, PostNotification notification) {
        List<WebhookDestination> destinations = store.listActiveWebhooks(account.getUserId());
        if (destinations.isEmpty()) {
            log.debug("No active webhooks for user {}, post {} not forwarded", account.getUserId(), notification.getPostId());
            return 0;
        }

        int delivered = 0;
        String lastError = null;
        for (WebhookDestination destination : destinations) {
            DeliveryResult result = notify(destination, notification);
            try {
                store.recordWebhookOutcome(destination.getId(), result.isSuccess(), result.getErrorMessage());
                if (result.isSuccess()) {
                    store.incrementDailyStat(account.getUserId(), account.getPlatform(), today(), StatField.NOTIFICATIONS_SENT);
                }
            } catch (RuntimeException e) {
                log.error("Could not record delivery outcome for webhook {}: {}", destination.getId(), e.getMessage(), e);
            }
            if (result.isSuccess()) {
                delivered++;
            } else {
                lastError = destination.getName() + ": " + result.getErrorMessage();
            }
        }

        if (delivered > 0) {
            store.markPostNotified(postId);
        } else {
            store.recordPostNotificationError(postId, lastError);
        }
        return delivered;
    }

    public DeliveryResult sendTest(UUID destinationId) {
        WebhookDestination destination = store.findWebhook(destinationId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook destination not found: " + destinationId));
        return notify(destination, PostNotification.sample(OffsetDateTime.now(clock)));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Timed out after " + deliveryTimeout.toMillis() + " ms";
        }
        if (cause instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) cause;
            return "HTTP " + response.getStatusCode().value() + " " + response.getStatusText();
        }
        if (cause instanceof WebClientRequestException) {
            return "Connection failed: " + cause.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
