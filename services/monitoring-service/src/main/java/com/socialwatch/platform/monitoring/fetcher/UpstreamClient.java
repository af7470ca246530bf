package com.socialwatch.platform.monitoring.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

@Slf4j
public class UpstreamClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final PlatformSession session;
    private final URI warmUpUri;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final Duration retryBaseDelay;

    public UpstreamClient(WebClient webClient, ObjectMapper objectMapper, MonitoringProperties.Fetch settings,
                          PlatformSession session, URI warmUpUri) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.session = session;
        this.warmUpUri = warmUpUri;
        this.requestTimeout = settings.getRequestTimeout();
        this.maxRetries = settings.getMaxRetries();
        this.retryBaseDelay = settings.getRetryBaseDelay();
    }

    public String getText(URI uri, Map<String, String> headers) {
        ensureSession();
        return exchange(uri, headers)
                .retryWhen(Retry.backoff(maxRetries, retryBaseDelay)
                        .filter(UpstreamErrors::isTransient)
                        .doBeforeRetry(signal -> log.debug("Retrying {} (attempt {}): {}",
                                uri.getPath(), signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    public JsonNode getJson(URI uri, Map<String, String> headers) {
        String body = getText(uri, headers);
        if (body == null || body.isBlank()) {
            throw new PermanentUpstreamException("Empty response body from " + uri.getPath());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentUpstreamException("Response from " + uri.getPath() + " is not JSON", 0, e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private Mono<String> exchange(URI uri, Map<String, String> headers) {
        return webClient.get()
                .uri(uri)
                .headers(h -> {
                    headers.forEach(h::set);
                    if (session != null) {
                        session.cookieHeader().ifPresent(cookie -> h.set(HttpHeaders.COOKIE, cookie));
                    }
                })
                .exchangeToMono(this::readBody)
                .timeout(requestTimeout)
                .onErrorMap(UpstreamErrors::classify);
    }

    private Mono<String> readBody(ClientResponse response) {
        if (session != null) {
            session.absorb(response.headers().header(HttpHeaders.SET_COOKIE));
        }
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        return response.createException().flatMap(Mono::error);
    }

    private void ensureSession() {
        if (session == null || warmUpUri == null || !session.needsRefresh()) {
            return;
        }
        try {
            exchange(warmUpUri, Map.of()).block();
            session.markRefreshed();
            log.debug("Session refreshed via {}", warmUpUri);
        } catch (UpstreamException e) {
            // a cold session still works for most endpoints, try again on the next call
            log.warn("Session warm-up against {} failed: {}", warmUpUri, e.getMessage());
        }
    }
}
