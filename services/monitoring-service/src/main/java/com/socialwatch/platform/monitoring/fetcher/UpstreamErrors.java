package com.socialwatch.platform.monitoring.fetcher;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

public final class UpstreamErrors {

    private UpstreamErrors() {
    }

    public static boolean isTransientStatus(int status) {
        return status >= 500 || status == 429 || status == 408;
    }

    public static UpstreamException classify(Throwable error) {
        if (error instanceof UpstreamException) {
            return (UpstreamException) error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            String message = "HTTP " + status + " from " + requestUri(response);
            return isTransientStatus(status)
                    ? new TransientUpstreamException(message, status, error)
                    : new PermanentUpstreamException(message, status, error);
        }
        if (error instanceof TimeoutException) {
            return new TransientUpstreamException("Request timed out", 0, error);
        }
        if (error instanceof WebClientRequestException) {
            return new TransientUpstreamException("Network error: " + error.getMessage(), 0, error);
        }
        return new PermanentUpstreamException(error.getClass().getSimpleName() + ": " + error.getMessage(), 0, error);
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof UpstreamException && ((UpstreamException) error).isTransient();
    }

    private static String requestUri(WebClientResponseException e) {
        return e.getRequest() != null ? e.getRequest().getURI().getPath() : "upstream";
    }
}
