package com.socialwatch.platform.monitoring.fetcher;

import lombok.Getter;

@Getter
public abstract class UpstreamException extends RuntimeException {

    // HTTP status when the failure came from a response, otherwise 0
    private final int status;

    protected UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public abstract boolean isTransient();
}
