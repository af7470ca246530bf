package com.socialwatch.platform.monitoring.fetcher;

public class TransientUpstreamException extends UpstreamException {

    public TransientUpstreamException(String message, int status, Throwable cause) {
        super(message, status, cause);
    }

    public TransientUpstreamException(String message) {
        this(message, 0, null);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
