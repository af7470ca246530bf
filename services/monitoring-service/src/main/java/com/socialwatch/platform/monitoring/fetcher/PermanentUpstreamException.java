package com.socialwatch.platform.monitoring.fetcher;

public class PermanentUpstreamException extends UpstreamException {

    public PermanentUpstreamException(String message, int status, Throwable cause) {
        super(message, status, cause);
    }

    public PermanentUpstreamException(String message) {
        this(message, 0, null);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
