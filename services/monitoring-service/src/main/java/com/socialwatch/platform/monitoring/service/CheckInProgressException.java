package com.socialwatch.platform.monitoring.service;

public class CheckInProgressException extends RuntimeException {

    public CheckInProgressException() {
        super("A monitoring check is already in progress");
    }
}
