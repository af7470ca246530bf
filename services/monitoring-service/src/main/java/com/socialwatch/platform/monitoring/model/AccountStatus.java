package com.socialwatch.platform.monitoring.model;

public enum AccountStatus {
    ACTIVE,
    PAUSED,
    STOPPED
}
