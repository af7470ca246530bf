package com.socialwatch.platform.monitoring.model;

public enum StatField {
    CHECKS_PERFORMED,
    POSTS_FOUND,
    NOTIFICATIONS_SENT,
    ERRORS
}
