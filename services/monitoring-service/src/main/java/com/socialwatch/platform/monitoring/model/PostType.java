package com.socialwatch.platform.monitoring.model;

public enum PostType {
    TEXT,
    IMAGE,
    VIDEO,
    MIXED;

    public static PostType classify(boolean hasText, boolean hasImages, boolean hasVideos) {
        if (hasVideos) return VIDEO;
        if (hasImages && hasText) return MIXED;
        if (hasImages) return IMAGE;
        return TEXT;
    }

    public String code() {
        return name().toLowerCase();
    }
}
