package com.socialwatch.platform.monitoring.model;

import lombok.Getter;

import java.util.Arrays;

@Getter
public enum Platform {
    WEIBO("weibo", "Weibo"),
    X_TWITTER("x_twitter", "X (Twitter)");

    private final String code;
    private final String displayName;

    Platform(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Accepts either the wire code ({@code x_twitter}) or the enum name ({@code X_TWITTER}).
     */
    public static Platform fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Platform must not be null");
        }
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported platform: " + value));
    }
}
