package com.socialwatch.platform.monitoring.dto;

import com.socialwatch.platform.monitoring.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformProfile {
    private Platform platform;
    private String accountId;
    private String username;
    private String displayName;
    private String avatarUrl;
    private Long followerCount;
    private Long followingCount;
    private Long postCount;
    private boolean verified;
    private String bio;
    private String profileUrl;
    // strategy that produced this profile
    private String source;
    private boolean placeholder;

    public static PlatformProfile placeholder(Platform platform, String accountId) {
        return PlatformProfile.builder()
                .platform(platform)
                .accountId(accountId)
                .username(platform.getCode() + "_user_" + tail(accountId, 6))
                .displayName(platform.getDisplayName() + " user " + tail(accountId, 4))
                .followerCount(0L)
                .followingCount(0L)
                .postCount(0L)
                .verified(false)
                .bio("")
                .source("placeholder")
                .placeholder(true)
                .build();
    }

    private static String tail(String value, int length) {
        return value.length() <= length ? value : value.substring(value.length() - length);
    }
}
