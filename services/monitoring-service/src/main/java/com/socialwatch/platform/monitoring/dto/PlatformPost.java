package com.socialwatch.platform.monitoring.dto;

import com.socialwatch.platform.monitoring.model.PostType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformPost {
    private String postId;
    private String postUrl;
    private PostType postType;
    private String content;
    @Builder.Default
    private List<String> imageUrls = List.of();
    @Builder.Default
    private List<String> videoUrls = List.of();
    private OffsetDateTime publishedAt;
    private Long likes;
    private Long shares;
    private Long comments;
    private Long views;

    // Platform-specific data
    @Builder.Default
    private Map<String, Object> metadata = Map.of();
}
