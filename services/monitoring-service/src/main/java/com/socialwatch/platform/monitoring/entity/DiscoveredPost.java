package com.socialwatch.platform.monitoring.entity;

import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.PostType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "discovered_posts",
        uniqueConstraints = @UniqueConstraint(name = "uk_platform_post",
                columnNames = {"platform", "platform_post_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredPost {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Platform platform;

    @Column(name = "platform_post_id", nullable = false, length = 500)
    private String platformPostId;

    @Column(name = "post_url", columnDefinition = "TEXT")
    private String postUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "post_type", length = 20)
    private PostType postType;

    @Column(columnDefinition = "TEXT")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_urls", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> imageUrls = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "video_urls", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> videoUrls = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_metadata", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> rawMetadata = new HashMap<>();

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Builder.Default
    private Boolean notified = false;

    @Column(name = "notified_at")
    private OffsetDateTime notifiedAt;

    @Column(name = "notification_error", columnDefinition = "TEXT")
    private String notificationError;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
