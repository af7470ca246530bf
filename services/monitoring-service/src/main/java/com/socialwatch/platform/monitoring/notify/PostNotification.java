package com.socialwatch.platform.monitoring.notify;

import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.PostType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostNotification {
    private Platform platform;
    private String targetUsername;
    private String targetDisplayName;
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

    public static PostNotification of(MonitoredAccount account, PlatformPost post) {
        String username = account.getTargetUsername() != null ? account.getTargetUsername() : account.getTargetAccountId();
        return PostNotification.builder()
                .platform(account.getPlatform())
                .targetUsername(username)
                .targetDisplayName(account.getTargetDisplayName() != null ? account.getTargetDisplayName() : username)
                .postId(post.getPostId())
                .postUrl(post.getPostUrl())
                .postType(post.getPostType())
                .content(post.getContent())
                .imageUrls(post.getImageUrls() != null ? post.getImageUrls() : List.of())
                .videoUrls(post.getVideoUrls() != null ? post.getVideoUrls() : List.of())
                .publishedAt(post.getPublishedAt())
                .likes(post.getLikes())
                .shares(post.getShares())
                .comments(post.getComments())
                .views(post.getViews())
                .build();
    }

    public static PostNotification sample(OffsetDateTime now) {
        return PostNotification.builder()
                .platform(Platform.WEIBO)
                .targetUsername("test_user")
                .targetDisplayName("Test User")
                .postId("test_post_id")
                .postUrl("https://example.com/test")
                .postType(PostType.TEXT)
                .content("This is a test notification from the social media monitoring service.")
                .publishedAt(now)
                .likes(10L)
                .shares(5L)
                .comments(3L)
                .build();
    }
}
