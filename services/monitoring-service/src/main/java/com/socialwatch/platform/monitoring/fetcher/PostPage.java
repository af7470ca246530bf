package com.socialwatch.platform.monitoring.fetcher;

import com.socialwatch.platform.monitoring.dto.PlatformPost;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PostPage {
    private List<PlatformPost> posts;
    private boolean hasMore;
    private String nextCursor;

    public static PostPage of(List<PlatformPost> posts) {
        return new PostPage(posts, !posts.isEmpty(), null);
    }

    public static PostPage last(List<PlatformPost> posts) {
        return new PostPage(posts, false, null);
    }

    public static PostPage withCursor(List<PlatformPost> posts, String nextCursor) {
        return new PostPage(posts, nextCursor != null && !posts.isEmpty(), nextCursor);
    }
}
