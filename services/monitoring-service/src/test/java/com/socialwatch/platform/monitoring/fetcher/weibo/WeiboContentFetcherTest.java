package com.socialwatch.platform.monitoring.fetcher.weibo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.fetcher.AllStrategiesFailedException;
import com.socialwatch.platform.monitoring.model.PostType;
import com.socialwatch.platform.monitoring.support.MutableClock;
import com.socialwatch.platform.monitoring.support.ScriptedDispatcher;
import com.socialwatch.platform.monitoring.support.TestProperties;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static com.socialwatch.platform.monitoring.support.Fixtures.read;
import static com.socialwatch.platform.monitoring.support.ScriptedDispatcher.html;
import static com.socialwatch.platform.monitoring.support.ScriptedDispatcher.json;
import static com.socialwatch.platform.monitoring.support.ScriptedDispatcher.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeiboContentFetcherTest {

    private MockWebServer server;
    private ScriptedDispatcher dispatcher;
    private WeiboContentFetcher fetcher;
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T14:00:00Z"));

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = new ScriptedDispatcher(WeiboContentFetcherTest::route);
        dispatcher.on("warmup", html("<html></html>").addHeader("Set-Cookie", "_T_WM=session; Path=/"));
        server = new MockWebServer();
        server.setDispatcher(dispatcher);
        server.start();

        MonitoringProperties properties = TestProperties.fast();
        properties.getPlatforms().getWeibo().setBaseUrl(server.url("/").toString());
        properties.getPlatforms().getWeibo().setApiBaseUrl(server.url("/open/2").toString());
        fetcher = new WeiboContentFetcher(WebClient.builder(), new ObjectMapper(), properties, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsProfileFromContainerApi() {
        dispatcher.on("container-user", json(read("fixtures/weibo/container-user.json")));

        PlatformProfile profile = fetcher.fetchProfile("1001");

        assertThat(profile.getUsername()).isEqualTo("旅行的猫");
        assertThat(profile.getFollowerCount()).isEqualTo(759_000L);
        assertThat(profile.getFollowingCount()).isEqualTo(321L);
        assertThat(profile.getAvatarUrl()).endsWith("cat_hd.jpg");
        assertThat(profile.isVerified()).isTrue();
        assertThat(profile.getSource()).isEqualTo("container-api");
        assertThat(profile.isPlaceholder()).isFalse();
    }

    @Test
    void fallsBackToProfilePageWhenApisRefuse() {
        dispatcher.on("container-user", status(403));
        dispatcher.on("show", json("{\"ok\":0,\"msg\":\"请求过于频繁\"}"));
        dispatcher.on("page", html(read("fixtures/weibo/profile-page.html")));

        PlatformProfile profile = fetcher.fetchProfile("1001");

        assertThat(profile.getSource()).isEqualTo("profile-page");
        assertThat(profile.getUsername()).isEqualTo("旅行的猫");
        assertThat(profile.getFollowerCount()).isEqualTo(759_000L);
        assertThat(dispatcher.calls()).containsSubsequence("container-user", "show", "page");
        assertThat(dispatcher.calls()).doesNotContain("search");
    }

    @Test
    void profilePageTitleIsLastResortBeforeSearch() {
        dispatcher.on("container-user", status(403));
        dispatcher.on("show", status(404));
        dispatcher.on("page", html(read("fixtures/weibo/title-only.html")));

        PlatformProfile profile = fetcher.fetchProfile("1001");

        assertThat(profile.getUsername()).isEqualTo("旅行的猫");
        assertThat(profile.getFollowerCount()).isEqualTo(759_000L);
        assertThat(profile.getFollowingCount()).isEqualTo(321L);
        assertThat(profile.isVerified()).isTrue();
    }

    @Test
    void openApiIsSkippedWithoutTokenAndEverythingFailing() {
        dispatcher.on("container-user", status(403));
        dispatcher.on("show", status(403));
        dispatcher.on("page", status(403));
        dispatcher.on("search", status(403));

        assertThatThrownBy(() -> fetcher.fetchProfile("1001"))
                .isInstanceOf(AllStrategiesFailedException.class)
                .satisfies(e -> assertThat(((AllStrategiesFailedException) e).getFailures())
                        .containsOnlyKeys("container-api", "show-api", "profile-page", "search-api", "open-api"));
        assertThat(dispatcher.calls()).noneMatch(call -> call.startsWith("open"));
    }

    @Test
    void readsTimelineWithLongTextMediaAndChineseCounts() {
        dispatcher.on("container-user", json(read("fixtures/weibo/container-user.json")));
        dispatcher.on("timeline:1076031001:1", json(read("fixtures/weibo/timeline-page1.json")));
        dispatcher.on("timeline:1076031001:2", json("{\"ok\":0,\"msg\":\"这里还没有内容\"}"));
        dispatcher.on("extend:4990000000000200", json(read("fixtures/weibo/extend.json")));

        List<PlatformPost> posts = fetcher.fetchRecentPosts("1001", null, null);

        assertThat(posts).extracting(PlatformPost::getPostId)
                .containsExactly("4990000000000300", "4990000000000200", "4990000000000100");

        PlatformPost mixed = posts.get(0);
        assertThat(mixed.getPostType()).isEqualTo(PostType.MIXED);
        assertThat(mixed.getContent()).isEqualTo("今天去了#杭州#西湖&灵隐寺 @小明 一起");
        assertThat(mixed.getImageUrls()).containsExactly(
                "https://wx1.sinaimg.cn/large/p1.jpg", "https://wx1.sinaimg.cn/orj360/p2.jpg");
        assertThat(mixed.getLikes()).isEqualTo(12_000L);
        assertThat(mixed.getPostUrl()).endsWith("/status/NcXyZ3");
        assertThat(mixed.getPublishedAt().toInstant()).isEqualTo(Instant.parse("2024-05-01T11:30:00Z"));
        assertThat(mixed.getMetadata()).containsEntry("topics", List.of("杭州"))
                .containsEntry("mentions", List.of("小明"));

        PlatformPost longText = posts.get(1);
        assertThat(longText.getContent()).isEqualTo("这是一条很长的微博，完整内容在这里。 第二段 #长文#");
        assertThat(longText.getPostType()).isEqualTo(PostType.TEXT);

        PlatformPost video = posts.get(2);
        assertThat(video.getPostType()).isEqualTo(PostType.VIDEO);
        assertThat(video.getVideoUrls()).containsExactly("https://f.video.weibocdn.com/hd.mp4");
    }

    @Test
    void retriesTransientTimelineErrors() {
        dispatcher.on("container-user", json(read("fixtures/weibo/container-user.json")));
        dispatcher.on("timeline:1076031001:1", status(500), status(502), json(read("fixtures/weibo/timeline-page1.json")));
        dispatcher.on("extend:4990000000000200", status(400));

        List<PlatformPost> posts = fetcher.fetchRecentPosts("1001", "4990000000000100", null);

        assertThat(posts).extracting(PlatformPost::getPostId)
                .containsExactly("4990000000000300", "4990000000000200");
        assertThat(dispatcher.count("timeline:1076031001:1")).isEqualTo(3);
        // long text lookup failed, the excerpt is kept
        assertThat(posts.get(1).getContent()).startsWith("这是一条很长的微博……");
    }

    @Test
    void probesWellKnownContainerPrefixesWhenTabsAreMissing() {
        dispatcher.on("container-user", json("{\"ok\":1,\"data\":{\"userInfo\":{\"screen_name\":\"x\"}}}"));
        dispatcher.on("timeline:1076031001:1", json(read("fixtures/weibo/timeline-page1.json")));
        dispatcher.on("timeline:1076031001:2", json("{\"ok\":0}"));
        dispatcher.on("extend:4990000000000200", json(read("fixtures/weibo/extend.json")));

        List<PlatformPost> posts = fetcher.fetchRecentPosts("1001", null, null);

        assertThat(posts).hasSize(3);
        assertThat(dispatcher.calls()).contains("timeline:1076031001:1");
    }

    @Test
    void fallsBackToProfilePagePosts() {
        dispatcher.on("container-user", status(403));
        dispatcher.on("page", html(read("fixtures/weibo/profile-page.html")));

        List<PlatformPost> posts = fetcher.fetchRecentPosts("1001", null, null);

        assertThat(posts).singleElement().satisfies(post -> {
            assertThat(post.getPostId()).isEqualTo("4990000000000999");
            assertThat(post.getContent()).isEqualTo("页面里的微博 [哈哈]");
            assertThat(post.getPostType()).isEqualTo(PostType.TEXT);
        });
    }

    @Test
    void warmUpCookiesAreSentWithApiCalls() throws InterruptedException {
        dispatcher.on("container-user", json(read("fixtures/weibo/container-user.json")));

        fetcher.fetchProfile("1001");

        assertThat(server.takeRequest().getPath()).isEqualTo("/");
        assertThat(server.takeRequest().getHeader("Cookie")).isEqualTo("_T_WM=session");
    }

    static String route(HttpUrl url) {
        String path = url.encodedPath();
        return switch (path) {
            case "/" -> "warmup";
            case "/api/users/show.json" -> "show";
            case "/api/statuses/extend" -> "extend:" + url.queryParameter("id");
            case "/u/1001" -> "page";
            case "/api/container/getIndex" -> containerRoute(url);
            default -> path.startsWith("/open/") ? "open" + path : path;
        };
    }

    private static String containerRoute(HttpUrl url) {
        if ("uid".equals(url.queryParameter("type"))) {
            return "container-user";
        }
        String containerId = url.queryParameter("containerid");
        if (containerId != null && containerId.startsWith("100103")) {
            return "search";
        }
        return "timeline:" + containerId + ":" + url.queryParameter("page");
    }
}
