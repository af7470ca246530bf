package com.socialwatch.platform.monitoring.fetcher.twitter;

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
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.socialwatch.platform.monitoring.support.Fixtures.read;
import static com.socialwatch.platform.monitoring.support.ScriptedDispatcher.json;
import static com.socialwatch.platform.monitoring.support.ScriptedDispatcher.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TwitterContentFetcherTest {

    private MockWebServer server;
    private ScriptedDispatcher dispatcher;
    private MonitoringProperties properties;
    private TwitterContentFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = new ScriptedDispatcher(TwitterContentFetcherTest::route);
        server = new MockWebServer();
        server.setDispatcher(dispatcher);
        server.start();

        properties = TestProperties.fast();
        properties.getPlatforms().getTwitter().setApiBaseUrl(server.url("/2").toString());
        properties.getPlatforms().getTwitter().setBearerToken("test-token");
        fetcher = new TwitterContentFetcher(WebClient.builder(), new ObjectMapper(), properties,
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsProfileByIdWithBearerToken() throws InterruptedException {
        dispatcher.on("user-by-id", json(read("fixtures/twitter/user.json")));

        PlatformProfile profile = fetcher.fetchProfile("2244994945");

        assertThat(profile.getUsername()).isEqualTo("XDevelopers");
        assertThat(profile.getDisplayName()).isEqualTo("Developers");
        assertThat(profile.getFollowerCount()).isEqualTo(570_000L);
        assertThat(profile.getSource()).isEqualTo("user-by-id");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-token");
    }

    @Test
    void fallsBackToUsernameLookupForHandles() {
        dispatcher.on("user-by-id", status(400));
        dispatcher.on("user-by-username", json(read("fixtures/twitter/user.json")));

        PlatformProfile profile = fetcher.fetchProfile("@XDevelopers");

        assertThat(profile.getSource()).isEqualTo("user-by-username");
        assertThat(profile.getAccountId()).isEqualTo("@XDevelopers");
    }

    @Test
    void missingTokenFailsWithoutCallingTheApi() {
        properties.getPlatforms().getTwitter().setBearerToken("");

        assertThatThrownBy(() -> fetcher.fetchProfile("2244994945"))
                .isInstanceOf(AllStrategiesFailedException.class)
                .hasMessageContaining("bearer token");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void followsNextTokenAndMapsMedia() {
        dispatcher.on("tweets:first", json(read("fixtures/twitter/tweets-page1.json")));
        dispatcher.on("tweets:7140dibdnow9c7btw3w29", json(read("fixtures/twitter/tweets-page2.json")));

        List<PlatformPost> posts = fetcher.fetchRecentPosts("2244994945", null, null);

        assertThat(posts).extracting(PlatformPost::getPostId)
                .containsExactly("1790000000000000003", "1790000000000000002", "1790000000000000001");

        PlatformPost first = posts.get(0);
        assertThat(first.getPostType()).isEqualTo(PostType.VIDEO);
        assertThat(first.getImageUrls()).containsExactly("https://pbs.twimg.com/media/photo1.jpg");
        assertThat(first.getVideoUrls()).containsExactly("https://video.twimg.com/high.mp4");
        assertThat(first.getLikes()).isEqualTo(40L);
        assertThat(first.getShares()).isEqualTo(4L);
        assertThat(first.getComments()).isEqualTo(2L);
        assertThat(first.getViews()).isEqualTo(900L);
        assertThat(first.getMetadata()).containsEntry("topics", List.of("api"));
        assertThat(first.getPostUrl()).isEqualTo("https://x.com/i/web/status/1790000000000000003");

        assertThat(posts.get(1).getPostType()).isEqualTo(PostType.TEXT);
        assertThat(posts.get(1).getViews()).isNull();
        assertThat(posts.get(1).getMetadata()).containsEntry("mentions", List.of("alice"));
    }

    @Test
    void passesSinceIdAndStartTime() throws InterruptedException {
        dispatcher.on("tweets:first", json(read("fixtures/twitter/tweets-page2.json")));

        fetcher.fetchRecentPosts("2244994945", "1790000000000000000",
                OffsetDateTime.of(2024, 4, 28, 8, 30, 15, 500_000_000, ZoneOffset.ofHours(8)));

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.queryParameter("since_id")).isEqualTo("1790000000000000000");
        assertThat(url.queryParameter("start_time")).isEqualTo("2024-04-28T00:30:15Z");
        assertThat(url.queryParameter("expansions")).isEqualTo("attachments.media_keys");
    }

    @Test
    void apiErrorPayloadIsPermanent() {
        dispatcher.on("tweets:first", json("{\"errors\":[{\"detail\":\"Could not find user\",\"title\":\"Not Found Error\"}]}"));

        assertThatThrownBy(() -> fetcher.fetchRecentPosts("1", null, null))
                .isInstanceOf(AllStrategiesFailedException.class)
                .hasMessageContaining("Could not find user");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    static String route(HttpUrl url) {
        String path = url.encodedPath();
        if (path.startsWith("/2/users/by/username/")) {
            return "user-by-username";
        }
        if (path.endsWith("/tweets")) {
            String token = url.queryParameter("pagination_token");
            return "tweets:" + (token != null ? token : "first");
        }
        if (path.startsWith("/2/users/")) {
            return "user-by-id";
        }
        return path;
    }
}
