package com.socialwatch.platform.monitoring.fetcher.twitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.fetcher.AbstractContentFetcher;
import com.socialwatch.platform.monitoring.fetcher.FetchRequest;
import com.socialwatch.platform.monitoring.fetcher.FetchStrategy;
import com.socialwatch.platform.monitoring.fetcher.PermanentUpstreamException;
import com.socialwatch.platform.monitoring.fetcher.PostPage;
import com.socialwatch.platform.monitoring.fetcher.UpstreamClient;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.PostType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * X (Twitter) API v2 with an app bearer token.
 *
 * API Documentation: https://developer.x.com/en/docs/x-api
 */
@Component
@Slf4j
public class TwitterContentFetcher extends AbstractContentFetcher {

    private static final String USER_FIELDS = "created_at,description,profile_image_url,public_metrics,verified,username,name";
    private static final String TWEET_FIELDS = "created_at,public_metrics,attachments,entities,referenced_tweets,lang,conversation_id";
    private static final String MEDIA_FIELDS = "url,preview_image_url,type,variants";
    private static final int PAGE_SIZE = 20;
    private static final Pattern HANDLE = Pattern.compile("[A-Za-z0-9_]{1,15}");

    private final MonitoringProperties.Twitter config;
    private final String apiBaseUrl;
    private final UpstreamClient client;

    public TwitterContentFetcher(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                 MonitoringProperties properties, Clock clock) {
        super(properties.getFetch(), clock);
        this.config = properties.getPlatforms().getTwitter();
        String base = config.getApiBaseUrl();
        this.apiBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.client = new UpstreamClient(webClientBuilder.clone().build(), objectMapper, properties.getFetch(),
                null, null);
    }

    @Override
    public Platform getPlatform() {
        return Platform.X_TWITTER;
    }

    @Override
    protected List<FetchStrategy<PlatformProfile>> profileStrategies() {
        return List.of(
                FetchStrategy.of("user-by-id", this::profileById),
                FetchStrategy.of("user-by-username", this::profileByUsername));
    }

    @Override
    protected List<FetchStrategy<PostPage>> postStrategies() {
        return List.of(FetchStrategy.of("user-tweets", this::userTweets));
    }

    private PlatformProfile profileById(FetchRequest request) {
        JsonNode root = client.getJson(uri(List.of("users", request.getAccountId()),
                "user.fields", USER_FIELDS), authHeaders());
        return toProfile(requireData(root), request.getAccountId(), "user-by-id");
    }

    private PlatformProfile profileByUsername(FetchRequest request) {
        String handle = request.getAccountId().startsWith("@")
                ? request.getAccountId().substring(1)
                : request.getAccountId();
        if (!HANDLE.matcher(handle).matches()) {
            throw new PermanentUpstreamException("'" + request.getAccountId() + "' is not a valid handle");
        }
        JsonNode root = client.getJson(uri(List.of("users", "by", "username", handle),
                "user.fields", USER_FIELDS), authHeaders());
        return toProfile(requireData(root), request.getAccountId(), "user-by-username");
    }

    private PostPage userTweets(FetchRequest request) {
        List<String> params = new ArrayList<>(List.of(
                "max_results", String.valueOf(PAGE_SIZE),
                "tweet.fields", TWEET_FIELDS,
                "expansions", "attachments.media_keys",
                "media.fields", MEDIA_FIELDS));
        if (request.getCursor() != null) {
            params.add("pagination_token");
            params.add(request.getCursor());
        }
        if (request.getSinceId() != null) {
            params.add("since_id");
            params.add(request.getSinceId());
        }
        if (request.getSinceDate() != null) {
            params.add("start_time");
            params.add(DateTimeFormatter.ISO_INSTANT.format(request.getSinceDate().toInstant().truncatedTo(ChronoUnit.SECONDS)));
        }

        JsonNode root = client.getJson(uri(List.of("users", request.getAccountId(), "tweets"),
                params.toArray(new String[0])), authHeaders());
        if (!root.has("data") && root.has("errors")) {
            throw new PermanentUpstreamException("API error: " + root.path("errors").path(0).path("detail").asText(
                    root.path("errors").path(0).path("message").asText("unknown")));
        }

        Map<String, JsonNode> media = new HashMap<>();
        for (JsonNode item : root.path("includes").path("media")) {
            media.put(item.path("media_key").asText(), item);
        }

        List<PlatformPost> posts = new ArrayList<>();
        for (JsonNode tweet : root.path("data")) {
            posts.add(toPost(tweet, media));
        }
        String nextToken = root.path("meta").path("next_token").asText(null);
        return PostPage.withCursor(posts, nextToken);
    }

    private PlatformPost toPost(JsonNode tweet, Map<String, JsonNode> media) {
        String id = tweet.path("id").asText();
        String text = tweet.path("text").asText("");

        List<String> images = new ArrayList<>();
        List<String> videos = new ArrayList<>();
        for (JsonNode key : tweet.path("attachments").path("media_keys")) {
            JsonNode item = media.get(key.asText());
            if (item == null) {
                continue;
            }
            String type = item.path("type").asText();
            if ("photo".equals(type)) {
                String url = item.path("url").asText("");
                if (!url.isEmpty()) {
                    images.add(url);
                }
            } else if ("video".equals(type) || "animated_gif".equals(type)) {
                String url = bestVariant(item.path("variants"));
                if (url != null) {
                    videos.add(url);
                }
            }
        }

        JsonNode metrics = tweet.path("public_metrics");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("lang", tweet.path("lang").asText(""));
        metadata.put("conversation_id", tweet.path("conversation_id").asText(""));
        List<String> hashtags = new ArrayList<>();
        tweet.path("entities").path("hashtags").forEach(tag -> hashtags.add(tag.path("tag").asText()));
        metadata.put("topics", hashtags);
        List<String> mentions = new ArrayList<>();
        tweet.path("entities").path("mentions").forEach(m -> mentions.add(m.path("username").asText()));
        metadata.put("mentions", mentions);
        List<String> references = new ArrayList<>();
        tweet.path("referenced_tweets").forEach(ref -> references.add(ref.path("type").asText()));
        metadata.put("referenced", references);
        metadata.put("is_repost", references.contains("retweeted"));
        if (metrics.has("quote_count")) {
            metadata.put("quotes", metrics.path("quote_count").asLong());
        }

        return PlatformPost.builder()
                .postId(id)
                .postUrl("https://x.com/i/web/status/" + id)
                .postType(PostType.classify(!text.isBlank(), !images.isEmpty(), !videos.isEmpty()))
                .content(text)
                .imageUrls(images)
                .videoUrls(videos)
                .publishedAt(parseTimestamp(tweet.path("created_at").asText(null)))
                .likes(metric(metrics, "like_count"))
                .shares(metric(metrics, "retweet_count"))
                .comments(metric(metrics, "reply_count"))
                .views(metric(metrics, "impression_count"))
                .metadata(metadata)
                .build();
    }

    private PlatformProfile toProfile(JsonNode user, String accountId, String source) {
        JsonNode metrics = user.path("public_metrics");
        String username = user.path("username").asText();
        return PlatformProfile.builder()
                .platform(Platform.X_TWITTER)
                .accountId(accountId)
                .username(username)
                .displayName(user.path("name").asText(username))
                .avatarUrl(user.path("profile_image_url").asText(null))
                .followerCount(metric(metrics, "followers_count"))
                .followingCount(metric(metrics, "following_count"))
                .postCount(metric(metrics, "tweet_count"))
                .verified(user.path("verified").asBoolean(false))
                .bio(user.path("description").asText(""))
                .profileUrl("https://x.com/" + username)
                .source(source)
                .build();
    }

    private static JsonNode requireData(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isObject() || !data.has("username")) {
            String detail = root.path("errors").path(0).path("detail").asText("response carries no user");
            throw new PermanentUpstreamException(detail);
        }
        return data;
    }

    private static String bestVariant(JsonNode variants) {
        String best = null;
        long bestRate = -1;
        for (JsonNode variant : variants) {
            if (!"video/mp4".equals(variant.path("content_type").asText())) {
                continue;
            }
            long rate = variant.path("bit_rate").asLong(0);
            if (rate > bestRate) {
                bestRate = rate;
                best = variant.path("url").asText(null);
            }
        }
        return best;
    }

    private static Long metric(JsonNode metrics, String field) {
        return metrics.has(field) ? metrics.path(field).asLong() : null;
    }

    private static OffsetDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable tweet timestamp '{}'", value);
            return null;
        }
    }

    private Map<String, String> authHeaders() {
        String token = config.getBearerToken();
        if (token == null || token.isBlank()) {
            throw new PermanentUpstreamException("No X bearer token configured");
        }
        return Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + token,
                HttpHeaders.ACCEPT, "application/json");
    }

    private URI uri(List<String> segments, String... params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(apiBaseUrl)
                .pathSegment(segments.toArray(new String[0]));
        Object[] values = new Object[params.length / 2];
        for (int i = 0; i + 1 < params.length; i += 2) {
            builder.queryParam(params[i], "{q" + (i / 2) + "}");
            values[i / 2] = params[i + 1];
        }
        return builder.encode().buildAndExpand(values).toUri();
    }
}
