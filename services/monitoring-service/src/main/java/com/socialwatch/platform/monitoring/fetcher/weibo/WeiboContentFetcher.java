package com.socialwatch.platform.monitoring.fetcher.weibo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.fetcher.AbstractContentFetcher;
import com.socialwatch.platform.monitoring.fetcher.EmbeddedJsonLocator;
import com.socialwatch.platform.monitoring.fetcher.FetchRequest;
import com.socialwatch.platform.monitoring.fetcher.FetchStrategy;
import com.socialwatch.platform.monitoring.fetcher.PermanentUpstreamException;
import com.socialwatch.platform.monitoring.fetcher.PlatformSession;
import com.socialwatch.platform.monitoring.fetcher.PostPage;
import com.socialwatch.platform.monitoring.fetcher.UpstreamClient;
import com.socialwatch.platform.monitoring.fetcher.UpstreamException;
import com.socialwatch.platform.monitoring.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weibo through the mobile web site (m.weibo.cn), with the open API as a last resort when an
 * access token is configured.
 *
 * The mobile endpoints are unofficial: they rate limit aggressively, answer {@code ok: 0} for
 * accounts they decide not to serve and change shape without notice, hence the number of
 * alternative routes to the same data.
 */
@Component
@Slf4j
public class WeiboContentFetcher extends AbstractContentFetcher {

    static final List<String> CONTAINER_PREFIXES = List.of("107603", "230413", "100505", "100406", "100206");

    private static final int MAX_BODY_BYTES = 4 * 1024 * 1024;
    private static final int OPEN_API_PAGE_SIZE = 20;
    private static final Pattern TITLE = Pattern.compile("<title>([^<]+)的微博</title>");
    private static final List<Pattern> FOLLOWERS = List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?[万亿]?)粉丝"),
            Pattern.compile("粉丝[：:]\\s*(\\d+(?:\\.\\d+)?[万亿]?)"),
            Pattern.compile("followers?\\s*[:：]\\s*(\\d+(?:\\.\\d+)?[万亿]?)", Pattern.CASE_INSENSITIVE));
    private static final List<Pattern> FOLLOWING = List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?[万亿]?)关注"),
            Pattern.compile("关注[：:]\\s*(\\d+(?:\\.\\d+)?[万亿]?)"),
            Pattern.compile("following\\s*[:：]\\s*(\\d+(?:\\.\\d+)?[万亿]?)", Pattern.CASE_INSENSITIVE));

    private final MonitoringProperties.Weibo config;
    private final ZoneId zone;
    private final String baseUrl;
    private final String apiBaseUrl;
    private final UpstreamClient client;
    private final PlatformSession session;
    // account id -> timeline container id
    private final Map<String, String> containerIds = new ConcurrentHashMap<>();

    public WeiboContentFetcher(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                               MonitoringProperties properties, Clock clock) {
        super(properties.getFetch(), clock);
        this.config = properties.getPlatforms().getWeibo();
        this.zone = properties.getScheduler().getZoneId();
        this.baseUrl = trimSlash(config.getBaseUrl());
        this.apiBaseUrl = trimSlash(config.getApiBaseUrl());
        this.session = new PlatformSession(clock, properties.getFetch().getSessionRefreshInterval());
        WebClient webClient = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .build();
        this.client = new UpstreamClient(webClient, objectMapper, properties.getFetch(), session,
                URI.create(baseUrl + "/"));
    }

    @Override
    public Platform getPlatform() {
        return Platform.WEIBO;
    }

    @Override
    protected List<FetchStrategy<PlatformProfile>> profileStrategies() {
        return List.of(
                FetchStrategy.of("container-api", this::profileFromContainerApi),
                FetchStrategy.of("show-api", this::profileFromShowApi),
                FetchStrategy.of("profile-page", this::profileFromProfilePage),
                FetchStrategy.of("search-api", this::profileFromSearchApi),
                FetchStrategy.of("open-api", this::profileFromOpenApi));
    }

    @Override
    protected List<FetchStrategy<PostPage>> postStrategies() {
        return List.of(
                FetchStrategy.of("container-timeline", this::postsFromContainerTimeline),
                FetchStrategy.of("profile-page", this::postsFromProfilePage),
                FetchStrategy.of("open-api", this::postsFromOpenApi));
    }

    @Override
    public void clearCache(String accountId) {
        super.clearCache(accountId);
        if (accountId == null) {
            containerIds.clear();
            session.reset();
        } else {
            containerIds.remove(accountId);
        }
    }

    // ---- profile strategies ----

    private PlatformProfile profileFromContainerApi(FetchRequest request) {
        JsonNode root = client.getJson(mobileUri("/api/container/getIndex", "type", "uid", "value", request.getAccountId()),
                ajaxHeaders(request.getAccountId()));
        requireOk(root);
        JsonNode user = root.path("data").path("userInfo");
        if (!user.isObject() || !user.has("screen_name")) {
            throw new PermanentUpstreamException("Container response carries no userInfo");
        }
        rememberWeiboTab(request.getAccountId(), root);
        return toProfile(user, request.getAccountId(), "container-api");
    }

    private PlatformProfile profileFromShowApi(FetchRequest request) {
        JsonNode root = client.getJson(mobileUri("/api/users/show.json", "uid", request.getAccountId()),
                ajaxHeaders(request.getAccountId()));
        if (root.has("ok") && root.path("ok").asInt() != 1) {
            throw new PermanentUpstreamException("show.json answered ok=" + root.path("ok").asText());
        }
        JsonNode user = EmbeddedJsonLocator.findFirstObject(root, node -> node.has("screen_name"))
                .orElseThrow(() -> new PermanentUpstreamException("show.json response carries no user"));
        return toProfile(user, request.getAccountId(), "show-api");
    }

    private PlatformProfile profileFromProfilePage(FetchRequest request) {
        String html = client.getText(mobileUri("/u/" + request.getAccountId()), pageHeaders());

        Optional<JsonNode> user = renderData(html)
                .flatMap(data -> EmbeddedJsonLocator.findFirst(data, "user"))
                .filter(node -> node.isObject() && node.has("screen_name"));
        if (user.isPresent()) {
            return toProfile(user.get(), request.getAccountId(), "profile-page");
        }

        Matcher title = TITLE.matcher(html);
        if (!title.find()) {
            throw new PermanentUpstreamException("Profile page has neither render data nor a title");
        }
        String name = title.group(1).trim();
        return PlatformProfile.builder()
                .platform(Platform.WEIBO)
                .accountId(request.getAccountId())
                .username(name)
                .displayName(name)
                .followerCount(firstCount(html, FOLLOWERS))
                .followingCount(firstCount(html, FOLLOWING))
                .verified(html.contains("icon-vip") || html.contains("微博认证"))
                .bio("")
                .profileUrl(baseUrl + "/u/" + request.getAccountId())
                .source("profile-page")
                .build();
    }

    private PlatformProfile profileFromSearchApi(FetchRequest request) {
        String accountId = request.getAccountId();
        JsonNode root = client.getJson(mobileUri("/api/container/getIndex",
                "containerid", "100103type=1&q=" + accountId, "page_type", "searchall"), ajaxHeaders(accountId));
        requireOk(root);
        return EmbeddedJsonLocator.findAll(root, "user").stream()
                .filter(user -> accountId.equals(user.path("id").asText()))
                .findFirst()
                .map(user -> toProfile(user, accountId, "search-api"))
                .orElseThrow(() -> new PermanentUpstreamException("Search returned no user with id " + accountId));
    }

    private PlatformProfile profileFromOpenApi(FetchRequest request) {
        String token = requireAccessToken();
        JsonNode user = client.getJson(apiUri("/users/show.json", "uid", request.getAccountId(), "access_token", token),
                Map.of(HttpHeaders.ACCEPT, "application/json"));
        if (user.has("error_code")) {
            throw new PermanentUpstreamException("Open API error " + user.path("error_code").asText()
                    + ": " + user.path("error").asText());
        }
        return toProfile(user, request.getAccountId(), "open-api");
    }

    // ---- post strategies ----

    private PostPage postsFromContainerTimeline(FetchRequest request) {
        String accountId = request.getAccountId();
        String containerId = resolveContainerId(accountId);
        JsonNode root = client.getJson(mobileUri("/api/container/getIndex",
                "containerid", containerId, "page", String.valueOf(request.getPage())), ajaxHeaders(accountId));

        if (root.path("ok").asInt() != 1) {
            if (request.getPage() > 1) {
                // past the last page the API answers ok=0
                return PostPage.last(List.of());
            }
            containerIds.remove(accountId);
            throw new PermanentUpstreamException("Timeline container " + containerId + " answered ok="
                    + root.path("ok").asText() + " " + root.path("msg").asText(""));
        }

        List<PlatformPost> posts = new ArrayList<>();
        for (JsonNode mblog : timelineStatuses(root.path("data").path("cards"))) {
            PlatformPost post = WeiboParsing.toPost(mblog, fullText(mblog), baseUrl, clock, zone);
            if (post != null) {
                posts.add(post);
            }
        }
        return PostPage.of(posts);
    }

    private PostPage postsFromProfilePage(FetchRequest request) {
        if (request.getPage() > 1) {
            throw new PermanentUpstreamException("Profile page only carries the first page of posts");
        }
        String html = client.getText(mobileUri("/u/" + request.getAccountId()), pageHeaders());
        JsonNode data = renderData(html)
                .orElseThrow(() -> new PermanentUpstreamException("Profile page carries no render data"));

        // status pages embed a single "status", profile pages "mblog" cards or a "statuses" list
        List<JsonNode> statuses = new ArrayList<>(EmbeddedJsonLocator.findAll(data, "mblog"));
        statuses.addAll(EmbeddedJsonLocator.findAll(data, "status"));
        for (JsonNode list : EmbeddedJsonLocator.findAll(data, "statuses")) {
            list.forEach(statuses::add);
        }
        List<PlatformPost> posts = new ArrayList<>();
        for (JsonNode status : statuses) {
            if (status.isObject() && status.has("text")) {
                PlatformPost post = WeiboParsing.toPost(status, WeiboParsing.cleanText(WeiboParsing.text(status, "text")),
                        baseUrl, clock, zone);
                if (post != null) {
                    posts.add(post);
                }
            }
        }
        return PostPage.last(posts);
    }

    private PostPage postsFromOpenApi(FetchRequest request) {
        String token = requireAccessToken();
        List<String> params = new ArrayList<>(List.of(
                "uid", request.getAccountId(),
                "access_token", token,
                "page", String.valueOf(request.getPage()),
                "count", String.valueOf(OPEN_API_PAGE_SIZE)));
        if (request.getSinceId() != null) {
            params.add("since_id");
            params.add(request.getSinceId());
        }
        JsonNode root = client.getJson(apiUri("/statuses/user_timeline.json", params.toArray(new String[0])),
                Map.of(HttpHeaders.ACCEPT, "application/json"));
        if (root.has("error_code")) {
            throw new PermanentUpstreamException("Open API error " + root.path("error_code").asText()
                    + ": " + root.path("error").asText());
        }
        List<PlatformPost> posts = new ArrayList<>();
        for (JsonNode status : root.path("statuses")) {
            PlatformPost post = WeiboParsing.toPost(status, WeiboParsing.cleanText(WeiboParsing.text(status, "text")),
                    baseUrl, clock, zone);
            if (post != null) {
                posts.add(post);
            }
        }
        return PostPage.of(posts);
    }

    // ---- helpers ----

    private String resolveContainerId(String accountId) {
        String known = containerIds.get(accountId);
        if (known != null) {
            return known;
        }

        try {
            JsonNode root = client.getJson(mobileUri("/api/container/getIndex", "type", "uid", "value", accountId),
                    ajaxHeaders(accountId));
            Optional<String> fromTabs = rememberWeiboTab(accountId, root);
            if (fromTabs.isPresent()) {
                return fromTabs.get();
            }
        } catch (UpstreamException e) {
            log.debug("Tab lookup for {} failed, probing container prefixes: {}", accountId, e.getMessage());
        }

        for (String prefix : CONTAINER_PREFIXES) {
            String candidate = prefix + accountId;
            try {
                JsonNode probe = client.getJson(mobileUri("/api/container/getIndex", "containerid", candidate, "page", "1"),
                        ajaxHeaders(accountId));
                if (probe.path("ok").asInt() == 1 && probe.path("data").path("cards").size() > 0) {
                    containerIds.put(accountId, candidate);
                    return candidate;
                }
            } catch (UpstreamException e) {
                log.debug("Container {} rejected: {}", candidate, e.getMessage());
            }
        }
        throw new PermanentUpstreamException("No timeline container found for " + accountId);
    }

    private Optional<String> rememberWeiboTab(String accountId, JsonNode root) {
        if (root.path("ok").asInt() != 1) {
            return Optional.empty();
        }
        for (JsonNode tab : root.path("data").path("tabsInfo").path("tabs")) {
            if ("weibo".equals(tab.path("tab_type").asText()) && !tab.path("containerid").asText().isEmpty()) {
                String containerId = tab.path("containerid").asText();
                containerIds.put(accountId, containerId);
                return Optional.of(containerId);
            }
        }
        return Optional.empty();
    }

    private static List<JsonNode> timelineStatuses(JsonNode cards) {
        List<JsonNode> statuses = new ArrayList<>();
        for (JsonNode card : cards) {
            if (card.path("card_type").asInt() == 9 && card.path("mblog").isObject()) {
                statuses.add(card.get("mblog"));
            }
            for (JsonNode nested : card.path("card_group")) {
                if (nested.path("card_type").asInt() == 9 && nested.path("mblog").isObject()) {
                    statuses.add(nested.get("mblog"));
                }
            }
        }
        return statuses;
    }

    private String fullText(JsonNode mblog) {
        String text = WeiboParsing.text(mblog, "text");
        if (!mblog.path("isLongText").asBoolean(false)) {
            return WeiboParsing.cleanText(text);
        }
        String id = mblog.path("id").asText();
        try {
            JsonNode root = client.getJson(mobileUri("/api/statuses/extend", "id", id), ajaxHeaders(null));
            String longText = root.path("data").path("longTextContent").asText("");
            if (root.path("ok").asInt() == 1 && !longText.isEmpty()) {
                return WeiboParsing.cleanText(longText);
            }
        } catch (UpstreamException e) {
            log.debug("Long text for post {} unavailable, keeping the excerpt: {}", id, e.getMessage());
        }
        return WeiboParsing.cleanText(text);
    }

    private PlatformProfile toProfile(JsonNode user, String accountId, String source) {
        String screenName = user.path("screen_name").asText(user.path("name").asText(""));
        if (screenName.isEmpty()) {
            throw new PermanentUpstreamException("User object has no screen name");
        }
        String avatar = user.path("avatar_hd").asText("");
        if (avatar.isEmpty()) {
            avatar = user.path("profile_image_url").asText("");
        }
        Long following = WeiboParsing.count(user, "follow_count");
        if (following == null) {
            following = WeiboParsing.count(user, "friends_count");
        }
        return PlatformProfile.builder()
                .platform(Platform.WEIBO)
                .accountId(accountId)
                .username(screenName)
                .displayName(screenName)
                .avatarUrl(avatar.isEmpty() ? null : avatar)
                .followerCount(WeiboParsing.count(user, "followers_count"))
                .followingCount(following)
                .postCount(WeiboParsing.count(user, "statuses_count"))
                .verified(user.path("verified").asBoolean(false))
                .bio(user.path("description").asText(""))
                .profileUrl(baseUrl + "/u/" + accountId)
                .source(source)
                .build();
    }

    private Optional<JsonNode> renderData(String html) {
        return EmbeddedJsonLocator.extractAssignedBlob(html, "$render_data").flatMap(blob -> {
            try {
                return Optional.of(client.objectMapper().readTree(blob));
            } catch (JsonProcessingException e) {
                log.debug("Embedded render data is not valid JSON: {}", e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    private static Long firstCount(String html, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(html);
            if (m.find()) {
                return WeiboParsing.parseChineseNumber(m.group(1));
            }
        }
        return 0L;
    }

    private static void requireOk(JsonNode root) {
        if (root.path("ok").asInt() != 1) {
            throw new PermanentUpstreamException("Upstream answered ok=" + root.path("ok").asText()
                    + " " + root.path("msg").asText(""));
        }
    }

    private String requireAccessToken() {
        String token = config.getAccessToken();
        if (token == null || token.isBlank()) {
            throw new PermanentUpstreamException("No Weibo open API access token configured");
        }
        return token;
    }

    private Map<String, String> ajaxHeaders(String accountId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.ACCEPT, "application/json, text/plain, */*");
        headers.put("X-Requested-With", "XMLHttpRequest");
        headers.put("MWeibo-Pwa", "1");
        headers.put(HttpHeaders.REFERER, accountId != null ? baseUrl + "/u/" + accountId : baseUrl + "/");
        return headers;
    }

    private static Map<String, String> pageHeaders() {
        return Map.of(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
                HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9,en;q=0.8");
    }

    private URI mobileUri(String path, String... params) {
        return buildUri(baseUrl, path, params);
    }

    private URI apiUri(String path, String... params) {
        return buildUri(apiBaseUrl, path, params);
    }

    static URI buildUri(String base, String path, String... params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base).path(path);
        Object[] values = new Object[params.length / 2];
        for (int i = 0; i + 1 < params.length; i += 2) {
            builder.queryParam(params[i], "{p" + (i / 2) + "}");
            values[i / 2] = params[i + 1];
        }
        return builder.encode().buildAndExpand(values).toUri();
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
