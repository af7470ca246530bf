package com.socialwatch.platform.monitoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables for the monitoring pipeline, bound from the {@code monitoring.*} namespace.
 * Defaults match the production cadence; tests build instances directly and shrink the delays.
 */
@Data
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringProperties {

    private Scheduler scheduler = new Scheduler();
    private Check check = new Check();
    private Fetch fetch = new Fetch();
    private Notify notify = new Notify();
    private Platforms platforms = new Platforms();

    @Data
    public static class Scheduler {
        private Duration interval = Duration.ofMinutes(5);
        private boolean autoStart = true;
        private ZoneId zoneId = ZoneId.of("Asia/Shanghai");
    }

    @Data
    public static class Check {
        // consecutive failed checks before an account is paused
        private int pauseThreshold = 5;
    }

    @Data
    public static class Fetch {
        private Duration profileCacheTtl = Duration.ofMinutes(5);
        private Duration sessionRefreshInterval = Duration.ofMinutes(30);
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(15);
        private int maxPages = 10;
        private int recentPages = 2;
        private Duration strategyPause = Duration.ofSeconds(2);
    }

    @Data
    public static class Notify {
        private Duration deliveryTimeout = Duration.ofSeconds(10);
        private String signatureHeader = "X-Webhook-Signature";
    }

    @Data
    public static class Platforms {
        private Weibo weibo = new Weibo();
        private Twitter twitter = new Twitter();
    }

    @Data
    public static class Weibo {
        private String baseUrl = "https://m.weibo.cn";
        private String apiBaseUrl = "https://api.weibo.com/2";
        private String accessToken;
        private String userAgent = "Mozilla/5.0 (iPhone; CPU iPhone OS 14_0 like Mac OS X) "
                + "AppleWebKit/605.1.15 (KHTML, like Gecko) Mobile/15E148";
    }

    @Data
    public static class Twitter {
        private String apiBaseUrl = "https://api.twitter.com/2";
        private String bearerToken;
    }
}
