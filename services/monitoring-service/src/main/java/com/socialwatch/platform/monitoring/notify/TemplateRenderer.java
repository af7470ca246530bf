package com.socialwatch.platform.monitoring.notify;

import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-z_]+)\\s*}}");
    private static final DateTimeFormatter PUBLISHED_AT = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

    private final ZoneId zone;

    public TemplateRenderer(MonitoringProperties properties) {
        this.zone = properties.getScheduler().getZoneId();
    }

    public String render(String template, PostNotification notification) {
        Map<String, String> values = placeholders(notification);
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    public Map<String, String> placeholders(PostNotification n) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("platform", n.getPlatform() != null ? n.getPlatform().getCode() : "");
        values.put("platform_label", n.getPlatform() != null ? n.getPlatform().getDisplayName() : "");
        values.put("target_username", orEmpty(n.getTargetUsername()));
        values.put("target_display_name", orEmpty(n.getTargetDisplayName()));
        values.put("post_id", orEmpty(n.getPostId()));
        values.put("post_url", orEmpty(n.getPostUrl()));
        values.put("post_type", n.getPostType() != null ? n.getPostType().code() : "");
        values.put("post_content", orEmpty(n.getContent()));
        values.put("published_at", formatPublishedAt(n.getPublishedAt()));
        values.put("likes", count(n.getLikes()));
        values.put("shares", count(n.getShares()));
        values.put("comments", count(n.getComments()));
        values.put("views", count(n.getViews()));
        return values;
    }

    public String formatPublishedAt(OffsetDateTime publishedAt) {
        return publishedAt == null ? "" : PUBLISHED_AT.format(publishedAt.atZoneSameInstant(zone));
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String count(Long value) {
        return String.valueOf(value != null ? value : 0L);
    }
}
