package com.socialwatch.platform.monitoring.fetcher.weibo;

import com.fasterxml.jackson.databind.JsonNode;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.model.PostType;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class WeiboParsing {

    static final DateTimeFormatter CREATED_AT = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.US);

    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern LINE_BREAKS = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOPIC = Pattern.compile("#([^#]+)#");
    private static final Pattern MENTION = Pattern.compile("@([^\\s@:：，,]+)");
    private static final Pattern SECONDS_AGO = Pattern.compile("(\\d+)\\s*秒前");
    private static final Pattern MINUTES_AGO = Pattern.compile("(\\d+)\\s*分钟前");
    private static final Pattern HOURS_AGO = Pattern.compile("(\\d+)\\s*小时前");
    private static final Pattern YESTERDAY = Pattern.compile("昨天\\s*(\\d{1,2}):(\\d{2})");
    private static final Pattern TODAY = Pattern.compile("今天\\s*(\\d{1,2}):(\\d{2})");
    private static final Pattern MONTH_DAY = Pattern.compile("(\\d{1,2})-(\\d{1,2})");
    private static final Pattern FULL_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern DIGITS = Pattern.compile("[^\\d]");

    private WeiboParsing() {
    }

    static String cleanText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = LINE_BREAKS.matcher(html).replaceAll(" ");
        text = TAGS.matcher(text).replaceAll("");
        text = HtmlUtils.htmlUnescape(text).replace('\u00a0', ' ');
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * "75.9万" becomes 759000, "1.2亿" becomes 120000000; anything else keeps its digits.
     */
    static long parseChineseNumber(String value) {
        if (value == null) {
            return 0L;
        }
        String str = value.trim();
        try {
            if (str.endsWith("万")) {
                return new BigDecimal(str.substring(0, str.length() - 1).trim())
                        .multiply(BigDecimal.valueOf(10_000L)).longValue();
            }
            if (str.endsWith("亿")) {
                return new BigDecimal(str.substring(0, str.length() - 1).trim())
                        .multiply(BigDecimal.valueOf(100_000_000L)).longValue();
            }
        } catch (NumberFormatException e) {
            return 0L;
        }
        String digits = DIGITS.matcher(str).replaceAll("");
        if (digits.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return 0L;
        }
    }

    static Long count(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        return parseChineseNumber(value.asText());
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    // null when the value matches none of the known forms
    static OffsetDateTime parseDate(String value, Clock clock, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String str = value.trim();
        try {
            return OffsetDateTime.parse(str, CREATED_AT);
        } catch (DateTimeParseException ignored) {
            // fall through to the display forms
        }
        try {
            return OffsetDateTime.parse(str);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return parseDisplayDate(str, clock, zone);
        } catch (DateTimeException | NumberFormatException | ArithmeticException e) {
            // shaped like a display form but out of range, e.g. "02-30" or "昨天 24:30"
            return null;
        }
    }

    private static OffsetDateTime parseDisplayDate(String str, Clock clock, ZoneId zone) {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        if (str.startsWith("刚刚")) {
            return now.toOffsetDateTime();
        }
        Matcher m = SECONDS_AGO.matcher(str);
        if (m.find()) {
            return now.minusSeconds(Long.parseLong(m.group(1))).toOffsetDateTime();
        }
        m = MINUTES_AGO.matcher(str);
        if (m.find()) {
            return now.minusMinutes(Long.parseLong(m.group(1))).toOffsetDateTime();
        }
        m = HOURS_AGO.matcher(str);
        if (m.find()) {
            return now.minusHours(Long.parseLong(m.group(1))).toOffsetDateTime();
        }
        m = YESTERDAY.matcher(str);
        if (m.find()) {
            return atTime(now.toLocalDate().minusDays(1), m, zone);
        }
        m = TODAY.matcher(str);
        if (m.find()) {
            return atTime(now.toLocalDate(), m, zone);
        }
        m = FULL_DATE.matcher(str);
        if (m.find()) {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)))
                    .atStartOfDay(zone).toOffsetDateTime();
        }
        m = MONTH_DAY.matcher(str);
        if (m.find()) {
            return LocalDate.of(now.getYear(), Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))
                    .atStartOfDay(zone).toOffsetDateTime();
        }
        return null;
    }

    private static OffsetDateTime atTime(LocalDate date, Matcher m, ZoneId zone) {
        LocalTime time = LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        return LocalDateTime.of(date, time).atZone(zone).toOffsetDateTime();
    }

    static List<String> topics(String text) {
        return matches(TOPIC, text);
    }

    static List<String> mentions(String text) {
        return matches(MENTION, text);
    }

    private static List<String> matches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String value = m.group(1).trim();
            if (!value.isEmpty() && !found.contains(value)) {
                found.add(value);
            }
        }
        return found;
    }

    static List<String> imageUrls(JsonNode status) {
        List<String> urls = new ArrayList<>();
        JsonNode pics = status.path("pics");
        if (pics.isArray()) {
            for (JsonNode pic : pics) {
                String url = pic.path("large").path("url").asText(pic.path("url").asText(""));
                if (!url.isEmpty()) {
                    urls.add(url);
                }
            }
        }
        // open API shape
        JsonNode picUrls = status.path("pic_urls");
        if (urls.isEmpty() && picUrls.isArray()) {
            for (JsonNode pic : picUrls) {
                String url = pic.path("thumbnail_pic").asText("");
                if (!url.isEmpty()) {
                    urls.add(url.replace("/thumbnail/", "/large/"));
                }
            }
        }
        return urls;
    }

    static List<String> videoUrls(JsonNode status) {
        List<String> urls = new ArrayList<>();
        JsonNode pageInfo = status.path("page_info");
        if (!"video".equals(pageInfo.path("type").asText())) {
            return urls;
        }
        JsonNode media = pageInfo.path("media_info");
        for (String field : List.of("stream_url_hd", "mp4_hd_url", "stream_url", "mp4_sd_url")) {
            String url = media.path(field).asText("");
            if (!url.isEmpty()) {
                urls.add(url);
                return urls;
            }
        }
        JsonNode variants = pageInfo.path("urls");
        if (variants.isObject()) {
            variants.elements().forEachRemaining(v -> {
                if (urls.isEmpty() && !v.asText("").isEmpty()) {
                    urls.add(v.asText());
                }
            });
        }
        return urls;
    }

    static PlatformPost toPost(JsonNode status, String content, String mobileBaseUrl, Clock clock, ZoneId zone) {
        String id = text(status, "idstr");
        if (id == null) {
            id = text(status, "id");
        }
        if (id == null || id.isBlank()) {
            return null;
        }
        String bid = text(status, "bid");

        List<String> images = imageUrls(status);
        List<String> videos = videoUrls(status);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (bid != null) {
            metadata.put("bid", bid);
        }
        metadata.put("source", cleanText(text(status, "source")));
        metadata.put("topics", topics(content));
        metadata.put("mentions", mentions(content));
        metadata.put("is_long_text", status.path("isLongText").asBoolean(false));
        String region = text(status, "region_name");
        if (region != null && !region.isEmpty()) {
            metadata.put("region", region);
        }
        JsonNode retweeted = status.get("retweeted_status");
        metadata.put("is_repost", retweeted != null && !retweeted.isNull());
        if (retweeted != null && retweeted.isObject()) {
            Map<String, Object> repost = new LinkedHashMap<>();
            repost.put("id", text(retweeted, "id"));
            repost.put("text", cleanText(text(retweeted, "text")));
            repost.put("user", retweeted.path("user").path("screen_name").asText(""));
            repost.put("images", imageUrls(retweeted));
            metadata.put("repost", repost);
        }

        return PlatformPost.builder()
                .postId(id)
                .postUrl(mobileBaseUrl + "/status/" + (bid != null ? bid : id))
                .postType(PostType.classify(!content.isEmpty(), !images.isEmpty(), !videos.isEmpty()))
                .content(content)
                .imageUrls(images)
                .videoUrls(videos)
                .publishedAt(parseDate(text(status, "created_at"), clock, zone))
                .likes(count(status, "attitudes_count"))
                .shares(count(status, "reposts_count"))
                .comments(count(status, "comments_count"))
                .metadata(metadata)
                .build();
    }
}
