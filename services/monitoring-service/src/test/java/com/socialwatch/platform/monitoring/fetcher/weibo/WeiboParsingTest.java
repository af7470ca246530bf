package com.socialwatch.platform.monitoring.fetcher.weibo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class WeiboParsingTest {

    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");
    // 2024-05-01 12:00 in Shanghai
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T04:00:00Z"));

    @Test
    void stripsTagsAndUnescapesEntities() {
        assertThat(WeiboParsing.cleanText("<span class=\"url-icon\"><img alt=[笑]></span>A&amp;B&nbsp;&lt;3<br/>next   line"))
                .isEqualTo("A&B <3 next line");
        assertThat(WeiboParsing.cleanText(null)).isEmpty();
    }

    @Test
    void parsesChineseMagnitudes() {
        assertThat(WeiboParsing.parseChineseNumber("75.9万")).isEqualTo(759_000L);
        assertThat(WeiboParsing.parseChineseNumber("1.2亿")).isEqualTo(120_000_000L);
        assertThat(WeiboParsing.parseChineseNumber("1,234")).isEqualTo(1_234L);
        assertThat(WeiboParsing.parseChineseNumber("n/a")).isZero();
        assertThat(WeiboParsing.parseChineseNumber("x万")).isZero();
    }

    @Test
    void parsesApiTimestamp() {
        assertThat(WeiboParsing.parseDate("Wed May 01 19:30:00 +0800 2024", clock, SHANGHAI).toInstant())
                .isEqualTo(Instant.parse("2024-05-01T11:30:00Z"));
    }

    @Test
    void parsesRelativeForms() {
        assertThat(parse("刚刚")).isEqualTo(Instant.parse("2024-05-01T04:00:00Z"));
        assertThat(parse("5分钟前")).isEqualTo(Instant.parse("2024-05-01T03:55:00Z"));
        assertThat(parse("3小时前")).isEqualTo(Instant.parse("2024-05-01T01:00:00Z"));
        assertThat(parse("昨天 21:15")).isEqualTo(Instant.parse("2024-04-30T13:15:00Z"));
        assertThat(parse("04-28")).isEqualTo(Instant.parse("2024-04-27T16:00:00Z"));
        assertThat(parse("2023-12-31")).isEqualTo(Instant.parse("2023-12-30T16:00:00Z"));
        assertThat(WeiboParsing.parseDate("sometime", clock, SHANGHAI)).isNull();
    }

    @Test
    void extractsTopicsAndMentions() {
        String text = "#五一假期# 和 @小红 @Bob_99: 出发了 #旅行#";

        assertThat(WeiboParsing.topics(text)).containsExactly("五一假期", "旅行");
        assertThat(WeiboParsing.mentions(text)).containsExactly("小红", "Bob_99");
    }

    @Test
    void outOfRangeDisplayDatesAreUnknown() {
        assertThat(WeiboParsing.parseDate("02-30", clock, SHANGHAI)).isNull();
        assertThat(WeiboParsing.parseDate("2024-13-01", clock, SHANGHAI)).isNull();
        assertThat(WeiboParsing.parseDate("昨天 24:30", clock, SHANGHAI)).isNull();
        assertThat(WeiboParsing.parseDate("今天 12:75", clock, SHANGHAI)).isNull();
    }

    @Test
    void oversizedCountFallsBackToZero() {
        assertThat(WeiboParsing.parseChineseNumber("100000000000000000000")).isZero();
        assertThat(WeiboParsing.parseChineseNumber("9223372036854775807")).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void malformedFieldsDoNotFailThePost() throws Exception {
        JsonNode status = new ObjectMapper().readTree(
                "{\"idstr\":\"4990000000000777\",\"bid\":\"Oxyz\",\"created_at\":\"昨天 24:30\","
                        + "\"attitudes_count\":\"100000000000000000000\",\"reposts_count\":3}");

        PlatformPost post = WeiboParsing.toPost(status, "hello", "https://m.weibo.cn", clock, SHANGHAI);

        assertThat(post.getPostId()).isEqualTo("4990000000000777");
        assertThat(post.getPublishedAt()).isNull();
        assertThat(post.getLikes()).isZero();
        assertThat(post.getShares()).isEqualTo(3L);
    }

    private Instant parse(String value) {
        OffsetDateTime parsed = WeiboParsing.parseDate(value, clock, SHANGHAI);
        return parsed.toInstant();
    }
}
