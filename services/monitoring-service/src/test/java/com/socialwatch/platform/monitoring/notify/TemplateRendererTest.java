package com.socialwatch.platform.monitoring.notify;

import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.PostType;
import com.socialwatch.platform.monitoring.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer(TestProperties.fast());

    @Test
    void substitutesKnownPlaceholders() {
        PostNotification notification = PostNotification.builder()
                .targetUsername("alice")
                .content("hello")
                .build();

        assertThat(renderer.render("{{target_username}} posted {{post_content}}", notification))
                .isEqualTo("alice posted hello");
    }

    @Test
    void toleratesWhitespaceAndKeepsUnknownPlaceholders() {
        PostNotification notification = PostNotification.builder()
                .platform(Platform.X_TWITTER)
                .postType(PostType.IMAGE)
                .likes(7L)
                .build();

        assertThat(renderer.render("{{ platform_label }}/{{post_type}}: {{likes}} likes, {{views}} views {{mood}}", notification))
                .isEqualTo("X (Twitter)/image: 7 likes, 0 views {{mood}}");
    }

    @Test
    void contentWithDollarSignsIsCopiedLiterally() {
        PostNotification notification = PostNotification.builder().content("costs $5 \\o/").build();

        assertThat(renderer.render("> {{post_content}}", notification)).isEqualTo("> costs $5 \\o/");
    }

    @Test
    void formatsPublishedAtInConfiguredZone() {
        PostNotification notification = PostNotification.builder()
                .publishedAt(OffsetDateTime.of(2024, 4, 30, 23, 5, 0, 0, ZoneOffset.UTC))
                .build();

        assertThat(renderer.render("{{published_at}}", notification)).isEqualTo("2024/05/01 07:05");
        assertThat(renderer.placeholders(PostNotification.builder().build())).containsEntry("published_at", "");
    }
}
