package com.socialwatch.platform.monitoring.notify;

import com.socialwatch.platform.monitoring.model.WebhookProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class WebhookPayloadRenderer {

    private final TemplateRenderer templateRenderer;

    public Map<String, Object> render(WebhookProvider provider, String template, PostNotification notification) {
        boolean templated = template != null && !template.isBlank();
        String text = templated ? templateRenderer.render(template, notification) : null;

        return switch (provider) {
            case FEISHU -> templated ? map("msg_type", "text", "content", map("text", text)) : feishuPost(notification);
            case WECHAT_WORK -> templated
                    ? map("msgtype", "text", "text", map("content", text))
                    : map("msgtype", "markdown", "markdown", map("content", wechatMarkdown(notification)));
            case DINGTALK -> templated
                    ? map("msgtype", "text", "text", map("content", text))
                    : map("msgtype", "markdown", "markdown",
                            map("title", "Social Media Update", "text", dingTalkMarkdown(notification)));
            case CUSTOM -> templated ? map("content", text) : structured(notification);
        };
    }

    private Map<String, Object> feishuPost(PostNotification n) {
        Map<String, String> v = templateRenderer.placeholders(n);
        List<List<Map<String, Object>>> rows = List.of(
                List.of(map("tag", "text", "text", "Content: " + v.get("post_content") + "\n")),
                List.of(map("tag", "text", "text", "Type: " + v.get("post_type") + "\n")),
                List.of(map("tag", "text", "text", "Published: " + v.get("published_at") + "\n")),
                List.of(map("tag", "text", "text", "Likes: " + v.get("likes") + ", Shares: " + v.get("shares")
                        + ", Comments: " + v.get("comments") + "\n")),
                List.of(map("tag", "a", "text", "View Post", "href", v.get("post_url"))));
        Map<String, Object> zhCn = map("title", heading(v), "content", rows);
        return map("msg_type", "post", "content", map("post", map("zh_cn", zhCn)));
    }

    private String wechatMarkdown(PostNotification n) {
        Map<String, String> v = templateRenderer.placeholders(n);
        return "## " + heading(v) + "\n\n"
                + "**Content:** " + v.get("post_content") + "\n\n"
                + "**Type:** " + v.get("post_type") + "\n\n"
                + "**Published:** " + v.get("published_at") + "\n\n"
                + "**Engagement:** " + engagement(v) + "\n\n"
                + "[View Post](" + v.get("post_url") + ")";
    }

    private String dingTalkMarkdown(PostNotification n) {
        Map<String, String> v = templateRenderer.placeholders(n);
        return "#### " + heading(v) + "\n\n"
                + "> **Content:** " + v.get("post_content") + "\n\n"
                + "> **Type:** " + v.get("post_type") + "\n\n"
                + "> **Published:** " + v.get("published_at") + "\n\n"
                + "> **Engagement:** " + engagement(v) + "\n\n"
                + "> [View Post](" + v.get("post_url") + ")";
    }

    private Map<String, Object> structured(PostNotification n) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("likes", n.getLikes() != null ? n.getLikes() : 0L);
        metadata.put("shares", n.getShares() != null ? n.getShares() : 0L);
        metadata.put("comments", n.getComments() != null ? n.getComments() : 0L);
        metadata.put("views", n.getViews() != null ? n.getViews() : 0L);

        Map<String, Object> post = new LinkedHashMap<>();
        post.put("id", n.getPostId());
        post.put("url", n.getPostUrl());
        post.put("type", n.getPostType() != null ? n.getPostType().code() : null);
        post.put("content", n.getContent());
        post.put("images", n.getImageUrls());
        post.put("videos", n.getVideoUrls());
        post.put("published_at", n.getPublishedAt() != null ? n.getPublishedAt().toString() : null);
        post.put("metadata", metadata);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("platform", n.getPlatform() != null ? n.getPlatform().getCode() : null);
        body.put("platform_label", n.getPlatform() != null ? n.getPlatform().getDisplayName() : null);
        body.put("user", map("username", n.getTargetUsername(), "display_name", n.getTargetDisplayName()));
        body.put("post", post);
        return body;
    }

    private static String heading(Map<String, String> v) {
        return v.get("target_display_name") + " (@" + v.get("target_username") + ") - " + v.get("platform_label");
    }

    private static String engagement(Map<String, String> v) {
        return "👍" + v.get("likes") + " 🔁" + v.get("shares") + " 💬" + v.get("comments");
    }

    // insertion-ordered, tolerates null values
    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
